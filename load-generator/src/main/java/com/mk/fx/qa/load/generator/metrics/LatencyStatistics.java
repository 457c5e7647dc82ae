package com.mk.fx.qa.load.generator.metrics;

import java.util.Arrays;

/**
 * Descriptive statistics over latency samples. Every method takes the samples sorted ascending and
 * requires at least one of them.
 */
final class LatencyStatistics {

  static final double P90 = 0.9;

  private LatencyStatistics() {}

  static double mean(double[] sorted) {
    requireSamples(sorted);
    double sum = 0.0;
    for (double v : sorted) {
      sum += v;
    }
    return sum / sorted.length;
  }

  static double median(double[] sorted) {
    requireSamples(sorted);
    int n = sorted.length;
    int mid = n / 2;
    return n % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  /** Sample standard deviation (n - 1 divisor); 0.0 for a single sample. */
  static double sampleStdDev(double[] sorted) {
    requireSamples(sorted);
    int n = sorted.length;
    if (n < 2) {
      return 0.0;
    }
    double mean = mean(sorted);
    double squares = 0.0;
    for (double v : sorted) {
      double d = v - mean;
      squares += d * d;
    }
    return Math.sqrt(squares / (n - 1));
  }

  /**
   * Nearest-rank percentile without interpolation: the sample at index {@code floor(fraction *
   * n)}, clamped to the last index.
   */
  static double percentile(double[] sorted, double fraction) {
    requireSamples(sorted);
    if (fraction < 0.0 || fraction > 1.0) {
      throw new IllegalArgumentException("Percentile fraction must be between 0 and 1");
    }
    int idx = (int) Math.floor(sorted.length * fraction);
    return sorted[Math.min(sorted.length - 1, idx)];
  }

  static double[] sortedCopy(double[] samples) {
    double[] copy = Arrays.copyOf(samples, samples.length);
    Arrays.sort(copy);
    return copy;
  }

  private static void requireSamples(double[] sorted) {
    if (sorted == null || sorted.length == 0) {
      throw new IllegalArgumentException("At least one latency sample is required");
    }
  }
}
