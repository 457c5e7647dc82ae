package com.mk.fx.qa.load.generator.utils;

import com.google.common.base.Throwables;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

public final class LoadUtils {

  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /** Number of attempts a run issues: {@code floor(qps * duration)}. */
  public static long expectedRequests(double qps, Duration duration) {
    if (qps <= 0.0 || duration == null || duration.isZero() || duration.isNegative()) {
      return 0L;
    }
    return Math.max(0L, (long) Math.floor(qps * toSeconds(duration)));
  }

  /** Fixed delay between successive dispatches, {@code 1 / qps}. */
  public static long intervalNanos(double qps) {
    if (qps <= 0.0) {
      throw new IllegalArgumentException("qps must be > 0");
    }
    return (long) Math.max(1, NANOS_PER_SECOND / qps);
  }

  public static double toSeconds(Duration duration) {
    return duration.toNanos() / NANOS_PER_SECOND;
  }

  /** Rounds half-even on the exact binary value of {@code value}. */
  public static double round(double value, int scale) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
  }

  /**
   * Human readable description of a transport failure, taken from the root cause: {@code
   * "ConnectException: Connection refused"}, or just the class name when the cause has no message.
   */
  public static String describeFailure(Throwable failure) {
    if (failure == null) {
      return "Unknown error";
    }
    Throwable rootCause = Throwables.getRootCause(failure);
    String name = rootCause.getClass().getSimpleName();
    String msg = rootCause.getMessage();
    if (msg == null || msg.isBlank() || msg.equals("null")) {
      return name.isBlank() ? rootCause.getClass().getName() : name;
    }
    return name + ": " + msg;
  }
}
