package com.mk.fx.qa.load.generator.metrics;

import static com.mk.fx.qa.load.generator.utils.LoadUtils.round;

import com.mk.fx.qa.load.generator.dto.SummaryReport;
import com.mk.fx.qa.load.generator.model.RequestOutcome;
import com.mk.fx.qa.load.generator.model.RunResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Reduces the outcomes of a run into a {@link SummaryReport}. */
public final class SummaryAggregator {

  static final int DECIMALS = 4;

  public SummaryReport aggregate(RunResult result) {
    Objects.requireNonNull(result, "result");

    List<Double> latencies = new ArrayList<>();
    Map<String, List<String>> detailedErrors = new LinkedHashMap<>();
    long failures = 0;

    for (RequestOutcome outcome : result.outcomes()) {
      switch (outcome.type()) {
        case SUCCESS -> latencies.add(outcome.latencySeconds());
        case ERROR_STATUS -> {
          failures++;
          detailedErrors
              .computeIfAbsent(String.valueOf(outcome.statusCode()), k -> new ArrayList<>())
              .add(outcome.detail());
        }
        case EXCEPTION -> {
          failures++;
          detailedErrors
              .computeIfAbsent(SummaryReport.EXCEPTIONS_CATEGORY, k -> new ArrayList<>())
              .add(outcome.detail());
        }
        default -> throw new IllegalStateException("Unhandled outcome type: " + outcome.type());
      }
    }

    var builder =
        SummaryReport.builder()
            .totalRequests(latencies.size() + failures)
            .successfulRequests(latencies.size())
            .failedRequests(failures)
            .detailedErrors(detailedErrors);

    if (latencies.isEmpty()) {
      return builder.message(SummaryReport.NO_SUCCESS_MESSAGE).build();
    }

    double[] sorted =
        LatencyStatistics.sortedCopy(latencies.stream().mapToDouble(Double::doubleValue).toArray());
    return builder
        .meanLatency(round(LatencyStatistics.mean(sorted), DECIMALS))
        .medianLatency(round(LatencyStatistics.median(sorted), DECIMALS))
        .stddevLatency(round(LatencyStatistics.sampleStdDev(sorted), DECIMALS))
        .maxLatency(round(sorted[sorted.length - 1], DECIMALS))
        .minLatency(round(sorted[0], DECIMALS))
        .p90Latency(round(LatencyStatistics.percentile(sorted, LatencyStatistics.P90), DECIMALS))
        .build();
  }
}
