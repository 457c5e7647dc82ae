package com.mk.fx.qa.load.generator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of one run. Latency statistics are in seconds and present only when at least one
 * request succeeded; otherwise {@link #message} explains why they are missing.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "total_requests",
  "successful_requests",
  "failed_requests",
  "mean_latency",
  "median_latency",
  "stddev_latency",
  "max_latency",
  "min_latency",
  "90th_percentile_latency",
  "message",
  "detailed_errors"
})
public class SummaryReport {

  public static final String NO_SUCCESS_MESSAGE = "No successful requests.";
  public static final String EXCEPTIONS_CATEGORY = "exceptions";

  @JsonProperty("total_requests")
  long totalRequests;

  @JsonProperty("successful_requests")
  long successfulRequests;

  @JsonProperty("failed_requests")
  long failedRequests;

  @JsonProperty("mean_latency")
  Double meanLatency;

  @JsonProperty("median_latency")
  Double medianLatency;

  @JsonProperty("stddev_latency")
  Double stddevLatency;

  @JsonProperty("max_latency")
  Double maxLatency;

  @JsonProperty("min_latency")
  Double minLatency;

  @JsonProperty("90th_percentile_latency")
  Double p90Latency;

  @JsonProperty("message")
  String message;

  /** Status code (as text) or {@value #EXCEPTIONS_CATEGORY} to the diagnostics recorded for it. */
  @JsonProperty("detailed_errors")
  Map<String, List<String>> detailedErrors;

  @Builder
  private SummaryReport(
      long totalRequests,
      long successfulRequests,
      long failedRequests,
      Double meanLatency,
      Double medianLatency,
      Double stddevLatency,
      Double maxLatency,
      Double minLatency,
      Double p90Latency,
      String message,
      Map<String, List<String>> detailedErrors) {
    this.totalRequests = totalRequests;
    this.successfulRequests = successfulRequests;
    this.failedRequests = failedRequests;
    this.meanLatency = meanLatency;
    this.medianLatency = medianLatency;
    this.stddevLatency = stddevLatency;
    this.maxLatency = maxLatency;
    this.minLatency = minLatency;
    this.p90Latency = p90Latency;
    this.message = message;
    this.detailedErrors = detailedErrors == null ? null : copyOf(detailedErrors);
  }

  /** Immutable copy that keeps category order. */
  private static Map<String, List<String>> copyOf(Map<String, List<String>> errors) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    errors.forEach((category, entries) -> copy.put(category, List.copyOf(entries)));
    return Collections.unmodifiableMap(copy);
  }

  public boolean hasLatencyStatistics() {
    return meanLatency != null;
  }
}
