package com.mk.fx.qa.load.generator.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable result of one request attempt.
 *
 * @param type outcome classification
 * @param latency elapsed time from dispatch to response, {@code null} for {@link
 *     OutcomeType#EXCEPTION}
 * @param statusCode HTTP status code, {@code null} for {@link OutcomeType#EXCEPTION}
 * @param detail response body for {@link OutcomeType#ERROR_STATUS}, failure description for
 *     {@link OutcomeType#EXCEPTION}, {@code null} for {@link OutcomeType#SUCCESS}
 */
public record RequestOutcome(
    OutcomeType type, Duration latency, Integer statusCode, String detail) {

  public RequestOutcome {
    Objects.requireNonNull(type, "type");
    if (type == OutcomeType.EXCEPTION) {
      if (latency != null || statusCode != null) {
        throw new IllegalArgumentException("Exception outcomes carry no latency or status");
      }
      detail = detail != null ? detail : "";
    } else {
      Objects.requireNonNull(latency, "latency");
      Objects.requireNonNull(statusCode, "statusCode");
      if (latency.isNegative()) {
        throw new IllegalArgumentException("Latency must not be negative: " + latency);
      }
      if (type == OutcomeType.ERROR_STATUS) {
        detail = detail != null ? detail : "";
      }
    }
  }

  public static RequestOutcome success(Duration latency, int statusCode) {
    return new RequestOutcome(OutcomeType.SUCCESS, latency, statusCode, null);
  }

  public static RequestOutcome errorStatus(Duration latency, int statusCode, String body) {
    return new RequestOutcome(OutcomeType.ERROR_STATUS, latency, statusCode, body);
  }

  public static RequestOutcome exception(String message) {
    return new RequestOutcome(OutcomeType.EXCEPTION, null, null, message);
  }

  public boolean isSuccess() {
    return type == OutcomeType.SUCCESS;
  }

  /** Latency in fractional seconds; only defined when a response was received. */
  public double latencySeconds() {
    if (latency == null) {
      throw new IllegalStateException("No latency recorded for " + type + " outcome");
    }
    return latency.toNanos() / 1_000_000_000.0;
  }
}
