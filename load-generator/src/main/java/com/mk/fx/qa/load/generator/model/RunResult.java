package com.mk.fx.qa.load.generator.model;

import java.util.List;

/**
 * Every outcome collected during one run.
 *
 * @param outcomes one outcome per dispatched attempt; order is not significant
 * @param expectedRequests nominal number of attempts, {@code floor(qps * duration)}
 * @param cancelled true if dispatching stopped before all expected attempts were issued
 */
public record RunResult(List<RequestOutcome> outcomes, long expectedRequests, boolean cancelled) {

  public RunResult {
    outcomes = List.copyOf(outcomes);
    if (expectedRequests < 0) {
      throw new IllegalArgumentException("expectedRequests must be >= 0");
    }
    if (outcomes.size() > expectedRequests) {
      throw new IllegalArgumentException(
          "More outcomes (" + outcomes.size() + ") than expected requests (" + expectedRequests + ")");
    }
  }

  public static RunResult empty() {
    return new RunResult(List.of(), 0, false);
  }

  public int size() {
    return outcomes.size();
  }
}
