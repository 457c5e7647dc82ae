package com.mk.fx.qa.load.generator.executors.paced;

import com.mk.fx.qa.load.generator.model.ConcurrencyMode;
import java.time.Duration;

/**
 * Parameters for a paced load run.
 *
 * @param qps target dispatch rate per second
 * @param concurrency maximum number of attempts in flight
 * @param duration nominal run length
 * @param mode how the in-flight bound is enforced
 */
public record PacedLoadParameters(
    double qps, int concurrency, Duration duration, ConcurrencyMode mode) {

  public PacedLoadParameters(double qps, int concurrency, Duration duration) {
    this(qps, concurrency, duration, ConcurrencyMode.BATCH);
  }
}
