package com.mk.fx.qa.load.generator.model;

/** Classification of a single request attempt. */
public enum OutcomeType {
  /** The target answered with the success status; the latency is a sample. */
  SUCCESS,
  /** The target answered with any other status; the response body is kept for diagnostics. */
  ERROR_STATUS,
  /** No response was received; no latency is recorded. */
  EXCEPTION
}
