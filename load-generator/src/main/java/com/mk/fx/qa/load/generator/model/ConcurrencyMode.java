package com.mk.fx.qa.load.generator.model;

/** How the driver bounds the number of attempts in flight. */
public enum ConcurrencyMode {
  /**
   * Launch attempts into a batch; once the batch is full, wait for every attempt in it before
   * launching the next one.
   */
  BATCH,
  /** Hold one permit per in-flight attempt and launch again as soon as any attempt completes. */
  WINDOW
}
