package com.mk.fx.qa.load.generator.executors.paced;

import com.mk.fx.qa.load.generator.model.RequestOutcome;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one request attempt. Implementations must not block the calling thread while waiting for
 * the response and must produce exactly one outcome per invocation.
 */
@FunctionalInterface
public interface RequestExecutor {

  CompletableFuture<RequestOutcome> execute();
}
