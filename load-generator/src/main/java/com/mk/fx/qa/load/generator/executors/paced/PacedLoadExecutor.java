package com.mk.fx.qa.load.generator.executors.paced;

import static com.mk.fx.qa.load.generator.utils.LoadUtils.describeFailure;
import static com.mk.fx.qa.load.generator.utils.LoadUtils.expectedRequests;
import static com.mk.fx.qa.load.generator.utils.LoadUtils.intervalNanos;

import com.mk.fx.qa.load.generator.model.ConcurrencyMode;
import com.mk.fx.qa.load.generator.model.RequestOutcome;
import com.mk.fx.qa.load.generator.model.RunResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Dispatches {@code floor(qps * duration)} request attempts from a single driver thread, sleeping
 * {@code 1 / qps} after every dispatch and never letting more than {@code concurrency} attempts
 * stay incomplete.
 *
 * <p>Attempts run asynchronously; each one hands its {@link RequestOutcome} back through its
 * future and the driver is the only writer of the collected outcomes. The pacing delay does not
 * account for response time, so the achieved rate drops once responses take longer than {@code
 * concurrency / qps}.
 *
 * <p>There is no run-level timeout: an attempt that never completes holds the driver at the
 * concurrency barrier. Use a request timeout on the transport to bound it.
 */
@Slf4j
public final class PacedLoadExecutor {

  private PacedLoadExecutor() {
    throw new UnsupportedOperationException("PacedLoadExecutor cannot be instantiated");
  }

  /**
   * Runs the paced load to completion or cancellation. Per-request failures, including an executor
   * that throws, become {@link RequestOutcome#exception(String) exception outcomes}.
   *
   * @param parameters rate, duration and concurrency bound
   * @param cancellationRequested polled before every dispatch; when true, dispatching stops and
   *     in-flight attempts are still awaited
   * @param requestExecutor issues one attempt per call
   * @return one outcome per dispatched attempt
   */
  public static RunResult execute(
      PacedLoadParameters parameters,
      BooleanSupplier cancellationRequested,
      RequestExecutor requestExecutor) {

    validateTask(parameters, cancellationRequested, requestExecutor);

    long total = expectedRequests(parameters.qps(), parameters.duration());
    if (total == 0) {
      log.info(
          "No requests to dispatch: qps={} duration={}", parameters.qps(), parameters.duration());
      return RunResult.empty();
    }

    int concurrency = parameters.concurrency();
    long intervalNanos = intervalNanos(parameters.qps());
    ConcurrencyMode mode = parameters.mode() != null ? parameters.mode() : ConcurrencyMode.BATCH;
    log.debug(
        "Paced load starting: requests={} qps={} concurrency={} mode={}",
        total,
        parameters.qps(),
        concurrency,
        mode);

    List<CompletableFuture<RequestOutcome>> dispatched =
        new ArrayList<>((int) Math.min(total, 1 << 16));
    List<CompletableFuture<RequestOutcome>> batch = new ArrayList<>(concurrency);
    Semaphore permits = new Semaphore(concurrency);
    boolean cancelled = false;
    long startNanos = System.nanoTime();

    try {
      for (long i = 0; i < total; i++) {
        if (shouldStop(cancellationRequested)) {
          cancelled = true;
          break;
        }

        CompletableFuture<RequestOutcome> attempt;
        if (mode == ConcurrencyMode.WINDOW) {
          permits.acquire();
          attempt = launch(requestExecutor);
          attempt.whenComplete((outcome, error) -> permits.release());
        } else {
          if (batch.size() >= concurrency) {
            awaitAll(batch);
            batch.clear();
          }
          attempt = launch(requestExecutor);
          batch.add(attempt);
        }
        dispatched.add(attempt);

        TimeUnit.NANOSECONDS.sleep(intervalNanos);
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      cancelled = true;
      log.warn("Paced load interrupted after {} of {} dispatches", dispatched.size(), total);
    }

    awaitAll(dispatched);

    List<RequestOutcome> outcomes = new ArrayList<>(dispatched.size());
    for (CompletableFuture<RequestOutcome> attempt : dispatched) {
      outcomes.add(attempt.join());
    }

    double elapsedSec = Math.max(1e-9, (System.nanoTime() - startNanos) / 1_000_000_000.0);
    log.info(
        "Paced load completed: dispatched={}/{} achievedQps={} cancelled={} mode={}",
        outcomes.size(),
        total,
        String.format("%.2f", outcomes.size() / elapsedSec),
        cancelled,
        mode);

    return new RunResult(outcomes, total, cancelled);
  }

  private static void validateTask(
      PacedLoadParameters parameters,
      BooleanSupplier cancellationRequested,
      RequestExecutor requestExecutor) {
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");
    Objects.requireNonNull(requestExecutor, "requestExecutor");
    if (!(parameters.qps() > 0.0) || Double.isInfinite(parameters.qps())) {
      throw new IllegalArgumentException("qps must be a finite value > 0: " + parameters.qps());
    }
    if (parameters.concurrency() < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1: " + parameters.concurrency());
    }
    if (parameters.duration() == null
        || parameters.duration().isZero()
        || parameters.duration().isNegative()) {
      throw new IllegalArgumentException("duration must be > 0: " + parameters.duration());
    }
  }

  /** Starts one attempt; the returned future always completes normally with an outcome. */
  private static CompletableFuture<RequestOutcome> launch(RequestExecutor requestExecutor) {
    CompletableFuture<RequestOutcome> future;
    try {
      future = requestExecutor.execute();
    } catch (RuntimeException ex) {
      log.debug("Request executor failed before dispatch: {}", ex.getMessage());
      return CompletableFuture.completedFuture(RequestOutcome.exception(describeFailure(ex)));
    }
    if (future == null) {
      return CompletableFuture.completedFuture(
          RequestOutcome.exception("Request executor returned no result"));
    }
    return future.handle(
        (outcome, error) -> {
          if (error != null) {
            return RequestOutcome.exception(describeFailure(error));
          }
          return outcome != null
              ? outcome
              : RequestOutcome.exception("Request executor returned no result");
        });
  }

  private static void awaitAll(List<CompletableFuture<RequestOutcome>> attempts) {
    if (!attempts.isEmpty()) {
      CompletableFuture.allOf(attempts.toArray(new CompletableFuture[0])).join();
    }
  }

  private static boolean shouldStop(BooleanSupplier cancellationRequested) {
    return Thread.currentThread().isInterrupted() || cancellationRequested.getAsBoolean();
  }
}
