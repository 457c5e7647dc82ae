package com.mk.fx.qa.load.generator.executors.paced;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.load.generator.model.ConcurrencyMode;
import com.mk.fx.qa.load.generator.model.OutcomeType;
import com.mk.fx.qa.load.generator.model.RequestOutcome;
import com.mk.fx.qa.load.generator.model.RunResult;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class PacedLoadExecutorTest {

  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    pool.shutdownNow();
    pool.awaitTermination(5, TimeUnit.SECONDS);
  }

  private static PacedLoadParameters params(double qps, int concurrency, Duration duration) {
    return new PacedLoadParameters(qps, concurrency, duration);
  }

  private static BooleanSupplier neverCancel() {
    return () -> false;
  }

  private static RequestExecutor instantSuccess(AtomicInteger calls) {
    return () -> {
      calls.incrementAndGet();
      return CompletableFuture.completedFuture(RequestOutcome.success(Duration.ofMillis(1), 200));
    };
  }

  /** Attempts that take {@code delayMs} on the pool and record the peak number in flight. */
  private RequestExecutor slowSuccess(AtomicInteger current, AtomicInteger peak, long delayMs) {
    return () -> {
      int now = current.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      return CompletableFuture.supplyAsync(
          () -> {
            try {
              TimeUnit.MILLISECONDS.sleep(delayMs);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              current.decrementAndGet();
            }
            return RequestOutcome.success(Duration.ofMillis(delayMs), 200);
          },
          pool);
    };
  }

  @Test
  void dispatchesExactlyFloorOfQpsTimesDuration() {
    AtomicInteger calls = new AtomicInteger();
    var params = new PacedLoadParameters(50.0, 5, Duration.ofMillis(200));

    RunResult result = PacedLoadExecutor.execute(params, neverCancel(), instantSuccess(calls));

    assertEquals(10, calls.get());
    assertEquals(10, result.size());
    assertEquals(10, result.expectedRequests());
    assertFalse(result.cancelled());
  }

  @Test
  void fractionalProductIsFloored() {
    AtomicInteger calls = new AtomicInteger();
    var params = new PacedLoadParameters(7.5, 2, Duration.ofMillis(500));

    RunResult result = PacedLoadExecutor.execute(params, neverCancel(), instantSuccess(calls));

    assertEquals(3, calls.get());
    assertEquals(3, result.size());
  }

  @Test
  void zeroExpectedRequests_returnsEmptyResultWithoutCallingExecutor() {
    AtomicInteger calls = new AtomicInteger();
    var params = new PacedLoadParameters(0.001, 1, Duration.ofSeconds(1));

    RunResult result = PacedLoadExecutor.execute(params, neverCancel(), instantSuccess(calls));

    assertEquals(0, calls.get());
    assertEquals(0, result.size());
    assertEquals(0, result.expectedRequests());
  }

  @Test
  void pacesDispatchesByOneOverQps() {
    AtomicInteger calls = new AtomicInteger();
    var params = new PacedLoadParameters(20.0, 10, Duration.ofMillis(500));

    long start = System.nanoTime();
    PacedLoadExecutor.execute(params, neverCancel(), instantSuccess(calls));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(10, calls.get());
    assertTrue(elapsedMs >= 450, "Run finished too early: " + elapsedMs + "ms");
  }

  @ParameterizedTest
  @EnumSource(ConcurrencyMode.class)
  void neverExceedsConcurrency(ConcurrencyMode mode) {
    AtomicInteger current = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    var params = new PacedLoadParameters(150.0, 3, Duration.ofMillis(200), mode);

    RunResult result =
        PacedLoadExecutor.execute(params, neverCancel(), slowSuccess(current, peak, 20));

    assertEquals(30, result.size());
    assertTrue(peak.get() <= 3, "Peak concurrency " + peak.get() + " exceeded 3 in " + mode);
    assertEquals(0, current.get());
    assertTrue(result.outcomes().stream().allMatch(RequestOutcome::isSuccess));
  }

  @Test
  void batchMode_waitsForWholeBatchBeforeNextLaunch() {
    AtomicInteger current = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    var params = new PacedLoadParameters(1000.0, 2, Duration.ofMillis(6));

    long start = System.nanoTime();
    RunResult result =
        PacedLoadExecutor.execute(params, neverCancel(), slowSuccess(current, peak, 100));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(6, result.size());
    assertEquals(2, peak.get());
    // three batches of two, each held for the slowest attempt
    assertTrue(elapsedMs >= 300, "Batches overlapped: " + elapsedMs + "ms");
  }

  @Test
  void executorFailuresBecomeExceptionOutcomes() {
    AtomicInteger calls = new AtomicInteger();
    RequestExecutor flaky =
        () -> {
          int n = calls.incrementAndGet();
          if (n % 3 == 0) {
            throw new IllegalStateException("boom");
          }
          if (n % 3 == 1) {
            return CompletableFuture.failedFuture(new java.net.ConnectException("refused"));
          }
          return null;
        };
    var params = new PacedLoadParameters(100.0, 2, Duration.ofMillis(90));

    RunResult result =
        assertDoesNotThrow(() -> PacedLoadExecutor.execute(params, neverCancel(), flaky));

    assertEquals(9, result.size());
    assertTrue(result.outcomes().stream().allMatch(o -> o.type() == OutcomeType.EXCEPTION));
    assertTrue(
        result.outcomes().stream().anyMatch(o -> o.detail().equals("ConnectException: refused")));
    assertTrue(
        result.outcomes().stream().anyMatch(o -> o.detail().equals("IllegalStateException: boom")));
  }

  @Test
  void cancellationStopsDispatching_andKeepsDispatchedOutcomes() {
    AtomicInteger calls = new AtomicInteger();
    var params = new PacedLoadParameters(100.0, 2, Duration.ofSeconds(2));

    RunResult result =
        PacedLoadExecutor.execute(params, () -> calls.get() >= 4, instantSuccess(calls));

    assertTrue(result.cancelled());
    assertEquals(4, result.size());
    assertEquals(200, result.expectedRequests());
  }

  @Test
  void interruptStopsDispatching_awaitsInFlightAndRestoresFlag() throws InterruptedException {
    AtomicInteger calls = new AtomicInteger();
    AtomicInteger current = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    RequestExecutor counted =
        () -> {
          calls.incrementAndGet();
          return slowSuccess(current, peak, 50).execute();
        };
    AtomicReference<RunResult> result = new AtomicReference<>();
    AtomicBoolean interruptFlag = new AtomicBoolean();

    Thread driver =
        new Thread(
            () -> {
              result.set(
                  PacedLoadExecutor.execute(
                      new PacedLoadParameters(20.0, 2, Duration.ofSeconds(10)),
                      neverCancel(),
                      counted));
              interruptFlag.set(Thread.currentThread().isInterrupted());
            },
            "paced-driver");
    driver.start();
    TimeUnit.MILLISECONDS.sleep(300);
    driver.interrupt();
    driver.join(TimeUnit.SECONDS.toMillis(5));

    assertFalse(driver.isAlive());
    RunResult run = result.get();
    assertNotNull(run);
    assertTrue(run.cancelled());
    assertEquals(200, run.expectedRequests());
    assertTrue(run.size() < run.expectedRequests());
    assertEquals(calls.get(), run.size());
    assertTrue(run.outcomes().stream().allMatch(RequestOutcome::isSuccess));
    assertEquals(0, current.get());
    assertTrue(interruptFlag.get());
  }

  @Test
  void validateTask_rejectsInvalidInputs() {
    var ok = new PacedLoadParameters(1.0, 1, Duration.ofSeconds(1));
    RequestExecutor noop = () -> CompletableFuture.completedFuture(RequestOutcome.exception("x"));

    assertThrows(
        NullPointerException.class, () -> PacedLoadExecutor.execute(null, () -> false, noop));
    assertThrows(NullPointerException.class, () -> PacedLoadExecutor.execute(ok, null, noop));
    assertThrows(
        NullPointerException.class, () -> PacedLoadExecutor.execute(ok, () -> false, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> PacedLoadExecutor.execute(params(0.0, 1, Duration.ofSeconds(1)), () -> false, noop));
    assertThrows(
        IllegalArgumentException.class,
        () -> PacedLoadExecutor.execute(params(1.0, 0, Duration.ofSeconds(1)), () -> false, noop));
    assertThrows(
        IllegalArgumentException.class,
        () -> PacedLoadExecutor.execute(params(1.0, 1, Duration.ZERO), () -> false, noop));
  }
}
