package com.mk.fx.qa.load.generator.cli;

import com.mk.fx.qa.load.generator.cfg.JsonArguments;
import com.mk.fx.qa.load.generator.cfg.LoadTestConfig;
import com.mk.fx.qa.load.generator.model.ConcurrencyMode;
import com.mk.fx.qa.load.generator.rest.HttpMethod;
import com.mk.fx.qa.load.generator.service.LoadTestRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Slf4j
@Command(
    name = "load-generator",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    description = "Rate-controlled HTTP load generator.")
public class LoadGeneratorCommand implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_REPORT_FAILED = 1;

  private static final long SHUTDOWN_GRACE_SECONDS = 30;

  @Spec CommandSpec spec;

  @Parameters(index = "0", paramLabel = "URL", description = "URL to load test")
  String url;

  @Option(names = "--qps", defaultValue = "1", description = "Queries per second")
  double qps;

  @Option(names = "--duration", defaultValue = "10", description = "Duration of the test in seconds")
  int durationSeconds;

  @Option(names = "--method", defaultValue = "GET", description = "HTTP method to use")
  String method;

  @Option(names = "--headers", defaultValue = "{}", description = "HTTP headers as JSON object")
  String headersJson;

  @Option(names = "--payload", defaultValue = "{}", description = "HTTP payload as JSON object")
  String payloadJson;

  @Option(
      names = "--output",
      defaultValue = "results.json",
      description = "Output file for results")
  Path output;

  @Option(
      names = "--concurrency",
      defaultValue = "1",
      description = "Maximum number of requests in flight")
  int concurrency;

  @Option(
      names = "--concurrency-mode",
      defaultValue = "BATCH",
      description = "BATCH waits for the whole in-flight batch, WINDOW refills each free slot")
  ConcurrencyMode concurrencyMode;

  @Option(
      names = "--timeout",
      defaultValue = "300",
      description = "Per-request timeout in seconds, 0 waits indefinitely")
  int timeoutSeconds;

  @Option(
      names = "--connect-timeout",
      defaultValue = "5",
      description = "Connection timeout in seconds")
  int connectTimeoutSeconds;

  private final LoadTestRunner runner;

  public LoadGeneratorCommand() {
    this(new LoadTestRunner());
  }

  LoadGeneratorCommand(LoadTestRunner runner) {
    this.runner = runner;
  }

  public static void main(String[] args) {
    System.exit(new CommandLine(new LoadGeneratorCommand()).execute(args));
  }

  @Override
  public Integer call() {
    LoadTestConfig config;
    try {
      config = buildConfig();
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
    }

    AtomicBoolean cancelled = new AtomicBoolean(false);
    CountDownLatch finished = new CountDownLatch(1);
    Thread shutdownHook = cancellationHook(cancelled, finished);
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    try {
      runner.run(config, cancelled::get);
      return EXIT_OK;
    } catch (IOException e) {
      log.error("Failed to write results to {}: {}", config.getOutput(), e.getMessage(), e);
      return EXIT_REPORT_FAILED;
    } finally {
      finished.countDown();
      removeShutdownHook(shutdownHook);
    }
  }

  LoadTestConfig buildConfig() {
    return LoadTestConfig.builder()
        .url(url)
        .method(HttpMethod.from(method))
        .headers(JsonArguments.parseHeaders(headersJson, "--headers"))
        .payload(JsonArguments.parsePayload(payloadJson, "--payload"))
        .qps(qps)
        .duration(Duration.ofSeconds(durationSeconds))
        .concurrency(concurrency)
        .concurrencyMode(concurrencyMode)
        .requestTimeout(Duration.ofSeconds(timeoutSeconds))
        .connectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
        .output(output)
        .build()
        .validate();
  }

  /**
   * Hook that requests cancellation, then holds JVM shutdown until the run has written its report
   * or the grace period expires.
   */
  static Thread cancellationHook(AtomicBoolean cancelled, CountDownLatch finished) {
    return new Thread(
        () -> {
          cancelled.set(true);
          try {
            finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
        },
        "load-generator-shutdown");
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException e) {
      log.debug("JVM shutdown in progress, keeping shutdown hook: {}", e.getMessage());
    }
  }
}
