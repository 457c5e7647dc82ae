package com.mk.fx.qa.load.generator.service;

import com.mk.fx.qa.load.generator.cfg.LoadTestConfig;
import com.mk.fx.qa.load.generator.dto.SummaryReport;
import com.mk.fx.qa.load.generator.executors.paced.PacedLoadExecutor;
import com.mk.fx.qa.load.generator.metrics.SummaryAggregator;
import com.mk.fx.qa.load.generator.model.RunResult;
import com.mk.fx.qa.load.generator.processors.rest.HttpRequestExecutor;
import com.mk.fx.qa.load.generator.report.JsonReportWriter;
import com.mk.fx.qa.load.generator.rest.LoadHttpClient;
import java.io.IOException;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/** Runs one load test end to end: dispatch, aggregate, write the report. */
@Slf4j
public class LoadTestRunner {

  private final SummaryAggregator aggregator;
  private final JsonReportWriter reportWriter;

  public LoadTestRunner() {
    this(new SummaryAggregator(), new JsonReportWriter());
  }

  public LoadTestRunner(SummaryAggregator aggregator, JsonReportWriter reportWriter) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
  }

  /**
   * Runs the configured load and writes the summary to {@link LoadTestConfig#getOutput()}.
   *
   * @param config validated before anything is sent
   * @param cancellationRequested stops dispatching when it turns true
   * @return the written report
   * @throws IllegalArgumentException if the configuration is invalid
   * @throws IOException if the report cannot be written
   */
  public SummaryReport run(LoadTestConfig config, BooleanSupplier cancellationRequested)
      throws IOException {
    Objects.requireNonNull(config, "config").validate();

    RunResult result = dispatch(config, cancellationRequested);
    SummaryReport report = aggregator.aggregate(result);
    log.info(
        "Summary: total={} successful={} failed={}",
        report.getTotalRequests(),
        report.getSuccessfulRequests(),
        report.getFailedRequests());

    reportWriter.write(report, config.getOutput());
    return report;
  }

  RunResult dispatch(LoadTestConfig config, BooleanSupplier cancellationRequested) {
    log.info(
        "Starting the load test for {} with a QPS of {} for {} secs.",
        config.getUrl(),
        config.getQps(),
        config.getDuration().toSeconds());

    RunResult result;
    try (LoadHttpClient client =
        new LoadHttpClient(
            config.getUrl(),
            config.getConnectTimeout(),
            config.getRequestTimeout(),
            config.getHeaders())) {
      var executor = new HttpRequestExecutor(client, config.toRequest());
      result = PacedLoadExecutor.execute(config.toParameters(), cancellationRequested, executor);
    }

    if (result.cancelled()) {
      log.warn(
          "Test cancelled after {} of {} requests.", result.size(), result.expectedRequests());
    } else {
      log.info("Test complete.");
    }
    return result;
  }
}
