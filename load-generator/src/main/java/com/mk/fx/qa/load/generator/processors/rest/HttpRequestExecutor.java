package com.mk.fx.qa.load.generator.processors.rest;

import static com.mk.fx.qa.load.generator.utils.LoadUtils.describeFailure;

import com.mk.fx.qa.load.generator.executors.paced.RequestExecutor;
import com.mk.fx.qa.load.generator.model.RequestOutcome;
import com.mk.fx.qa.load.generator.rest.LoadHttpClient;
import com.mk.fx.qa.load.generator.rest.Request;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends one prepared request per invocation and classifies the result. Only {@value
 * #SUCCESS_STATUS} counts as success; any other status keeps the response body, and a transport
 * failure yields an outcome without latency. Latency is the client's time to response headers.
 */
@Slf4j
public class HttpRequestExecutor implements RequestExecutor {

  public static final int SUCCESS_STATUS = 200;

  private final LoadHttpClient client;
  private final Request request;

  public HttpRequestExecutor(LoadHttpClient client, Request request) {
    this.client = Objects.requireNonNull(client, "client");
    this.request = Objects.requireNonNull(request, "request");
  }

  @Override
  public CompletableFuture<RequestOutcome> execute() {
    return client
        .executeAsync(request)
        .handle(
            (response, error) -> {
              if (error != null) {
                String description = describeFailure(error);
                log.debug("Request failed: {}", description);
                return RequestOutcome.exception(description);
              }
              Duration latency = response.getResponseTime();
              int status = response.getStatusCode();
              if (status == SUCCESS_STATUS) {
                return RequestOutcome.success(latency, status);
              }
              log.debug("Request returned status {} after {} ms", status, latency.toMillis());
              return RequestOutcome.errorStatus(latency, status, response.getBody());
            });
  }
}
