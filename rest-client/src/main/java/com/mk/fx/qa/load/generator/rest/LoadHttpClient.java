package com.mk.fx.qa.load.generator.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client for executing REST requests against a single target URL. Supports global headers,
 * JSON request bodies and timeout configuration. This implementation does not include retry logic
 * and does not interpret status codes: every response, successful or not, is returned as {@link
 * RestResponseData}.
 */
@Slf4j
public class LoadHttpClient implements AutoCloseable {

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers to be included in all requests. */
  private final Map<String, String> headers;

  /** Target of every request. */
  private final URI targetUri;

  /** Per-request timeout, or {@code null} to wait for a response indefinitely. */
  private final Duration requestTimeout;

  /**
   * Constructs a client without a per-request timeout.
   *
   * @param url the target URL
   * @param connectTimeout connection timeout
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(String url, Duration connectTimeout, Map<String, String> headers) {
    this(url, connectTimeout, null, headers);
  }

  /**
   * Constructs a client with a per-request timeout.
   *
   * @param url the target URL
   * @param connectTimeout connection timeout
   * @param requestTimeout per-request timeout, {@code null} or zero to disable
   * @param headers global headers to include in all requests
   */
  public LoadHttpClient(
      String url, Duration connectTimeout, Duration requestTimeout, Map<String, String> headers) {
    Objects.requireNonNull(connectTimeout, "Connect timeout cannot be null");
    this.targetUri = validateTargetUrl(url);
    this.requestTimeout =
        requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? null
            : requestTimeout;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    this.headers = headers != null ? Map.copyOf(headers) : Map.of();

    log.info(
        "LoadHttpClient initialised - URL: {}, Connection timeout: {}s, Request timeout: {}",
        targetUri,
        connectTimeout.toSeconds(),
        this.requestTimeout != null ? this.requestTimeout.toSeconds() + "s" : "none");
  }

  /**
   * Executes an asynchronous REST request. The calling thread is never blocked waiting for the
   * response.
   *
   * @param request the REST request to execute
   * @return a future completed with the response data, or completed exceptionally with the
   *     transport failure as its cause
   */
  public CompletableFuture<RestResponseData> executeAsync(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");

    var startTime = System.nanoTime();

    HttpRequest httpRequest;
    try {
      httpRequest = buildHttpRequest(request);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }

    log.debug("Executing async {} request to {}", request.getMethod(), httpRequest.uri());

    var headersReceivedAt = new AtomicLong();
    HttpResponse.BodyHandler<String> bodyHandler =
        responseInfo -> {
          headersReceivedAt.set(System.nanoTime());
          return HttpResponse.BodyHandlers.ofString().apply(responseInfo);
        };

    return httpClient
        .sendAsync(httpRequest, bodyHandler)
        .thenApply(
            response -> {
              var responseTime =
                  Duration.ofNanos(Math.max(0L, headersReceivedAt.get() - startTime));
              log.debug(
                  "Async request completed in {} ms with status {}",
                  responseTime.toMillis(),
                  response.statusCode());
              return buildResponseData(response, responseTime);
            });
  }

  /**
   * Builds an HTTP request from the given Request.
   *
   * @throws IllegalArgumentException if the body cannot be serialised
   */
  private HttpRequest buildHttpRequest(Request request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    var requestBuilder = HttpRequest.newBuilder().uri(targetUri);
    if (requestTimeout != null) {
      requestBuilder.timeout(requestTimeout);
    }

    // global headers
    headers.forEach(requestBuilder::header);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    if (request.getBody() != null) {
      try {
        var jsonBody = JsonUtil.toJson(request.getBody());
        requestBuilder
            .method(request.getMethod().name(), HttpRequest.BodyPublishers.ofString(jsonBody))
            .setHeader("Content-Type", "application/json");
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException(
            "Failed to serialize request body: " + e.getOriginalMessage(), e);
      }
    } else {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    }

    return requestBuilder.build();
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, Duration responseTime) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    result.setBody(response.body());
    result.setResponseTime(responseTime);
    return result;
  }

  /**
   * Validates the target URL.
   *
   * @throws IllegalArgumentException if the URL is empty or not an absolute http(s) URL
   */
  private static URI validateTargetUrl(String url) {
    Objects.requireNonNull(url, "URL cannot be null");
    var trimmed = url.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("URL cannot be empty");
    }
    URI uri;
    try {
      uri = URI.create(trimmed);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed URL: " + trimmed, e);
    }
    if (uri.getScheme() == null
        || !(uri.getScheme().equalsIgnoreCase("http") || uri.getScheme().equalsIgnoreCase("https"))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("URL must be an absolute http(s) URL: " + trimmed);
    }
    return uri;
  }

  @Override
  public void close() {
    log.debug("LoadHttpClient for {} closed", targetUri);
  }
}
