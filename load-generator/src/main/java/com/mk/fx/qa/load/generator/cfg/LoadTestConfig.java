package com.mk.fx.qa.load.generator.cfg;

import com.mk.fx.qa.load.generator.executors.paced.PacedLoadParameters;
import com.mk.fx.qa.load.generator.model.ConcurrencyMode;
import com.mk.fx.qa.load.generator.rest.HttpMethod;
import com.mk.fx.qa.load.generator.rest.Request;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Immutable configuration of one load test run. */
@Value
@Builder(toBuilder = true)
public class LoadTestConfig {

  public static final double DEFAULT_QPS = 1.0;
  public static final int DEFAULT_DURATION_SECONDS = 10;
  public static final int DEFAULT_CONCURRENCY = 1;
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final String DEFAULT_OUTPUT = "results.json";

  String url;

  @Builder.Default HttpMethod method = HttpMethod.GET;

  @Builder.Default Map<String, String> headers = Map.of();

  @Builder.Default Map<String, Object> payload = Map.of();

  @Builder.Default double qps = DEFAULT_QPS;

  @Builder.Default Duration duration = Duration.ofSeconds(DEFAULT_DURATION_SECONDS);

  @Builder.Default int concurrency = DEFAULT_CONCURRENCY;

  @Builder.Default ConcurrencyMode concurrencyMode = ConcurrencyMode.BATCH;

  /** Zero disables the per-request timeout. */
  @Builder.Default Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

  @Builder.Default Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

  @Builder.Default Path output = Path.of(DEFAULT_OUTPUT);

  /**
   * Checks every field a run depends on.
   *
   * @return this config
   * @throws IllegalArgumentException naming the first invalid field
   */
  public LoadTestConfig validate() {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("URL must be provided");
    }
    validateUrl(url.trim());
    if (method == null) {
      throw new IllegalArgumentException("HTTP method must be provided");
    }
    if (!(qps > 0.0) || Double.isInfinite(qps)) {
      throw new IllegalArgumentException("qps must be a finite value > 0, got " + qps);
    }
    if (duration == null || duration.isZero() || duration.isNegative()) {
      throw new IllegalArgumentException("duration must be > 0, got " + duration);
    }
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
    }
    if (requestTimeout == null || requestTimeout.isNegative()) {
      throw new IllegalArgumentException("request timeout must be >= 0, got " + requestTimeout);
    }
    if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connect timeout must be > 0, got " + connectTimeout);
    }
    if (output == null) {
      throw new IllegalArgumentException("output path must be provided");
    }
    return this;
  }

  private static void validateUrl(String value) {
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Malformed URL: " + value, e);
    }
    String scheme = uri.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("URL must be an absolute http(s) URL: " + value);
    }
  }

  public PacedLoadParameters toParameters() {
    return new PacedLoadParameters(qps, concurrency, duration, concurrencyMode);
  }

  /** The request sent on every attempt; the payload is always the JSON body, even {@code {}}. */
  public Request toRequest() {
    var request = new Request();
    request.setMethod(method);
    request.setBody(payload != null ? payload : Map.of());
    return request;
  }
}
