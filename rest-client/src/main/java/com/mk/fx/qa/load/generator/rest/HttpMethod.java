package com.mk.fx.qa.load.generator.rest;

import java.util.Locale;

/** HTTP methods supported by {@link LoadHttpClient}. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  PATCH,
  DELETE,
  HEAD,
  OPTIONS;

  /**
   * Resolves a method name case-insensitively.
   *
   * @param value the method name, e.g. {@code "get"}
   * @return the matching method
   * @throws IllegalArgumentException if the value is blank or not a supported method
   */
  public static HttpMethod from(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("HTTP method is required");
    }
    try {
      return HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported HTTP method: " + value, ex);
    }
  }
}
