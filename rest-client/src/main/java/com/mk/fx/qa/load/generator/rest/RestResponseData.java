package com.mk.fx.qa.load.generator.rest;

import java.time.Duration;
import lombok.Data;

/**
 * Status and body text of one response, whatever its status. {@code responseTime} runs from just
 * before the request is built until the status line and headers arrive, so reading the body is not
 * counted.
 */
@Data
public class RestResponseData {
  private int statusCode;
  private String body;
  private Duration responseTime;
}
