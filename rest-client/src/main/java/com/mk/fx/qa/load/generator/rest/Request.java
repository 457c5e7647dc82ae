package com.mk.fx.qa.load.generator.rest;

import java.util.Map;
import lombok.Data;

/** One request template, sent unchanged on every attempt. */
@Data
public class Request {
  private HttpMethod method;
  private Map<String, String> headers;
  private Object body;
}
