package com.mk.fx.qa.load.generator.cfg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.load.generator.rest.JsonUtil;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Parses the JSON object arguments of the command line. */
public final class JsonArguments {

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
      new TypeReference<>() {};

  private JsonArguments() {
    // Utility class, no instantiation
  }

  /**
   * Parses a JSON object into header name/value pairs. Non-string values keep their JSON text.
   *
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public static Map<String, String> parseHeaders(String json, String argumentName) {
    JsonNode node = readObject(json, argumentName);
    Map<String, String> headers = new LinkedHashMap<>();
    node.fields()
        .forEachRemaining(
            e -> {
              JsonNode value = e.getValue();
              if (value.isNull()) {
                throw new IllegalArgumentException(
                    argumentName + ": header '" + e.getKey() + "' must not be null");
              }
              headers.put(e.getKey(), value.isValueNode() ? value.asText() : value.toString());
            });
    return Collections.unmodifiableMap(headers);
  }

  /**
   * Parses a JSON object payload.
   *
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  public static Map<String, Object> parsePayload(String json, String argumentName) {
    JsonNode node = readObject(json, argumentName);
    return Collections.unmodifiableMap(JsonUtil.mapper().convertValue(node, OBJECT_TYPE));
  }

  private static JsonNode readObject(String json, String argumentName) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException(argumentName + " must be a JSON object");
    }
    JsonNode node;
    try {
      node = JsonUtil.mapper().readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          argumentName + " is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(argumentName + " must be a JSON object, got: " + json);
    }
    return node;
  }
}
