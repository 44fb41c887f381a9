package com.mk.fx.qa.loadgen.engine.scenario.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.rest.JsonUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compiled JSON path over the subset {@code $.a.b[0].c}: dotted field access and zero-based array
 * indexes, with an optional leading {@code $}.
 */
public final class JsonPathExpression {

  private sealed interface Segment permits Field, Index {}

  private record Field(String name) implements Segment {}

  private record Index(int index) implements Segment {}

  private final String expression;
  private final List<Segment> segments;

  private JsonPathExpression(String expression, List<Segment> segments) {
    this.expression = expression;
    this.segments = segments;
  }

  public static JsonPathExpression compile(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new LoadConfigException("jsonPath", "expression must not be blank");
    }
    String path = expression.trim();
    if (path.startsWith("$")) {
      path = path.substring(1);
    }
    List<Segment> segments = new ArrayList<>();
    int i = 0;
    while (i < path.length()) {
      char c = path.charAt(i);
      if (c == '.') {
        i++;
        continue;
      }
      if (c == '[') {
        int close = path.indexOf(']', i);
        if (close < 0) {
          throw new LoadConfigException("jsonPath", "unclosed '[' in " + expression);
        }
        try {
          int index = Integer.parseInt(path.substring(i + 1, close).trim());
          if (index < 0) {
            throw new LoadConfigException("jsonPath", "negative index in " + expression);
          }
          segments.add(new Index(index));
        } catch (NumberFormatException e) {
          throw new LoadConfigException("jsonPath", "invalid index in " + expression, e);
        }
        i = close + 1;
        continue;
      }
      int end = i;
      while (end < path.length() && path.charAt(end) != '.' && path.charAt(end) != '[') {
        end++;
      }
      segments.add(new Field(path.substring(i, end)));
      i = end;
    }
    return new JsonPathExpression(expression, List.copyOf(segments));
  }

  /** Navigates {@code root}; empty when any segment is missing. */
  public Optional<JsonNode> evaluate(JsonNode root) {
    JsonNode current = root;
    for (Segment segment : segments) {
      if (current == null || current.isMissingNode()) {
        return Optional.empty();
      }
      if (segment instanceof Field field) {
        current = current.isObject() ? current.get(field.name()) : null;
      } else if (segment instanceof Index index) {
        current = current.isArray() ? current.get(index.index()) : null;
      }
    }
    return current == null || current.isMissingNode() ? Optional.empty() : Optional.of(current);
  }

  /** Evaluates against a JSON body. */
  public Optional<JsonNode> evaluate(String json) throws ExtractionException {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return evaluate(JsonUtil.readTree(json));
    } catch (JsonProcessingException e) {
      throw new ExtractionException("Response body is not valid JSON: " + e.getMessage(), e);
    }
  }

  /** Scalars as their text, {@code null} as "null", containers as compact JSON. */
  public static String asString(JsonNode node) {
    if (node.isTextual()) {
      return node.asText();
    }
    if (node.isValueNode()) {
      return node.isNull() ? "null" : node.toString();
    }
    return node.toString();
  }

  public String expression() {
    return expression;
  }

  @Override
  public String toString() {
    return expression;
  }
}
