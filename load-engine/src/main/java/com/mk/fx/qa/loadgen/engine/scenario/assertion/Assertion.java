package com.mk.fx.qa.loadgen.engine.scenario.assertion;

import com.mk.fx.qa.loadgen.engine.error.EngineError.AssertionFailure;
import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.engine.scenario.extract.ExtractionException;
import com.mk.fx.qa.loadgen.engine.scenario.extract.JsonPathExpression;
import com.mk.fx.qa.loadgen.rest.RestResponseData;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** A check on a response. A failed check fails its step and stops the scenario. */
public sealed interface Assertion {

  /** Empty when the check holds. */
  Optional<AssertionFailure> check(RestResponseData response);

  record StatusCode(int expected) implements Assertion {
    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      int actual = response.getStatusCode();
      if (actual == expected) {
        return Optional.empty();
      }
      return fail(
          "StatusCode",
          String.valueOf(expected),
          String.valueOf(actual),
          "Status code mismatch: expected " + expected + ", got " + actual);
    }
  }

  record ResponseTime(long maxMillis) implements Assertion {
    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      long actual = response.getResponseTimeMs();
      if (actual <= maxMillis) {
        return Optional.empty();
      }
      return fail(
          "ResponseTime",
          "<= " + maxMillis + "ms",
          actual + "ms",
          "Response time " + actual + "ms exceeded threshold " + maxMillis + "ms");
    }
  }

  record BodyContains(String text) implements Assertion {
    public BodyContains {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      String body = response.getBody();
      if (body != null && body.contains(text)) {
        return Optional.empty();
      }
      return fail(
          "BodyContains", text, abbreviate(body), "Response body does not contain '" + text + "'");
    }
  }

  record BodyMatches(Pattern pattern) implements Assertion {
    public BodyMatches(String regex) {
      this(compile(regex));
    }

    public BodyMatches {
      Objects.requireNonNull(pattern, "pattern");
    }

    private static Pattern compile(String regex) {
      try {
        return Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new LoadConfigException("assert.bodyMatches", "invalid pattern: " + e.getDescription(), e);
      }
    }

    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      String body = response.getBody() == null ? "" : response.getBody();
      if (pattern.matcher(body).find()) {
        return Optional.empty();
      }
      return fail(
          "BodyMatches",
          pattern.pattern(),
          abbreviate(body),
          "Response body does not match pattern '" + pattern.pattern() + "'");
    }
  }

  /** Path must exist; when {@code expected} is set its value must also equal it. */
  record JsonPath(JsonPathExpression path, String expected) implements Assertion {
    public JsonPath(String path, String expected) {
      this(JsonPathExpression.compile(path), expected);
    }

    public JsonPath {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      try {
        var node = path.evaluate(response.getBody());
        if (node.isEmpty()) {
          return fail(
              "JsonPath",
              expected == null ? "<present>" : expected,
              "<missing>",
              "JSON path " + path + " not found");
        }
        String actual = JsonPathExpression.asString(node.get());
        if (expected == null || expected.equals(actual)) {
          return Optional.empty();
        }
        return fail(
            "JsonPath",
            expected,
            actual,
            "JSON path " + path + " mismatch: expected '" + expected + "', got '" + actual + "'");
      } catch (ExtractionException e) {
        return fail("JsonPath", expected, "<invalid json>", e.getMessage());
      }
    }
  }

  record HeaderExists(String name) implements Assertion {
    public HeaderExists {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public Optional<AssertionFailure> check(RestResponseData response) {
      if (!response.headerValues(name).isEmpty()) {
        return Optional.empty();
      }
      return fail("HeaderExists", name, "<absent>", "Header '" + name + "' not present");
    }
  }

  private static Optional<AssertionFailure> fail(
      String assertion, String expected, String actual, String message) {
    return Optional.of(new AssertionFailure(assertion, expected, actual, message));
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "<empty>";
    }
    return body.length() <= 120 ? body : body.substring(0, 117) + "...";
  }
}
