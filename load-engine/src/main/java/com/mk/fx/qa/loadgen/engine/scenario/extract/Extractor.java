package com.mk.fx.qa.loadgen.engine.scenario.extract;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.rest.RestResponseData;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Pulls a single string value out of a response. */
public sealed interface Extractor {

  String extract(RestResponseData response) throws ExtractionException;

  /** Value at a JSON path in the body, e.g. {@code $.user.id}. */
  record JsonPath(JsonPathExpression path) implements Extractor {

    public JsonPath(String expression) {
      this(JsonPathExpression.compile(expression));
    }

    public JsonPath {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public String extract(RestResponseData response) throws ExtractionException {
      return path.evaluate(response.getBody())
          .map(JsonPathExpression::asString)
          .orElseThrow(() -> new ExtractionException("JSON path " + path + " not found"));
    }
  }

  /** A capture group of the first regex match in the body; group may be a number or a name. */
  record Regex(Pattern pattern, String group) implements Extractor {

    public Regex(String regex, String group) {
      this(compile(regex), group);
    }

    public Regex {
      Objects.requireNonNull(pattern, "pattern");
      if (group == null || group.isBlank()) {
        group = "1";
      }
    }

    private static Pattern compile(String regex) {
      try {
        return Pattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new LoadConfigException("extract.regex", "invalid pattern: " + e.getDescription(), e);
      }
    }

    @Override
    public String extract(RestResponseData response) throws ExtractionException {
      String body = response.getBody() == null ? "" : response.getBody();
      Matcher matcher = pattern.matcher(body);
      if (!matcher.find()) {
        throw new ExtractionException("Pattern " + pattern.pattern() + " did not match");
      }
      String value;
      try {
        value =
            group.chars().allMatch(Character::isDigit)
                ? matcher.group(Integer.parseInt(group))
                : matcher.group(group);
      } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
        throw new ExtractionException("Pattern " + pattern.pattern() + " has no group " + group, e);
      }
      if (value == null) {
        throw new ExtractionException("Group " + group + " did not participate in the match");
      }
      return value;
    }
  }

  /** First value of a response header. */
  record Header(String name) implements Extractor {
    public Header {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String extract(RestResponseData response) throws ExtractionException {
      return response
          .firstHeader(name)
          .orElseThrow(() -> new ExtractionException("Header " + name + " not present"));
    }
  }

  /** Value of a cookie set by this response. */
  record Cookie(String name) implements Extractor {
    public Cookie {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String extract(RestResponseData response) throws ExtractionException {
      for (String header : response.headerValues("Set-Cookie")) {
        String pair = header.split(";", 2)[0];
        int eq = pair.indexOf('=');
        if (eq > 0 && pair.substring(0, eq).trim().equals(name)) {
          return pair.substring(eq + 1).trim();
        }
      }
      throw new ExtractionException("Cookie " + name + " not set by response");
    }
  }
}
