package com.mk.fx.qa.loadgen.engine.scenario;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Mutable name to value bindings for one scenario execution. Not thread-safe; each worker owns its
 * own context.
 */
@Slf4j
public class VariableContext {

  public static final String TIMESTAMP = "timestamp";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(\\w+)}");

  private final Map<String, String> variables = new HashMap<>();

  public VariableContext set(String name, String value) {
    variables.put(name, value);
    return this;
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(variables.get(name));
  }

  public VariableContext putAll(Map<String, String> values) {
    if (values != null) {
      variables.putAll(values);
    }
    return this;
  }

  public boolean contains(String name) {
    return variables.containsKey(name);
  }

  public int size() {
    return variables.size();
  }

  public void clear() {
    variables.clear();
  }

  public Map<String, String> snapshot() {
    return Map.copyOf(variables);
  }

  /**
   * Replaces every {@code ${name}} with its bound value. Unbound names are left as literal text,
   * except {@code timestamp}, which falls back to the current epoch millis.
   */
  public String substitute(String template) {
    if (template == null || template.indexOf("${") < 0) {
      return template;
    }
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder out = new StringBuilder(template.length() + 16);
    while (matcher.find()) {
      String name = matcher.group(1);
      String value = variables.get(name);
      if (value == null && TIMESTAMP.equals(name)) {
        value = Long.toString(System.currentTimeMillis());
      }
      if (value == null) {
        log.debug("No binding for variable '{}', leaving placeholder as-is", name);
        value = matcher.group();
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /** Applies {@link #substitute(String)} to every header name and value. */
  public Map<String, String> substitute(Map<String, String> headers) {
    Map<String, String> resolved = new LinkedHashMap<>();
    if (headers != null) {
      headers.forEach((k, v) -> resolved.put(substitute(k), substitute(v)));
    }
    return resolved;
  }
}
