package com.mk.fx.qa.loadgen.rest;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private String body;
  private long responseTimeMs;

  /** First value of the named header, matched case-insensitively. */
  public Optional<String> firstHeader(String name) {
    List<String> values = headerValues(name);
    return values.isEmpty() ? Optional.empty() : Optional.ofNullable(values.get(0));
  }

  /** All values of the named header, matched case-insensitively; never null. */
  public List<String> headerValues(String name) {
    if (name == null || headers == null) {
      return List.of();
    }
    List<String> values = headers.get(name);
    if (values == null) {
      // tolerate maps that were not built case-insensitive
      for (Map.Entry<String, List<String>> e : headers.entrySet()) {
        if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) {
          return e.getValue();
        }
      }
      return List.of();
    }
    return values;
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 400;
  }
}
