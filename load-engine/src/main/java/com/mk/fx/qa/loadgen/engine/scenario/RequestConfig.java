package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.rest.HttpMethod;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request template of a step. Method, path, body and headers may contain {@code ${name}}
 * placeholders resolved at execution time.
 */
public record RequestConfig(String method, String path, String body, Map<String, String> headers) {

  public RequestConfig {
    Objects.requireNonNull(path, "path");
    if (method == null || method.isBlank()) {
      method = HttpMethod.GET.name();
    }
    if (!method.contains("${") && HttpMethod.parse(method).isEmpty()) {
      throw new LoadConfigException("request.method", "unsupported HTTP method '" + method + "'");
    }
    headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
  }

  public static RequestConfig get(String path) {
    return new RequestConfig("GET", path, null, Map.of());
  }

  public static RequestConfig post(String path, String body) {
    return new RequestConfig("POST", path, body, Map.of());
  }

  public RequestConfig withHeader(String name, String value) {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.put(name, value);
    return new RequestConfig(method, path, body, copy);
  }
}
