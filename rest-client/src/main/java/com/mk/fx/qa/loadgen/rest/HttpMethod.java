package com.mk.fx.qa.loadgen.rest;

import java.util.Locale;
import java.util.Optional;

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
   * Case-insensitive lookup.
   *
   * @param value method name, e.g. {@code "post"}
   * @return the matching method, or empty when the name is blank or unsupported
   */
  public static Optional<HttpMethod> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
