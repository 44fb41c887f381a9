package com.mk.fx.qa.loadgen.engine.scenario;

import static com.google.common.base.Preconditions.checkState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Cookie jar for one virtual user. Cookies set by a response are replayed on every later request
 * of the same worker, across steps and across scenario iterations.
 *
 * <p>A store binds to the first thread that uses it and rejects calls from any other thread.
 */
@Slf4j
public class SessionStore {

  private final Map<String, String> cookies = new LinkedHashMap<>();
  private Thread owner;

  /** Absorbs every {@code Set-Cookie} header value of a response. */
  public void absorb(List<String> setCookieHeaders) {
    checkOwner();
    if (setCookieHeaders == null) {
      return;
    }
    for (String header : setCookieHeaders) {
      absorbOne(header);
    }
  }

  private void absorbOne(String header) {
    if (header == null || header.isBlank()) {
      return;
    }
    String[] parts = header.split(";");
    String pair = parts[0];
    int eq = pair.indexOf('=');
    if (eq <= 0) {
      log.debug("Ignoring malformed Set-Cookie header: {}", header);
      return;
    }
    String name = pair.substring(0, eq).trim();
    String value = pair.substring(eq + 1).trim();
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      value = value.substring(1, value.length() - 1);
    }

    boolean expired = value.isEmpty();
    for (int i = 1; i < parts.length && !expired; i++) {
      String attr = parts[i].trim();
      int attrEq = attr.indexOf('=');
      if (attrEq > 0 && attr.substring(0, attrEq).trim().equalsIgnoreCase("Max-Age")) {
        try {
          expired = Long.parseLong(attr.substring(attrEq + 1).trim()) <= 0;
        } catch (NumberFormatException e) {
          log.debug("Ignoring invalid Max-Age in Set-Cookie for {}: {}", name, attr);
        }
      }
    }

    if (expired) {
      cookies.remove(name);
    } else {
      cookies.put(name, value);
    }
  }

  /** Value for an outgoing {@code Cookie} header, or empty when the jar is empty. */
  public Optional<String> cookieHeader() {
    checkOwner();
    if (cookies.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        cookies.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("; ")));
  }

  public Optional<String> cookie(String name) {
    checkOwner();
    return Optional.ofNullable(cookies.get(name));
  }

  public int size() {
    checkOwner();
    return cookies.size();
  }

  public void clear() {
    checkOwner();
    cookies.clear();
  }

  private void checkOwner() {
    Thread current = Thread.currentThread();
    if (owner == null) {
      owner = current;
      return;
    }
    checkState(
        owner == current,
        "SessionStore owned by thread %s used from thread %s",
        owner.getName(),
        current.getName());
  }
}
