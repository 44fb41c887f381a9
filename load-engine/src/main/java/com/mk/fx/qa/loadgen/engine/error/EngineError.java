package com.mk.fx.qa.loadgen.engine.error;

import java.util.Objects;

/**
 * Closed set of failures a worker can observe while executing a step. Failures are values carried
 * in step results; they never escape a worker as exceptions.
 */
public sealed interface EngineError {

  /** Human-readable description. */
  String message();

  /** The request could not be completed (DNS, connect, TLS, timeout, I/O). */
  record TransportError(ErrorCategory category, String message) implements EngineError {
    public TransportError {
      Objects.requireNonNull(category, "category");
    }
  }

  /** A response check did not hold. */
  record AssertionFailure(String assertion, String expected, String actual, String message)
      implements EngineError {}

  /** A value could not be extracted from a response. Never fails a step. */
  record ExtractionFailure(String variable, String reason) implements EngineError {
    @Override
    public String message() {
      return "Failed to extract '" + variable + "': " + reason;
    }
  }

  /** Invalid configuration detected at startup or while resolving a templated request. */
  record ConfigError(String field, String message) implements EngineError {}
}
