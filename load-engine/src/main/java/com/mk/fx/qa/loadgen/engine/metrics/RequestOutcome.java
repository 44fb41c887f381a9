package com.mk.fx.qa.loadgen.engine.metrics;

import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import java.util.Optional;

/**
 * Outcome of a single request. {@code status} is null when no response was received; {@code
 * errorCategory} is set for transport failures and 4xx/5xx responses.
 */
public record RequestOutcome(
    String label, Integer status, ErrorCategory errorCategory, long elapsedMs) {

  public boolean isError() {
    return errorCategory != null;
  }

  public Optional<Integer> statusCode() {
    return Optional.ofNullable(status);
  }
}
