package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.EngineError;
import com.mk.fx.qa.loadgen.engine.error.EngineError.AssertionFailure;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one step. {@code status} is null when no response was received; {@code failure}
 * holds the transport or configuration error in that case. Assertion failures are kept apart so
 * they can be categorised separately.
 */
public record StepResult(
    String stepName,
    boolean success,
    Integer status,
    long elapsedMs,
    EngineError failure,
    List<AssertionFailure> assertionFailures) {

  public StepResult {
    assertionFailures = assertionFailures == null ? List.of() : List.copyOf(assertionFailures);
  }

  public Optional<Integer> statusCode() {
    return Optional.ofNullable(status);
  }

  /** Message of the transport/config error, if any. Never set for assertion failures. */
  public Optional<String> errorMessage() {
    return Optional.ofNullable(failure).map(EngineError::message);
  }
}
