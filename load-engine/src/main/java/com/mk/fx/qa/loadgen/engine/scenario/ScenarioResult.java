package com.mk.fx.qa.loadgen.engine.scenario;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one scenario execution. {@code stepsCompleted} counts attempted steps including a
 * failing one; {@code failedAtStep} is the zero-based index of that step.
 */
public record ScenarioResult(
    String scenarioName,
    boolean success,
    long totalTimeMs,
    int stepsCompleted,
    Integer failedAtStep,
    List<StepResult> steps) {

  public ScenarioResult {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }

  public Optional<Integer> failedAtStepIndex() {
    return Optional.ofNullable(failedAtStep);
  }
}
