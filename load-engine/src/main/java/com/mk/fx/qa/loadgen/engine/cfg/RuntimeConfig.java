package com.mk.fx.qa.loadgen.engine.cfg;

import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import com.mk.fx.qa.loadgen.engine.scenario.ScenarioSelector;
import java.util.Objects;
import java.util.Optional;

/**
 * Active load model and scenario selection. {@code scenarios} is null for single-request runs.
 */
public record RuntimeConfig(long version, LoadModel loadModel, ScenarioSelector scenarios) {

  public RuntimeConfig {
    Objects.requireNonNull(loadModel, "loadModel");
  }

  public Optional<ScenarioSelector> scenarioSelector() {
    return Optional.ofNullable(scenarios);
  }
}
