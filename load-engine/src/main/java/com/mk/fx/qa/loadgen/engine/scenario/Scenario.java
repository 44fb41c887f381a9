package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import java.util.List;

/** Named, ordered list of steps executed as one user journey. */
public record Scenario(String name, double weight, List<Step> steps) {

  public Scenario {
    if (name == null || name.isBlank()) {
      throw new LoadConfigException("scenario.name", "must not be blank");
    }
    if (!Double.isFinite(weight) || weight <= 0) {
      throw new LoadConfigException("scenario.weight", "must be positive for " + name);
    }
    if (steps == null || steps.isEmpty()) {
      throw new LoadConfigException("scenario.steps", "scenario " + name + " has no steps");
    }
    steps = List.copyOf(steps);
  }

  public Scenario(String name, List<Step> steps) {
    this(name, 1.0, steps);
  }
}
