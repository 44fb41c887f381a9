package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/** Picks a scenario per iteration, proportionally to scenario weights. */
public final class ScenarioSelector {

  private final List<Scenario> scenarios;
  private final double[] cumulative;
  private final double totalWeight;
  private final DoubleSupplier random;

  public ScenarioSelector(List<Scenario> scenarios) {
    this(scenarios, () -> ThreadLocalRandom.current().nextDouble());
  }

  /** @param random source of uniform values in {@code [0, 1)} */
  public ScenarioSelector(List<Scenario> scenarios, DoubleSupplier random) {
    if (scenarios == null || scenarios.isEmpty()) {
      throw new LoadConfigException("scenarios", "at least one scenario is required");
    }
    this.scenarios = List.copyOf(scenarios);
    this.random = random;
    this.cumulative = new double[this.scenarios.size()];
    double sum = 0;
    for (int i = 0; i < this.scenarios.size(); i++) {
      sum += this.scenarios.get(i).weight();
      cumulative[i] = sum;
    }
    this.totalWeight = sum;
  }

  public static ScenarioSelector single(Scenario scenario) {
    return new ScenarioSelector(List.of(scenario));
  }

  public Scenario select() {
    if (scenarios.size() == 1) {
      return scenarios.get(0);
    }
    double point = random.getAsDouble() * totalWeight;
    for (int i = 0; i < cumulative.length; i++) {
      if (point < cumulative[i]) {
        return scenarios.get(i);
      }
    }
    return scenarios.get(scenarios.size() - 1);
  }

  public List<Scenario> scenarios() {
    return scenarios;
  }
}
