package com.mk.fx.qa.loadgen.engine.executors;

import com.mk.fx.qa.loadgen.engine.data.CsvDataSource;
import com.mk.fx.qa.loadgen.engine.error.EngineError;
import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.metrics.RequestOutcome;
import com.mk.fx.qa.loadgen.engine.scenario.ScenarioEngine;
import com.mk.fx.qa.loadgen.engine.scenario.ScenarioResult;
import com.mk.fx.qa.loadgen.engine.scenario.StepResult;
import com.mk.fx.qa.loadgen.engine.scenario.VariableContext;
import java.time.Duration;
import java.util.Objects;

/**
 * Runs one scenario per iteration, chosen by the active selector. Each execution gets a fresh
 * variable context seeded with the next data row, if a data source is configured; cookies live in
 * the worker's session and carry over between iterations.
 */
public class ScenarioWorkUnit implements WorkUnit {

  private final ScenarioEngine engine;
  private final CsvDataSource dataSource;
  private final EngineContext context;

  public ScenarioWorkUnit(ScenarioEngine engine, EngineContext context) {
    this(engine, null, context);
  }

  /** @param dataSource optional; may be null */
  public ScenarioWorkUnit(ScenarioEngine engine, CsvDataSource dataSource, EngineContext context) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.dataSource = dataSource;
    this.context = Objects.requireNonNull(context, "context");
  }

  @Override
  public boolean run(IterationContext iteration) throws InterruptedException {
    var selector =
        iteration
            .config()
            .scenarioSelector()
            .orElseThrow(() -> new IllegalStateException("No scenarios configured"));
    var scenario = selector.select();

    var variables = new VariableContext();
    if (dataSource != null) {
      variables.putAll(dataSource.nextRow());
    }

    ScenarioResult result =
        engine.execute(scenario, variables, iteration.session(), iteration.cancelled());
    record(result);
    return result.success();
  }

  private void record(ScenarioResult result) {
    String name = result.scenarioName();
    boolean recordLatency = context.shouldRecordLatency();
    if (recordLatency) {
      context.getScenarioLatency().recordMillis(name, result.totalTimeMs());
    }
    context.getThroughput().record(name, Duration.ofMillis(result.totalTimeMs()));

    for (StepResult step : result.steps()) {
      String label = name + ":" + step.stepName();
      if (recordLatency && step.status() != null) {
        context.getStepLatency().recordMillis(label, step.elapsedMs());
      }
      ErrorCategory category = categorise(step);
      if (category != null) {
        context.getErrors().recordFailure(category, failureMessage(step));
      }
      context.publish(new RequestOutcome(label, step.status(), category, step.elapsedMs()));
    }
    context.publish(result);
  }

  private static ErrorCategory categorise(StepResult step) {
    if (step.failure() instanceof EngineError.TransportError transport) {
      return transport.category();
    }
    if (step.failure() != null) {
      return ErrorCategory.OTHER_ERROR;
    }
    if (!step.assertionFailures().isEmpty()) {
      return ErrorCategory.ASSERTION_FAILURE;
    }
    return step.status() == null ? null : ErrorCategory.fromStatusCode(step.status());
  }

  private static String failureMessage(StepResult step) {
    if (step.failure() != null) {
      return step.failure().message();
    }
    if (!step.assertionFailures().isEmpty()) {
      return step.assertionFailures().get(0).message();
    }
    return "HTTP " + step.status();
  }
}
