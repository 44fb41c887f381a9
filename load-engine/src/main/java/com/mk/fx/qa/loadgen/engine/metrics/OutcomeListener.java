package com.mk.fx.qa.loadgen.engine.metrics;

import com.mk.fx.qa.loadgen.engine.scenario.ScenarioResult;

/**
 * Receives an event for every request and every scenario execution, e.g. to feed an external
 * metrics collector. Called on worker threads; implementations must be thread-safe and fast.
 */
public interface OutcomeListener {

  default void onRequest(RequestOutcome outcome) {}

  default void onScenario(ScenarioResult result) {}
}
