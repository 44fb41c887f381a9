package com.mk.fx.qa.loadgen.engine.cfg;

import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import com.mk.fx.qa.loadgen.engine.scenario.ScenarioSelector;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the configuration workers read on every iteration and lets it be replaced while a run is
 * in progress. Replacements are pushed to subscribers so paced or paused workers wake up and
 * re-base their schedule.
 */
@Slf4j
public class RuntimeConfigHolder {

  /** Handle returned by {@link #subscribe(Consumer)}; closing it stops notifications. */
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }

  private final List<Consumer<RuntimeConfig>> subscribers = new CopyOnWriteArrayList<>();
  private volatile RuntimeConfig current;

  public RuntimeConfigHolder(LoadModel loadModel) {
    this(loadModel, null);
  }

  public RuntimeConfigHolder(LoadModel loadModel, ScenarioSelector scenarios) {
    this.current = new RuntimeConfig(1, loadModel, scenarios);
  }

  public RuntimeConfig current() {
    return current;
  }

  /** Replaces the load model, keeping the scenario selection. */
  public RuntimeConfig updateLoadModel(LoadModel loadModel) {
    return update(loadModel, current.scenarios());
  }

  public RuntimeConfig update(LoadModel loadModel, ScenarioSelector scenarios) {
    RuntimeConfig next;
    synchronized (this) {
      next = new RuntimeConfig(current.version() + 1, loadModel, scenarios);
      current = next;
    }
    log.info("Runtime configuration updated to version {}: {}", next.version(), loadModel.describe());
    for (Consumer<RuntimeConfig> subscriber : subscribers) {
      try {
        subscriber.accept(next);
      } catch (RuntimeException e) {
        log.warn("Configuration subscriber failed: {}", e.getMessage(), e);
      }
    }
    return next;
  }

  public Subscription subscribe(Consumer<RuntimeConfig> subscriber) {
    subscribers.add(subscriber);
    return () -> subscribers.remove(subscriber);
  }

  int subscriberCount() {
    return subscribers.size();
  }
}
