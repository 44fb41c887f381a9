package com.mk.fx.qa.loadgen.engine.executors;

/** Work performed by a worker on each paced iteration. */
@FunctionalInterface
public interface WorkUnit {

  /**
   * Performs one unit of work and records its outcome.
   *
   * @return whether the unit succeeded
   * @throws InterruptedException if the worker is interrupted or cancelled
   */
  boolean run(IterationContext iteration) throws InterruptedException;
}
