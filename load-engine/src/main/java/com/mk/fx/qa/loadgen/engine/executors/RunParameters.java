package com.mk.fx.qa.loadgen.engine.executors;

import java.time.Duration;

/**
 * @param workers number of concurrent workers
 * @param testDuration wall-clock duration of the run
 */
public record RunParameters(int workers, Duration testDuration) {

  public RunParameters {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be >= 1");
    }
    if (testDuration == null || testDuration.isNegative() || testDuration.isZero()) {
      throw new IllegalArgumentException("testDuration must be positive");
    }
  }
}
