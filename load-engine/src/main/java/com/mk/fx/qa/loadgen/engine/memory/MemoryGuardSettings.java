package com.mk.fx.qa.loadgen.engine.memory;

import java.time.Duration;

/**
 * Thresholds are percentages of the detected limit. With {@code autoDisable} the guard switches
 * latency tracking off at the warning threshold.
 */
public record MemoryGuardSettings(
    double warningThresholdPercent,
    double criticalThresholdPercent,
    boolean autoDisable,
    Duration checkInterval) {

  public static final MemoryGuardSettings DEFAULTS =
      new MemoryGuardSettings(80.0, 90.0, true, Duration.ofSeconds(5));

  public MemoryGuardSettings {
    if (warningThresholdPercent <= 0 || warningThresholdPercent > 100) {
      throw new IllegalArgumentException("warningThresholdPercent must be within (0, 100]");
    }
    if (criticalThresholdPercent < warningThresholdPercent || criticalThresholdPercent > 100) {
      throw new IllegalArgumentException(
          "criticalThresholdPercent must be within [warningThresholdPercent, 100]");
    }
    if (checkInterval == null || checkInterval.isZero() || checkInterval.isNegative()) {
      throw new IllegalArgumentException("checkInterval must be positive");
    }
  }
}
