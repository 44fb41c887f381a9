package com.mk.fx.qa.loadgen.engine.memory;

/** Snapshot taken on a guard check. */
public record MemoryStatus(long usedBytes, long limitBytes, double usagePercent) {

  public static MemoryStatus of(long usedBytes, long limitBytes) {
    return new MemoryStatus(usedBytes, limitBytes, usedBytes * 100.0 / limitBytes);
  }
}
