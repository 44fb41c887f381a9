package com.mk.fx.qa.loadgen.engine.memory;

import java.util.Optional;

/** Source of the memory limit and current usage of this process, in bytes. */
public interface MemoryLimitProvider {

  /** Effective limit, or empty when it cannot be determined. */
  Optional<Long> detectLimit();

  /** Current usage, or empty when it cannot be read. */
  Optional<Long> currentUsage();
}
