package com.mk.fx.qa.loadgen.engine.executors;

import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfig;
import com.mk.fx.qa.loadgen.engine.scenario.SessionStore;
import java.util.function.BooleanSupplier;

/** What a {@link WorkUnit} sees for one iteration of one worker. */
public record IterationContext(
    int workerIndex, SessionStore session, RuntimeConfig config, BooleanSupplier cancelled) {}
