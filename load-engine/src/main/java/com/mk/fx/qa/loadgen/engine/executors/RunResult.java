package com.mk.fx.qa.loadgen.engine.executors;

import java.time.Duration;

public record RunResult(
    int workers, long iterations, long failures, boolean cancelled, Duration elapsed) {}
