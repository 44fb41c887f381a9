package com.mk.fx.qa.loadgen.engine.metrics;

import java.time.Duration;

/**
 * Throughput of one label.
 *
 * @param totalCount samples recorded
 * @param avgTimeMs mean recorded elapsed time per sample
 * @param rps samples per second since the label's first sample
 * @param duration time since the label's first sample
 */
public record ThroughputStats(long totalCount, double avgTimeMs, double rps, Duration duration) {}
