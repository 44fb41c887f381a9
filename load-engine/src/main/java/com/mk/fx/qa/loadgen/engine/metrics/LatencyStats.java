package com.mk.fx.qa.loadgen.engine.metrics;

/** Latency summary; every value is in microseconds. */
public record LatencyStats(
    long count,
    long min,
    long max,
    double mean,
    long p50,
    long p90,
    long p95,
    long p99,
    long p999) {

  /** One-line rendering in milliseconds. */
  public String format() {
    return String.format(
        "count=%d min=%.2fms mean=%.2fms p50=%.2fms p90=%.2fms p95=%.2fms p99=%.2fms p99.9=%.2fms max=%.2fms",
        count,
        min / 1000.0,
        mean / 1000.0,
        p50 / 1000.0,
        p90 / 1000.0,
        p95 / 1000.0,
        p99 / 1000.0,
        p999 / 1000.0,
        max / 1000.0);
  }
}
