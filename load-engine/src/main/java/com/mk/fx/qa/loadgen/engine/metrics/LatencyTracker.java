package com.mk.fx.qa.loadgen.engine.metrics;

import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.HdrHistogram.Histogram;
import org.HdrHistogram.Recorder;

/**
 * Latency distribution backed by an HdrHistogram {@link Recorder}. Writers record without locking;
 * readers drain the recorder's interval histogram into an accumulated one.
 *
 * <p>Values are clamped to [1 µs, 60 s] and kept with two significant digits.
 */
@Slf4j
public final class LatencyTracker {

  static final long LOWEST_TRACKABLE_MICROS = 1L;
  static final long HIGHEST_TRACKABLE_MICROS = 60_000_000L;
  static final int SIGNIFICANT_DIGITS = 2;

  private final String name;
  private volatile State state = new State();

  public LatencyTracker() {
    this("latency");
  }

  public LatencyTracker(String name) {
    this.name = name;
  }

  public void record(long micros) {
    long clamped = Math.max(LOWEST_TRACKABLE_MICROS, Math.min(HIGHEST_TRACKABLE_MICROS, micros));
    state.recorder.recordValue(clamped);
  }

  public void recordMillis(long millis) {
    record(millis * 1000L);
  }

  /** Empty until something has been recorded since creation, reset or rotation. */
  public synchronized Optional<LatencyStats> stats() {
    State current = state;
    current.drain();
    Histogram h = current.accumulated;
    if (h.getTotalCount() == 0) {
      return Optional.empty();
    }
    return Optional.of(
        new LatencyStats(
            h.getTotalCount(),
            h.getMinValue(),
            h.getMaxValue(),
            h.getMean(),
            h.getValueAtPercentile(50.0),
            h.getValueAtPercentile(90.0),
            h.getValueAtPercentile(95.0),
            h.getValueAtPercentile(99.0),
            h.getValueAtPercentile(99.9)));
  }

  public synchronized void reset() {
    state = new State();
  }

  /** Drops the current histogram and starts a fresh one, releasing its memory. */
  public synchronized void rotate() {
    long dropped = state.accumulated.getTotalCount();
    state = new State();
    log.info("Rotated latency histogram {} ({} accumulated samples released)", name, dropped);
  }

  public String name() {
    return name;
  }

  private static final class State {
    private final Recorder recorder =
        new Recorder(LOWEST_TRACKABLE_MICROS, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS);
    private final Histogram accumulated =
        new Histogram(LOWEST_TRACKABLE_MICROS, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS);
    private Histogram interval;

    private void drain() {
      interval = recorder.getIntervalHistogram(interval);
      accumulated.add(interval);
    }
  }
}
