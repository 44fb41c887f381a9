package com.mk.fx.qa.loadgen.engine.scenario;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import com.mk.fx.qa.loadgen.engine.utils.LoadUtils;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.BooleanSupplier;

/** Pause applied after a step. Either fixed, or uniformly random within {@code [min, max]}. */
public record ThinkTime(Duration min, Duration max) {

  private static final long SLEEP_CHUNK_MILLIS = 200L;

  public ThinkTime {
    if (min == null || max == null || min.isNegative() || max.isNegative()) {
      throw new LoadConfigException("thinkTime", "bounds must be non-negative durations");
    }
    if (max.compareTo(min) < 0) {
      throw new LoadConfigException("thinkTime", "max " + max + " is below min " + min);
    }
  }

  public static ThinkTime fixed(Duration duration) {
    return new ThinkTime(duration, duration);
  }

  public static ThinkTime random(Duration min, Duration max) {
    return new ThinkTime(min, max);
  }

  public boolean isRandom() {
    return !min.equals(max);
  }

  /** Delay for the next pause, in milliseconds. */
  public long nextDelayMillis() {
    long lower = min.toMillis();
    long upper = max.toMillis();
    if (upper <= lower) {
      return lower;
    }
    return ThreadLocalRandom.current().nextLong(lower, upper + 1);
  }

  /**
   * Sleeps for the next delay, checking {@code cancelled} between chunks.
   *
   * @throws InterruptedException if interrupted or cancelled while pausing
   */
  public void pause(BooleanSupplier cancelled) throws InterruptedException {
    long delay = nextDelayMillis();
    if (delay <= 0) {
      return;
    }
    boolean completed =
        LoadUtils.sleepInChunks(
            delay, SLEEP_CHUNK_MILLIS, () -> cancelled.getAsBoolean() || Thread.currentThread().isInterrupted());
    if (!completed) {
      throw new InterruptedException("Cancelled during think time");
    }
  }
}
