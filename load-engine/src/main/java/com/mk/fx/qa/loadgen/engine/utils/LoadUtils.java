package com.mk.fx.qa.loadgen.engine.utils;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  /**
   * Sleeps for up to {@code millis} in chunks of at most {@code chunkMillis}, returning early as
   * soon as {@code wakeUp} reports true.
   *
   * @return true if the full duration elapsed, false if woken early
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  public static boolean sleepInChunks(long millis, long chunkMillis, BooleanSupplier wakeUp)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, millis));
    while (true) {
      if (wakeUp.getAsBoolean()) {
        return false;
      }
      long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remaining <= 0) {
        return true;
      }
      TimeUnit.MILLISECONDS.sleep(Math.min(chunkMillis, remaining));
    }
  }
}
