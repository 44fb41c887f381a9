package com.mk.fx.qa.loadgen.engine.executors;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfigHolder;
import com.mk.fx.qa.loadgen.engine.metrics.ErrorTracker;
import com.mk.fx.qa.loadgen.engine.scenario.SessionStore;
import com.mk.fx.qa.loadgen.engine.utils.LoadUtils;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Paces one worker against the active load model until the run deadline.
 *
 * <p>Each worker fires every {@code round(workers * 1000 / rate)} ms so that all workers together
 * approximate the aggregate rate. Fire times are absolute: the next one is advanced by one cycle
 * before the work runs, so timer overshoot and slow responses do not accumulate drift. Workers
 * start staggered across one cycle. An infinite rate fires back to back; a zero rate pauses the
 * worker for an hour, cut short by the deadline, a stop request or a configuration update.
 */
@Slf4j
public final class WorkerScheduler {

  static final Duration ZERO_RATE_PAUSE = Duration.ofHours(1);
  private static final long SLEEP_CHUNK_MILLIS = 50L;

  /** Per-worker totals. */
  public record WorkerReport(int workerIndex, long iterations, long failures) {}

  private final String runId;
  private final int workerIndex;
  private final int workerCount;
  private final RuntimeConfigHolder config;
  private final WorkUnit workUnit;
  private final ErrorTracker errors;
  private final long startNanos;
  private final Duration testDuration;
  private final BooleanSupplier stopRequested;
  private final AtomicBoolean rescheduled = new AtomicBoolean();

  public WorkerScheduler(
      String runId,
      int workerIndex,
      int workerCount,
      RuntimeConfigHolder config,
      WorkUnit workUnit,
      ErrorTracker errors,
      long startNanos,
      Duration testDuration,
      BooleanSupplier stopRequested) {
    if (workerCount < 1 || workerIndex < 0 || workerIndex >= workerCount) {
      throw new IllegalArgumentException(
          "Invalid worker " + workerIndex + " of " + workerCount);
    }
    this.runId = runId;
    this.workerIndex = workerIndex;
    this.workerCount = workerCount;
    this.config = Objects.requireNonNull(config, "config");
    this.workUnit = Objects.requireNonNull(workUnit, "workUnit");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.startNanos = startNanos;
    this.testDuration = Objects.requireNonNull(testDuration, "testDuration");
    this.stopRequested = Objects.requireNonNull(stopRequested, "stopRequested");
  }

  /**
   * Per-worker cycle in milliseconds for an aggregate rate: 0 for an unbounded rate, -1 for a zero
   * rate (paused).
   */
  @VisibleForTesting
  static long cycleMillis(double rate, int workers) {
    if (Double.isInfinite(rate) || Double.isNaN(rate)) {
      return 0;
    }
    if (rate <= 0) {
      return -1;
    }
    return Math.round(workers * 1000.0 / rate);
  }

  /** Initial offset of a worker within the first cycle. */
  @VisibleForTesting
  static long staggerMillis(int workerIndex, int workers, long cycleMillis) {
    return cycleMillis <= 0 ? 0 : workerIndex * cycleMillis / workers;
  }

  public WorkerReport run() throws InterruptedException {
    var session = new SessionStore();
    long deadline = startNanos + testDuration.toNanos();
    long totalSecs = testDuration.toSeconds();
    long iterations = 0;
    long failures = 0;

    BooleanSupplier cancelled = () -> shouldStop() || System.nanoTime() >= deadline;

    log.debug("Run {} worker {} started", runId, workerIndex);
    try (var subscription = config.subscribe(updated -> rescheduled.set(true))) {
      long nextFire = System.nanoTime() + initialStagger(totalSecs);

      while (true) {
        waitUntil(nextFire, deadline);
        if (rescheduled.compareAndSet(true, false)) {
          log.debug("Run {} worker {} re-basing schedule after configuration update", runId, workerIndex);
          nextFire = System.nanoTime();
          continue;
        }

        long now = System.nanoTime();
        if (now >= deadline) {
          log.debug("Run {} worker {} reached the duration limit", runId, workerIndex);
          break;
        }
        if (stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
          log.debug("Run {} worker {} stopping on request", runId, workerIndex);
          break;
        }

        var active = config.current();
        double elapsedSecs = (now - startNanos) / 1_000_000_000.0;
        double rate = active.loadModel().currentRate(elapsedSecs, totalSecs);
        long cycle = cycleMillis(rate, workerCount);
        if (cycle > 0) {
          nextFire += TimeUnit.MILLISECONDS.toNanos(cycle);
        } else if (cycle < 0) {
          nextFire = now + ZERO_RATE_PAUSE.toNanos();
          continue;
        } else {
          nextFire = now;
        }

        iterations++;
        try {
          if (!workUnit.run(new IterationContext(workerIndex, session, active, cancelled))) {
            failures++;
          }
        } catch (InterruptedException interrupted) {
          if (cancelled.getAsBoolean()) {
            // stopped or past the deadline while pausing inside the unit
            break;
          }
          throw interrupted;
        } catch (RuntimeException ex) {
          failures++;
          errors.recordException(ex);
          log.error(
              "Run {} worker {} iteration {} failed: {}",
              runId,
              workerIndex,
              iterations,
              ex.getMessage(),
              ex);
        }
      }
    }
    log.debug(
        "Run {} worker {} finished: iterations={} failures={}",
        runId,
        workerIndex,
        iterations,
        failures);
    return new WorkerReport(workerIndex, iterations, failures);
  }

  private long initialStagger(long totalSecs) {
    double rate = config.current().loadModel().currentRate(0.0, totalSecs);
    long stagger = staggerMillis(workerIndex, workerCount, cycleMillis(rate, workerCount));
    return TimeUnit.MILLISECONDS.toNanos(stagger);
  }

  private boolean shouldStop() {
    return stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted();
  }

  /** Sleeps until {@code fireAt}, waking early for the deadline, a stop request or an update. */
  private void waitUntil(long fireAt, long deadline) throws InterruptedException {
    long target = Math.min(fireAt, deadline);
    long remainingMs = TimeUnit.NANOSECONDS.toMillis(target - System.nanoTime());
    if (remainingMs <= 0) {
      return;
    }
    LoadUtils.sleepInChunks(
        remainingMs, SLEEP_CHUNK_MILLIS, () -> rescheduled.get() || stopRequested.getAsBoolean());
  }
}
