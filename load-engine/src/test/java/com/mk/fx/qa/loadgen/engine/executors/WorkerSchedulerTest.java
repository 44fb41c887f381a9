package com.mk.fx.qa.loadgen.engine.executors;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfigHolder;
import com.mk.fx.qa.loadgen.engine.metrics.ErrorTracker;
import com.mk.fx.qa.loadgen.engine.model.LoadModel;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class WorkerSchedulerTest {

  private static BooleanSupplier neverCancel() {
    return () -> false;
  }

  private static WorkerScheduler scheduler(
      RuntimeConfigHolder config,
      WorkUnit unit,
      ErrorTracker errors,
      Duration duration,
      BooleanSupplier stop) {
    return new WorkerScheduler(
        "test", 0, 1, config, unit, errors, System.nanoTime(), duration, stop);
  }

  @Test
  void cycleAndStagger_followTheRate() {
    assertEquals(100, WorkerScheduler.cycleMillis(100, 10));
    assertEquals(3, WorkerScheduler.cycleMillis(300, 1));
    assertEquals(0, WorkerScheduler.cycleMillis(Double.POSITIVE_INFINITY, 4));
    assertEquals(-1, WorkerScheduler.cycleMillis(0, 4));
    assertEquals(30, WorkerScheduler.staggerMillis(3, 10, 100));
    assertEquals(0, WorkerScheduler.staggerMillis(3, 10, 0));
  }

  @Test
  void pacedWorker_approximatesTargetRate() throws Exception {
    var count = new AtomicInteger();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(50));

    var report =
        scheduler(
                config,
                it -> {
                  count.incrementAndGet();
                  return true;
                },
                new ErrorTracker(),
                Duration.ofMillis(600),
                neverCancel())
            .run();

    // 20 ms cycle over 600 ms
    assertTrue(report.iterations() >= 20 && report.iterations() <= 32, "iterations " + report.iterations());
    assertEquals(count.get(), report.iterations());
    assertEquals(0, report.failures());
  }

  @Test
  void concurrentModel_firesBackToBackUntilDeadline() throws Exception {
    var config = new RuntimeConfigHolder(new LoadModel.Concurrent());
    var start = System.nanoTime();

    var report =
        scheduler(config, it -> true, new ErrorTracker(), Duration.ofMillis(200), neverCancel()).run();

    assertTrue(report.iterations() > 100);
    assertTrue((System.nanoTime() - start) / 1_000_000 < 1_000);
  }

  @Test
  void zeroRate_pausesUntilDeadline() throws Exception {
    var config = new RuntimeConfigHolder(new LoadModel.Rps(0));
    var start = System.nanoTime();

    var report =
        scheduler(config, it -> true, new ErrorTracker(), Duration.ofMillis(300), neverCancel()).run();

    assertEquals(0, report.iterations());
    var elapsedMs = (System.nanoTime() - start) / 1_000_000;
    assertTrue(elapsedMs >= 250 && elapsedMs < 2_000, "elapsed " + elapsedMs);
  }

  @Test
  void configurationUpdate_wakesPausedWorker() throws Exception {
    var config = new RuntimeConfigHolder(new LoadModel.Rps(0));
    var updater = Executors.newSingleThreadScheduledExecutor();
    updater.schedule(() -> config.updateLoadModel(new LoadModel.Rps(100)), 100, TimeUnit.MILLISECONDS);
    try {
      var report =
          scheduler(config, it -> true, new ErrorTracker(), Duration.ofMillis(600), neverCancel())
              .run();
      assertTrue(report.iterations() > 10, "iterations " + report.iterations());
    } finally {
      updater.shutdownNow();
    }
  }

  @Test
  void failingWork_isRecorded_andLoopContinues() throws Exception {
    var errors = new ErrorTracker();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(100));
    var calls = new AtomicInteger();

    var report =
        scheduler(
                config,
                it -> {
                  if (calls.incrementAndGet() % 2 == 0) {
                    throw new IllegalStateException("boom");
                  }
                  return false;
                },
                errors,
                Duration.ofMillis(300),
                neverCancel())
            .run();

    assertTrue(report.iterations() > 5);
    assertEquals(report.iterations(), report.failures());
    assertEquals(report.iterations() / 2, errors.totalErrors());
  }

  @Test
  void stopRequest_endsTheLoopEarly() throws Exception {
    var stop = new AtomicBoolean();
    var config = new RuntimeConfigHolder(new LoadModel.Rps(100));
    var start = System.nanoTime();

    var report =
        scheduler(
                config,
                it -> {
                  stop.set(true);
                  return true;
                },
                new ErrorTracker(),
                Duration.ofSeconds(10),
                stop::get)
            .run();

    assertEquals(1, report.iterations());
    assertTrue((System.nanoTime() - start) / 1_000_000 < 2_000);
  }

  @Test
  void runDeadline_cancelsWorkInsideAnIteration() throws Exception {
    var config = new RuntimeConfigHolder(new LoadModel.Concurrent());
    var sawCancel = new AtomicBoolean();
    var start = System.nanoTime();

    var report =
        scheduler(
                config,
                it -> {
                  long giveUp = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
                  while (!it.cancelled().getAsBoolean()) {
                    if (System.nanoTime() > giveUp) {
                      return false;
                    }
                    Thread.sleep(10);
                  }
                  sawCancel.set(true);
                  throw new InterruptedException("Cancelled during think time");
                },
                new ErrorTracker(),
                Duration.ofMillis(200),
                neverCancel())
            .run();

    assertTrue(sawCancel.get());
    assertEquals(1, report.iterations());
    assertEquals(0, report.failures());
    assertTrue((System.nanoTime() - start) / 1_000_000 < 2_000);
  }

  @Test
  void invalidWorkerIndex_isRejected() {
    var config = new RuntimeConfigHolder(new LoadModel.Concurrent());
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new WorkerScheduler(
                "t", 2, 2, config, it -> true, new ErrorTracker(), 0, Duration.ofSeconds(1), () -> false));
  }
}
