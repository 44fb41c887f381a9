package com.mk.fx.qa.loadgen.engine.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.loadgen.engine.cfg.RuntimeConfigHolder;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a fixed number of paced workers for the configured duration and logs the summary tables
 * when they are done.
 *
 * <p>Threading: one daemon thread per worker from a fixed pool. Workers share the {@link
 * EngineContext} and the {@link RuntimeConfigHolder}; each owns its own cookie session.
 */
@Slf4j
public final class LoadRunner {

  private LoadRunner() {
    throw new UnsupportedOperationException("LoadRunner cannot be instantiated");
  }

  /**
   * Runs the load.
   *
   * @param runId identifier used for thread names and logs
   * @param parameters worker count and duration
   * @param config active load model and scenarios; may be replaced during the run
   * @param context shared trackers
   * @param workUnit what each worker does per iteration
   * @param cancellationRequested checked between iterations and while waiting
   * @return totals over all workers
   * @throws InterruptedException if the calling thread is interrupted while waiting for workers
   */
  public static RunResult execute(
      String runId,
      RunParameters parameters,
      RuntimeConfigHolder config,
      EngineContext context,
      WorkUnit workUnit,
      BooleanSupplier cancellationRequested)
      throws InterruptedException {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(workUnit, "workUnit");
    Objects.requireNonNull(cancellationRequested, "cancellationRequested");

    var workers = parameters.workers();
    log.info(
        "Run {} starting: {} workers for {} with {}",
        runId,
        workers,
        parameters.testDuration(),
        config.current().loadModel().describe());

    var threadIds = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("load-worker-" + runId + "-" + threadIds.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };

    var executor = newFixedThreadPool(workers, threadFactory);
    var startNanos = System.nanoTime();
    List<Future<WorkerScheduler.WorkerReport>> futures = new ArrayList<>(workers);
    long iterations = 0;
    long failures = 0;

    try {
      for (int index = 0; index < workers; index++) {
        var scheduler =
            new WorkerScheduler(
                runId,
                index,
                workers,
                config,
                workUnit,
                context.getErrors(),
                startNanos,
                parameters.testDuration(),
                cancellationRequested);
        futures.add(executor.submit(scheduler::run));
      }

      for (Future<WorkerScheduler.WorkerReport> future : futures) {
        try {
          var report = future.get();
          iterations += report.iterations();
          failures += report.failures();
        } catch (ExecutionException e) {
          log.error("Run {} worker terminated abnormally: {}", runId, e.getCause().getMessage(), e.getCause());
        }
      }
    } finally {
      executor.shutdownNow();
      try {
        executor.awaitTermination(30, TimeUnit.SECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        throw interrupted;
      }
    }

    var elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    var cancelled = cancellationRequested.getAsBoolean();
    log.info(
        "Run {} finished in {} ms: iterations={} failures={} cancelled={} trackingActive={}",
        runId,
        elapsed.toMillis(),
        iterations,
        failures,
        cancelled,
        context.isTrackingActive());
    context.logSummary();
    return new RunResult(workers, iterations, failures, cancelled, elapsed);
  }
}
