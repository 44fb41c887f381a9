package com.mk.fx.qa.loadgen.engine.memory;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Periodically compares process memory usage with the detected limit and sheds tracking memory
 * under pressure.
 *
 * <p>First crossing of the warning threshold (with auto-disable) switches latency tracking off
 * and rotates every histogram; first crossing of the critical threshold rotates them again.
 * Without auto-disable the guard only logs.
 * Dropping below {@code warning - 10} re-arms both latches but never switches tracking back on.
 */
@Slf4j
public class MemoryGuard {

  private static final double HYSTERESIS_PERCENT = 10.0;

  private final MemoryGuardSettings settings;
  private final MemoryLimitProvider provider;
  private final EngineContext context;

  private ScheduledExecutorService scheduler;
  private volatile Long limitBytes;
  private volatile boolean warningTriggered;
  private volatile boolean criticalTriggered;
  private volatile Instant disabledAt;
  private volatile MemoryStatus lastStatus;

  public MemoryGuard(
      MemoryGuardSettings settings, MemoryLimitProvider provider, EngineContext context) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.provider = Objects.requireNonNull(provider, "provider");
    this.context = Objects.requireNonNull(context, "context");
  }

  /** Detects the limit and starts periodic checks; without a limit the guard stays idle. */
  public synchronized void start() {
    if (scheduler != null) {
      return;
    }
    if (!detectLimit()) {
      return;
    }
    scheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("memory-guard");
              t.setDaemon(true);
              return t;
            });
    long intervalMs = settings.checkInterval().toMillis();
    scheduler.scheduleAtFixedRate(this::safeTick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  public synchronized void stop() {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    try {
      scheduler.awaitTermination(2, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
    scheduler = null;
  }

  @VisibleForTesting
  boolean detectLimit() {
    Optional<Long> limit = provider.detectLimit();
    if (limit.isEmpty() || limit.get() <= 0) {
      log.warn("Could not detect a memory limit; memory guard disabled");
      return false;
    }
    limitBytes = limit.get();
    log.info(
        "Memory guard active: limit={} MB warning={}% critical={}% autoDisable={} interval={}",
        limitBytes / (1024 * 1024),
        settings.warningThresholdPercent(),
        settings.criticalThresholdPercent(),
        settings.autoDisable(),
        settings.checkInterval());
    return true;
  }

  private void safeTick() {
    try {
      tick();
    } catch (RuntimeException e) {
      log.error("Memory guard check failed: {}", e.getMessage(), e);
    }
  }

  /** One check; returns the status observed, or empty when usage or limit is unknown. */
  @VisibleForTesting
  synchronized Optional<MemoryStatus> tick() {
    Long limit = limitBytes;
    if (limit == null) {
      return Optional.empty();
    }
    Optional<Long> usage = provider.currentUsage();
    if (usage.isEmpty()) {
      log.debug("Memory usage unavailable, skipping check");
      return Optional.empty();
    }
    MemoryStatus status = MemoryStatus.of(usage.get(), limit);
    lastStatus = status;
    double percent = status.usagePercent();

    if (percent >= settings.warningThresholdPercent() && !warningTriggered) {
      warningTriggered = true;
      log.warn(
          "Memory usage {}% crossed warning threshold {}% ({} / {} MB)",
          String.format("%.1f", percent),
          settings.warningThresholdPercent(),
          status.usedBytes() / (1024 * 1024),
          limit / (1024 * 1024));
      if (settings.autoDisable()) {
        if (context.disableLatencyTracking()) {
          disabledAt = Instant.now();
        }
        context.rotateAllHistograms();
      }
    }

    if (percent >= settings.criticalThresholdPercent() && !criticalTriggered) {
      criticalTriggered = true;
      log.error(
          "Memory usage {}% crossed critical threshold {}%",
          String.format("%.1f", percent),
          settings.criticalThresholdPercent());
      if (settings.autoDisable()) {
        context.rotateAllHistograms();
      }
    }

    if (percent < settings.warningThresholdPercent() - HYSTERESIS_PERCENT
        && (warningTriggered || criticalTriggered)) {
      warningTriggered = false;
      criticalTriggered = false;
      log.info(
          "Memory usage back to {}%; thresholds re-armed, latency tracking stays {}",
          String.format("%.1f", percent),
          context.isTrackingActive() ? "on" : "off");
    }
    return Optional.of(status);
  }

  public boolean isWarningTriggered() {
    return warningTriggered;
  }

  public boolean isCriticalTriggered() {
    return criticalTriggered;
  }

  public Optional<Instant> disabledAt() {
    return Optional.ofNullable(disabledAt);
  }

  public Optional<Long> limitBytes() {
    return Optional.ofNullable(limitBytes);
  }

  public Optional<MemoryStatus> lastStatus() {
    return Optional.ofNullable(lastStatus);
  }
}
