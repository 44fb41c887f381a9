package com.mk.fx.qa.loadgen.engine.metrics;

import com.mk.fx.qa.loadgen.engine.scenario.ScenarioResult;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * State shared by every worker and by the memory guard for one process: the trackers, the
 * latency-tracking switch, the sampling counter and the outcome listeners. Built once at startup.
 */
@Slf4j
@Getter
public class EngineContext {

  private final LatencyTracker requestLatency = new LatencyTracker("requests");
  private final MultiLabelLatencyTracker scenarioLatency;
  private final MultiLabelLatencyTracker stepLatency;
  private final ThroughputTracker throughput;
  private final ErrorTracker errors = new ErrorTracker();

  private final boolean percentileTrackingEnabled;
  private final int samplingRate;

  @Getter(lombok.AccessLevel.NONE)
  private final AtomicBoolean trackingActive;

  @Getter(lombok.AccessLevel.NONE)
  private final AtomicLong samplingCounter = new AtomicLong();

  @Getter(lombok.AccessLevel.NONE)
  private final List<OutcomeListener> listeners = new CopyOnWriteArrayList<>();

  public EngineContext() {
    this(true, 100, MultiLabelLatencyTracker.DEFAULT_MAX_LABELS, new ThroughputTracker());
  }

  /**
   * @param percentileTrackingEnabled initial state of the latency tracking switch
   * @param samplingRate percentage of requests whose latency is recorded, 1 to 100
   * @param maxLabels bound on scenario and step labels
   */
  public EngineContext(
      boolean percentileTrackingEnabled,
      int samplingRate,
      int maxLabels,
      ThroughputTracker throughput) {
    if (samplingRate < 1 || samplingRate > 100) {
      throw new IllegalArgumentException("samplingRate must be within 1..100 but was " + samplingRate);
    }
    this.percentileTrackingEnabled = percentileTrackingEnabled;
    this.samplingRate = samplingRate;
    this.trackingActive = new AtomicBoolean(percentileTrackingEnabled);
    this.scenarioLatency = new MultiLabelLatencyTracker("scenarios", maxLabels);
    this.stepLatency = new MultiLabelLatencyTracker("steps", maxLabels);
    this.throughput = throughput;
  }

  public boolean isTrackingActive() {
    return trackingActive.get();
  }

  /**
   * Whether the next latency sample should be recorded. False once tracking is switched off;
   * otherwise a deterministic {@code samplingRate} out of every 100 calls.
   */
  public boolean shouldRecordLatency() {
    if (!trackingActive.get()) {
      return false;
    }
    if (samplingRate >= 100) {
      return true;
    }
    return samplingCounter.getAndIncrement() % 100 < samplingRate;
  }

  /** One-way switch; there is no way back on within a process run. */
  public boolean disableLatencyTracking() {
    boolean changed = trackingActive.compareAndSet(true, false);
    if (changed) {
      log.warn("Latency percentile tracking disabled; throughput is still recorded");
    }
    return changed;
  }

  public void rotateAllHistograms() {
    requestLatency.rotate();
    scenarioLatency.rotate();
    stepLatency.rotate();
  }

  public void addListener(OutcomeListener listener) {
    listeners.add(listener);
  }

  public void removeListener(OutcomeListener listener) {
    listeners.remove(listener);
  }

  public void publish(RequestOutcome outcome) {
    for (OutcomeListener listener : listeners) {
      try {
        listener.onRequest(outcome);
      } catch (RuntimeException e) {
        log.warn("Outcome listener {} failed: {}", listener, e.getMessage());
      }
    }
  }

  public void publish(ScenarioResult result) {
    for (OutcomeListener listener : listeners) {
      try {
        listener.onScenario(result);
      } catch (RuntimeException e) {
        log.warn("Outcome listener {} failed: {}", listener, e.getMessage());
      }
    }
  }

  /** Logs the latency, throughput and error tables. */
  public void logSummary() {
    log.info("\n{}", ReportFormatter.latencyTable("Request latency", requestStatsAsMap()));
    log.info("\n{}", ReportFormatter.latencyTable("Scenario latency", scenarioLatency.allStats()));
    log.info("\n{}", ReportFormatter.latencyTable("Step latency", stepLatency.allStats()));
    log.info("\n{}", ReportFormatter.throughputTable(throughput.allStats(), throughput.totalThroughput()));
    if (errors.totalErrors() > 0) {
      log.info("\n{}", ReportFormatter.errorTable(errors.totalErrors(), errors.breakdownSnapshot()));
    }
  }

  private Map<String, LatencyStats> requestStatsAsMap() {
    return requestLatency.stats().map(s -> Map.of("requests", s)).orElse(Map.of());
  }
}
