package com.mk.fx.qa.loadgen.engine.metrics;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * One {@link LatencyTracker} per label with a bounded number of labels. Least recently used
 * labels are evicted once the bound is reached; a single warning is logged at 80% occupancy.
 */
@Slf4j
public final class MultiLabelLatencyTracker {

  public static final int DEFAULT_MAX_LABELS = 100;

  private final String name;
  private final int maxLabels;
  private final Cache<String, LatencyTracker> trackers;
  private final AtomicLong evictions = new AtomicLong();
  private final AtomicBoolean capacityWarned = new AtomicBoolean();

  public MultiLabelLatencyTracker(String name) {
    this(name, DEFAULT_MAX_LABELS);
  }

  public MultiLabelLatencyTracker(String name, int maxLabels) {
    if (maxLabels < 1) {
      throw new IllegalArgumentException("maxLabels must be >= 1");
    }
    this.name = name;
    this.maxLabels = maxLabels;
    this.trackers =
        CacheBuilder.newBuilder()
            // single segment so eviction order is LRU across all labels
            .concurrencyLevel(1)
            .maximumSize(maxLabels)
            .<String, LatencyTracker>removalListener(
                notification -> {
                  if (notification.getCause() == RemovalCause.SIZE) {
                    evictions.incrementAndGet();
                    log.debug("Evicted latency label {} from {}", notification.getKey(), name);
                  }
                })
            .build();
  }

  public void record(String label, long micros) {
    tracker(label).record(micros);
  }

  public void recordMillis(String label, long millis) {
    tracker(label).recordMillis(millis);
  }

  public Optional<LatencyStats> stats(String label) {
    LatencyTracker tracker = trackers.getIfPresent(label);
    return tracker == null ? Optional.empty() : tracker.stats();
  }

  /** Stats for every label with samples, ordered by label. */
  public Map<String, LatencyStats> allStats() {
    Map<String, LatencyStats> result = new TreeMap<>();
    trackers.asMap().forEach((label, tracker) -> tracker.stats().ifPresent(s -> result.put(label, s)));
    return result;
  }

  public Set<String> labels() {
    return new TreeSet<>(trackers.asMap().keySet());
  }

  public long evictions() {
    return evictions.get();
  }

  /** Drops every label and histogram. */
  public void rotate() {
    long labels = trackers.size();
    trackers.invalidateAll();
    trackers.cleanUp();
    capacityWarned.set(false);
    log.info("Rotated {} latency tracker ({} labels released)", name, labels);
  }

  public void reset() {
    trackers.asMap().values().forEach(LatencyTracker::reset);
  }

  private LatencyTracker tracker(String label) {
    try {
      LatencyTracker tracker = trackers.get(label, () -> new LatencyTracker(name + ":" + label));
      checkCapacity();
      return tracker;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Unable to create latency tracker for " + label, e.getCause());
    }
  }

  private void checkCapacity() {
    long size = trackers.size();
    if (size * 100 >= maxLabels * 80L && capacityWarned.compareAndSet(false, true)) {
      log.warn(
          "Latency tracker {} holds {} of {} labels; least recently used labels will be evicted",
          name,
          size,
          maxLabels);
    }
  }
}
