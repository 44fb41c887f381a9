package com.mk.fx.qa.loadgen.engine.metrics;

import com.google.common.base.Ticker;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/** Per-label request counts and rates. Unaffected by the latency tracking switch. */
public final class ThroughputTracker {

  private static final long UNSET = Long.MIN_VALUE;

  private final Ticker ticker;
  private final Map<String, Counter> counters = new ConcurrentHashMap<>();
  private final AtomicLong globalFirst = new AtomicLong(UNSET);

  public ThroughputTracker() {
    this(Ticker.systemTicker());
  }

  public ThroughputTracker(Ticker ticker) {
    this.ticker = ticker;
  }

  public void record(String label, Duration elapsed) {
    long now = ticker.read();
    globalFirst.compareAndSet(UNSET, now);
    counters.computeIfAbsent(label, l -> new Counter(now)).add(elapsed);
  }

  public Optional<ThroughputStats> stats(String label) {
    Counter counter = counters.get(label);
    return counter == null ? Optional.empty() : Optional.of(counter.snapshot(ticker.read()));
  }

  public Map<String, ThroughputStats> allStats() {
    long now = ticker.read();
    Map<String, ThroughputStats> result = new TreeMap<>();
    counters.forEach((label, counter) -> result.put(label, counter.snapshot(now)));
    return result;
  }

  /** Requests per second across every label since the first sample of the run. */
  public double totalThroughput() {
    long first = globalFirst.get();
    if (first == UNSET) {
      return 0.0;
    }
    long total = counters.values().stream().mapToLong(c -> c.count.sum()).sum();
    return rate(total, ticker.read() - first);
  }

  public void reset() {
    counters.clear();
    globalFirst.set(UNSET);
  }

  private static double rate(long count, long nanos) {
    return nanos <= 0 ? 0.0 : count / (nanos / 1_000_000_000.0);
  }

  private static final class Counter {
    private final long firstNanos;
    private final LongAdder count = new LongAdder();
    private final LongAdder totalElapsedNanos = new LongAdder();

    private Counter(long firstNanos) {
      this.firstNanos = firstNanos;
    }

    private void add(Duration elapsed) {
      count.increment();
      totalElapsedNanos.add(elapsed == null ? 0 : elapsed.toNanos());
    }

    private ThroughputStats snapshot(long now) {
      long n = count.sum();
      double avgMs = n == 0 ? 0.0 : totalElapsedNanos.sum() / (double) n / 1_000_000.0;
      long window = now - firstNanos;
      return new ThroughputStats(n, avgMs, rate(n, window), Duration.ofNanos(Math.max(0, window)));
    }
  }
}
