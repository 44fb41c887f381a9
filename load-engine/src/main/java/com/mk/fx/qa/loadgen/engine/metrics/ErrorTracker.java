package com.mk.fx.qa.loadgen.engine.metrics;

import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/** Failure counters per {@link ErrorCategory} plus the first few samples for the run report. */
public final class ErrorTracker {

  static final int MAX_ERROR_SAMPLES = 5;

  /** A recorded failure; {@code stack} is empty unless an exception was involved. */
  public record ErrorSample(ErrorCategory category, String message, List<String> stack) {}

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<ErrorCategory, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();
  private final List<ErrorSample> errorSamples = new CopyOnWriteArrayList<>();

  public void recordFailure(ErrorCategory category, String message) {
    var key = category == null ? ErrorCategory.OTHER_ERROR : category;
    increment(key);
    if (errorSamples.size() < MAX_ERROR_SAMPLES) {
      errorSamples.add(new ErrorSample(key, message == null ? key.label() : message, List.of()));
    }
  }

  /** Records an unexpected exception thrown by a unit of work. */
  public void recordException(Throwable t) {
    increment(ErrorCategory.OTHER_ERROR);
    if (t != null && errorSamples.size() < MAX_ERROR_SAMPLES) {
      errorSamples.add(buildErrorSample(t));
    }
  }

  public long totalErrors() {
    return totalErrors.get();
  }

  public Map<ErrorCategory, Long> breakdownSnapshot() {
    Map<ErrorCategory, Long> map = new EnumMap<>(ErrorCategory.class);
    for (var e : errorBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return map;
  }

  public List<ErrorSample> samplesSnapshot() {
    return List.copyOf(errorSamples);
  }

  public void reset() {
    totalErrors.set(0);
    errorBreakdown.clear();
    errorSamples.clear();
  }

  private void increment(ErrorCategory key) {
    totalErrors.incrementAndGet();
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  private ErrorSample buildErrorSample(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }

    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = rootCause.getClass().getSimpleName() + " occurred";
    }

    List<String> frames = new ArrayList<>();
    if (rootCause != t) {
      frames.add(
          "ROOT CAUSE: "
              + rootCause.getClass().getSimpleName()
              + " - "
              + (rootCause.getMessage() != null ? rootCause.getMessage() : "no message"));
      StackTraceElement[] rootStack = rootCause.getStackTrace();
      for (int i = 0; i < Math.min(3, rootStack.length); i++) {
        frames.add("  at " + rootStack[i]);
      }
      frames.add("");
    }

    frames.add("WRAPPED BY: " + t.getClass().getSimpleName());
    StackTraceElement[] stackTrace = t.getStackTrace();
    for (int i = 0; i < Math.min(10, stackTrace.length); i++) {
      frames.add("  at " + stackTrace[i]);
    }
    return new ErrorSample(ErrorCategory.OTHER_ERROR, msg, List.copyOf(frames));
  }
}
