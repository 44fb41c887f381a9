package com.mk.fx.qa.loadgen.engine.metrics;

import com.mk.fx.qa.loadgen.engine.error.ErrorCategory;
import java.util.Map;

/** Fixed-width text tables for the end-of-run summary. */
public final class ReportFormatter {

  private static final int LABEL_WIDTH = 32;

  private ReportFormatter() {
    throw new UnsupportedOperationException("ReportFormatter cannot be instantiated");
  }

  public static String latencyTable(String title, Map<String, LatencyStats> stats) {
    var sb = new StringBuilder();
    sb.append("== ").append(title).append(" (ms) ==\n");
    sb.append(
        String.format(
            "%-" + LABEL_WIDTH + "s %10s %9s %9s %9s %9s %9s %9s %9s%n",
            "label", "count", "min", "p50", "p90", "p95", "p99", "p99.9", "max"));
    if (stats.isEmpty()) {
      sb.append("(no samples)\n");
      return sb.toString();
    }
    stats.forEach(
        (label, s) ->
            sb.append(
                String.format(
                    "%-" + LABEL_WIDTH + "s %10d %9.2f %9.2f %9.2f %9.2f %9.2f %9.2f %9.2f%n",
                    truncate(label),
                    s.count(),
                    s.min() / 1000.0,
                    s.p50() / 1000.0,
                    s.p90() / 1000.0,
                    s.p95() / 1000.0,
                    s.p99() / 1000.0,
                    s.p999() / 1000.0,
                    s.max() / 1000.0)));
    return sb.toString();
  }

  public static String throughputTable(Map<String, ThroughputStats> stats, double totalRps) {
    var sb = new StringBuilder();
    sb.append("== Throughput ==\n");
    sb.append(
        String.format(
            "%-" + LABEL_WIDTH + "s %10s %10s %10s %10s%n",
            "label", "count", "rps", "avg(ms)", "window(s)"));
    stats.forEach(
        (label, s) ->
            sb.append(
                String.format(
                    "%-" + LABEL_WIDTH + "s %10d %10.2f %10.2f %10.1f%n",
                    truncate(label),
                    s.totalCount(),
                    s.rps(),
                    s.avgTimeMs(),
                    s.duration().toMillis() / 1000.0)));
    sb.append(String.format("%-" + LABEL_WIDTH + "s %10s %10.2f%n", "TOTAL", "", totalRps));
    return sb.toString();
  }

  public static String errorTable(long total, Map<ErrorCategory, Long> breakdown) {
    var sb = new StringBuilder();
    sb.append("== Errors (").append(total).append(") ==\n");
    breakdown.forEach(
        (category, count) ->
            sb.append(String.format("%-" + LABEL_WIDTH + "s %10d%n", category.label(), count)));
    return sb.toString();
  }

  private static String truncate(String label) {
    return label.length() <= LABEL_WIDTH ? label : label.substring(0, LABEL_WIDTH - 3) + "...";
  }
}
