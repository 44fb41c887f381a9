package com.mk.fx.qa.loadgen.engine.model;

import com.mk.fx.qa.loadgen.engine.error.LoadConfigException;
import java.time.Duration;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Temporal rate curve driving the workers. Every variant is immutable and {@link
 * #currentRate(double, double)} is a pure function of the elapsed time.
 */
public sealed interface LoadModel {

  /**
   * Aggregate target rate at the given instant.
   *
   * @param elapsedSecs seconds since the run started
   * @param totalDurationSecs configured run duration in seconds
   * @return requests per second, or {@link Double#POSITIVE_INFINITY} for unbounded load
   */
  double currentRate(double elapsedSecs, double totalDurationSecs);

  /** Short summary used in run logs. */
  String describe();

  /** Unbounded load: workers fire back to back, limited only by response latency. */
  record Concurrent() implements LoadModel {
    @Override
    public double currentRate(double elapsedSecs, double totalDurationSecs) {
      return Double.POSITIVE_INFINITY;
    }

    @Override
    public String describe() {
      return "concurrent (no pacing)";
    }
  }

  /** Constant target rate. */
  record Rps(double target) implements LoadModel {
    public Rps {
      requireRate("target", target);
    }

    @Override
    public double currentRate(double elapsedSecs, double totalDurationSecs) {
      return target;
    }

    @Override
    public String describe() {
      return String.format("constant %.1f rps", target);
    }
  }

  /** Linear ramp from {@code min} to {@code max}, then hold at {@code max}. */
  record RampRps(double min, double max, Duration rampDuration) implements LoadModel {
    public RampRps {
      requireRate("min", min);
      requireRate("max", max);
      requireDuration("rampDuration", rampDuration);
    }

    @Override
    public double currentRate(double elapsedSecs, double totalDurationSecs) {
      double ramp = seconds(rampDuration);
      if (ramp <= 0) {
        return max;
      }
      double progress = Math.max(0, Math.min(1, elapsedSecs / ramp));
      return min + (max - min) * progress;
    }

    @Override
    public String describe() {
      return String.format("ramp %.1f -> %.1f rps over %s", min, max, rampDuration);
    }
  }

  /**
   * Repeating daily shape: morning ramp min to max, peak sustain, decline to mid, mid sustain,
   * evening decline to min, then night at min for whatever is left of the cycle. Phase lengths are
   * ratios of the cycle; when they add up to more than 1 the night phase never runs.
   */
  @Slf4j
  record DailyTraffic(
      double min,
      double mid,
      double max,
      Duration cycleDuration,
      double morningRampRatio,
      double peakSustainRatio,
      double midDeclineRatio,
      double midSustainRatio,
      double eveningDeclineRatio)
      implements LoadModel {

    public DailyTraffic {
      requireRate("min", min);
      requireRate("mid", mid);
      requireRate("max", max);
      requireDuration("cycleDuration", cycleDuration);
      requireRatio("morningRampRatio", morningRampRatio);
      requireRatio("peakSustainRatio", peakSustainRatio);
      requireRatio("midDeclineRatio", midDeclineRatio);
      requireRatio("midSustainRatio", midSustainRatio);
      requireRatio("eveningDeclineRatio", eveningDeclineRatio);
      double sum =
          morningRampRatio
              + peakSustainRatio
              + midDeclineRatio
              + midSustainRatio
              + eveningDeclineRatio;
      if (sum > 1.0) {
        log.warn(
            "Daily traffic phase ratios sum to {} (> 1.0); the night phase will be skipped",
            String.format("%.3f", sum));
      }
    }

    @Override
    public double currentRate(double elapsedSecs, double totalDurationSecs) {
      double cycle = seconds(cycleDuration);
      if (cycle <= 0) {
        return max;
      }
      double t = elapsedSecs % cycle;
      if (t < 0) {
        t += cycle;
      }

      double morningEnd = morningRampRatio * cycle;
      double peakEnd = morningEnd + peakSustainRatio * cycle;
      double declineEnd = peakEnd + midDeclineRatio * cycle;
      double midEnd = declineEnd + midSustainRatio * cycle;
      double eveningEnd = midEnd + eveningDeclineRatio * cycle;

      if (t < morningEnd) {
        return interpolate(min, max, t / morningEnd);
      }
      if (t < peakEnd) {
        return max;
      }
      if (t < declineEnd) {
        return interpolate(max, mid, (t - peakEnd) / (declineEnd - peakEnd));
      }
      if (t < midEnd) {
        return mid;
      }
      if (t < eveningEnd) {
        return interpolate(mid, min, (t - midEnd) / (eveningEnd - midEnd));
      }
      return min;
    }

    @Override
    public String describe() {
      return String.format(
          "daily traffic min=%.1f mid=%.1f max=%.1f rps, cycle %s", min, mid, max, cycleDuration);
    }

    private static double interpolate(double from, double to, double progress) {
      return from + (to - from) * progress;
    }
  }

  private static double seconds(Duration duration) {
    return duration.toNanos() / 1_000_000_000.0;
  }

  private static void requireRate(String field, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new LoadConfigException(field, "must be a finite, non-negative rate but was " + value);
    }
  }

  private static void requireRatio(String field, double value) {
    if (!Double.isFinite(value) || value < 0) {
      throw new LoadConfigException(field, "must be a finite, non-negative ratio but was " + value);
    }
  }

  private static void requireDuration(String field, Duration value) {
    Objects.requireNonNull(value, field);
    if (value.isNegative()) {
      throw new LoadConfigException(field, "must not be negative but was " + value);
    }
  }
}
