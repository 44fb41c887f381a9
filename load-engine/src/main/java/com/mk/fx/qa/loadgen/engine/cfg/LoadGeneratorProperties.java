package com.mk.fx.qa.loadgen.engine.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "loadgen")
public class LoadGeneratorProperties {

  @Valid private Metrics metrics = new Metrics();

  @Valid private MemoryGuard memoryGuard = new MemoryGuard();

  @Valid private Http http = new Http();

  @Valid private Run run = new Run();

  @Data
  public static class Metrics {
    private boolean percentileTrackingEnabled = true;

    @Min(1)
    @Max(100)
    private int percentileSamplingRate = 100;

    @Min(1)
    @Max(10_000)
    private int maxHistogramLabels = 100;
  }

  @Data
  public static class MemoryGuard {
    private boolean enabled = true;

    @DecimalMin("1.0")
    @DecimalMax("100.0")
    private double warningThresholdPercent = 80.0;

    @DecimalMin("1.0")
    @DecimalMax("100.0")
    private double criticalThresholdPercent = 90.0;

    private boolean autoDisableOnWarning = true;

    @NotNull private Duration checkInterval = Duration.ofSeconds(5);
  }

  @Data
  public static class Http {
    /** Target base URL; HTTP beans are only created when set. */
    private String baseUrl;

    @Positive private int connectTimeoutSeconds = 10;

    @Positive private int requestTimeoutSeconds = 30;

    private Map<String, String> headers = new LinkedHashMap<>();
  }

  /** Optional single-request run started with the application. */
  @Data
  public static class Run {
    private boolean enabled = false;

    @Min(1)
    private int workers = 10;

    @NotNull private Duration duration = Duration.ofMinutes(1);

    /** Aggregate target rate; unset means unbounded (concurrent) load. */
    @DecimalMin("0.0")
    private Double targetRps;

    private String method = "GET";

    private String path = "/";

    private String body;
  }
}
