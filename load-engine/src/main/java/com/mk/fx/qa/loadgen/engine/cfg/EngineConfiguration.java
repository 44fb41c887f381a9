package com.mk.fx.qa.loadgen.engine.cfg;

import com.mk.fx.qa.loadgen.engine.memory.MemoryGuard;
import com.mk.fx.qa.loadgen.engine.memory.MemoryGuardSettings;
import com.mk.fx.qa.loadgen.engine.memory.MemoryLimitProvider;
import com.mk.fx.qa.loadgen.engine.memory.ProcessMemoryLimitProvider;
import com.mk.fx.qa.loadgen.engine.metrics.EngineContext;
import com.mk.fx.qa.loadgen.engine.metrics.ThroughputTracker;
import com.mk.fx.qa.loadgen.engine.scenario.ScenarioEngine;
import com.mk.fx.qa.loadgen.rest.LoadHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(LoadGeneratorProperties.class)
public class EngineConfiguration {

  @Bean
  public EngineContext engineContext(LoadGeneratorProperties properties) {
    var metrics = properties.getMetrics();
    return new EngineContext(
        metrics.isPercentileTrackingEnabled(),
        metrics.getPercentileSamplingRate(),
        metrics.getMaxHistogramLabels(),
        new ThroughputTracker());
  }

  @Bean
  @ConditionalOnMissingBean
  public MemoryLimitProvider memoryLimitProvider() {
    return new ProcessMemoryLimitProvider();
  }

  @Bean(initMethod = "start", destroyMethod = "stop")
  @ConditionalOnProperty(
      prefix = "loadgen.memory-guard",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public MemoryGuard memoryGuard(
      LoadGeneratorProperties properties, MemoryLimitProvider provider, EngineContext context) {
    var guard = properties.getMemoryGuard();
    var settings =
        new MemoryGuardSettings(
            guard.getWarningThresholdPercent(),
            guard.getCriticalThresholdPercent(),
            guard.isAutoDisableOnWarning(),
            guard.getCheckInterval());
    return new MemoryGuard(settings, provider, context);
  }

  @Bean
  @ConditionalOnProperty(prefix = "loadgen.http", name = "base-url")
  public LoadHttpClient loadHttpClient(LoadGeneratorProperties properties) {
    var http = properties.getHttp();
    return new LoadHttpClient(
        http.getBaseUrl(),
        http.getConnectTimeoutSeconds(),
        http.getRequestTimeoutSeconds(),
        http.getHeaders());
  }

  @Bean
  @ConditionalOnProperty(prefix = "loadgen.http", name = "base-url")
  public ScenarioEngine scenarioEngine(LoadHttpClient loadHttpClient) {
    return new ScenarioEngine(loadHttpClient);
  }
}
