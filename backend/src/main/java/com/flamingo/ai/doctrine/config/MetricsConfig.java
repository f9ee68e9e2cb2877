package com.flamingo.ai.doctrine.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics wiring. Pipeline counters and timers are registered by {@code IngestMetrics}; this class
 * only tags them and enables {@code @Timed} on the pipeline and run entry points.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> ingestCommonTags(
      @Value("${spring.application.name:doctrine-ingest}") String applicationName,
      @Value("${ingest.extraction.model:unknown}") String model) {
    return registry -> registry.config().commonTags("application", applicationName, "model", model);
  }
}
