package com.flamingo.ai.smartretrieval.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Micrometer setup for retrieval, search and collaborator metrics. */
@Configuration
public class MetricsConfig {

  @Value("${spring.application.name:smart-retrieval}")
  private String applicationName;

  /** Backs {@code @Timed} on the retrieval and search entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> commonTags() {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
