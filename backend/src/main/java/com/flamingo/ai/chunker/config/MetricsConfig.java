package com.flamingo.ai.chunker.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Registers the aspect behind the {@code chunking.document} timer on document runs. */
@Configuration
public class MetricsConfig {

  /** Makes {@code @Timed} on service methods record into {@code registry}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
