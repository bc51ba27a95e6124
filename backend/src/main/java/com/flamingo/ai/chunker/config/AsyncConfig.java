package com.flamingo.ai.chunker.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors used to chunk the pages of one document concurrently. */
@Configuration
public class AsyncConfig {

  @Bean(name = "pageChunkingExecutor")
  public Executor pageChunkingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("page-chunk-");
    executor.initialize();
    return executor;
  }
}
