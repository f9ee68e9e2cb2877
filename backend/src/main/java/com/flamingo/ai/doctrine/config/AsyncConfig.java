package com.flamingo.ai.doctrine.config;

import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async ingestion runs.
 *
 * <p>Each run gets its own chapter worker pool inside the pipeline; this executor only hosts the
 * coordinating thread of each run.
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor(IngestConfig ingestConfig) {
    IngestConfig.Pipeline pipeline = ingestConfig.getPipeline();
    int maxRuns = Math.max(1, pipeline.getMaxConcurrentRuns());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(maxRuns);
    executor.setMaxPoolSize(maxRuns);
    int queueCapacity = Math.max(0, pipeline.getRunQueueCapacity());
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("ingest-run-");
    executor.initialize();
    log.info("Ingestion executor: {} concurrent runs, queue {}", maxRuns, queueCapacity);
    return executor;
  }
}
