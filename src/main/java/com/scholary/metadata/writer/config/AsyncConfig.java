package com.scholary.metadata.writer.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async job execution.
 *
 * <p>Each submitted job runs on one thread of this pool. Pool size and queue capacity bound how
 * many jobs run and wait at once; a submission beyond both is rejected.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "metadataJobExecutor")
  public Executor metadataJobExecutor(JobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("metadata-job-");
    executor.initialize();
    return executor;
  }
}
