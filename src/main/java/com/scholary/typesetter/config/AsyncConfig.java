package com.scholary.typesetter.config;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Sets up a bounded thread pool for image dimension probes and the hyphenation pass, and a
 * single scheduler thread that drives karaoke highlight frames.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${typesetter.asyncExecutorThreads}") int threads,
      @Value("${typesetter.asyncExecutorQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("typesetter-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "frameScheduler", destroyMethod = "shutdownNow")
  public ScheduledExecutorService frameSchedulerExecutor() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "karaoke-frames");
          thread.setDaemon(true);
          return thread;
        });
  }
}
