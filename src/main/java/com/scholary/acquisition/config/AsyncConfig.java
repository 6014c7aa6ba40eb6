package com.scholary.acquisition.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for background work.
 *
 * <p>{@code monitorExecutor} runs download monitors, which live as long as their downloads. It has
 * no queue: a monitor that finds every thread busy gets a new one, so one batch never waits behind
 * another. {@code streamExecutor} runs server-sent event streams, which live as long as the client
 * stays connected; it is capped at {@code async.maxStreams} and rejects beyond that. {@code
 * workerExecutor} runs short jobs: per-peer transfer submission and singleton imports.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "monitorExecutor")
  @Primary
  public Executor monitorExecutor(@Value("${async.threads}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(Integer.MAX_VALUE);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("monitor-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamExecutor")
  public Executor streamExecutor(@Value("${async.maxStreams}") int maxStreams) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(0);
    executor.setMaxPoolSize(maxStreams);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("stream-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "workerExecutor")
  public Executor workerExecutor(
      @Value("${async.threads}") int threads, @Value("${async.queueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("acquisition-");
    executor.initialize();
    return executor;
  }
}
