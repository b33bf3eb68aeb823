package com.scholary.poster.config;

import com.scholary.poster.notification.EventStreamProperties;
import com.scholary.poster.render.RenderProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Two bounded pools:
 *
 * <ul>
 *   <li>{@code renderExecutor} runs one renderer per task. Its size is the number of posters
 *       rendered at the same time; queued jobs stay PENDING until a thread is free.
 *   <li>{@code eventStreamExecutor} pumps job updates into server-sent event connections, one task
 *       per connected client.
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "renderExecutor")
  public ThreadPoolTaskExecutor renderExecutor(RenderProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("render-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "eventStreamExecutor")
  public ThreadPoolTaskExecutor eventStreamExecutor(EventStreamProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.streamThreads());
    executor.setMaxPoolSize(properties.streamThreads());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("job-events-");
    executor.initialize();
    return executor;
  }
}
