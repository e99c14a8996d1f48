package com.atasa.audio.processor.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for background job execution.
 *
 * <p>Every accepted extraction or transcription request runs as one task on this bounded pool, so
 * HTTP threads never wait on yt-dlp or a provider. When all threads are busy and the queue is full
 * the task is rejected; the caller then fails the job as "server busy" instead of blocking.
 */
@Configuration
public class AsyncConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncConfig.class);

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${transcription.asyncExecutorThreads}") int threads,
      @Value("${transcription.asyncExecutorQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("audio-job-");
    executor.setRejectedExecutionHandler(jobRejectionHandler(threads, queueSize));
    executor.initialize();

    LOGGER.info("Initialized job executor: threads={}, queueSize={}", threads, queueSize);
    return executor;
  }

  /** Logs the saturated pool and rejects, so the job can be failed by whoever submitted it. */
  static RejectedExecutionHandler jobRejectionHandler(int threads, int queueSize) {
    return (task, pool) -> {
      LOGGER.warn(
          "Job executor saturated: active={}/{}, queued={}/{}",
          pool.getActiveCount(),
          threads,
          pool.getQueue().size(),
          queueSize);
      throw new RejectedExecutionException(
          String.format("Job queue full (%d running, %d waiting)", threads, queueSize));
    };
  }
}
