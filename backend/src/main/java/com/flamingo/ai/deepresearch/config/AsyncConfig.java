package com.flamingo.ai.deepresearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for work that must run off the research thread. */
@Configuration
public class AsyncConfig {

  static final int TRANSCRIPT_POOL_SIZE = 16;

  /**
   * Executor for transcript fetches. Timed-out fetches are interrupted, but a fetch that ignores
   * interruption keeps its thread, so every thread is a core thread: new fetches get a fresh thread
   * instead of queueing behind stuck ones. Idle threads time out.
   */
  @Bean(name = "transcriptExecutor")
  public ThreadPoolTaskExecutor transcriptExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(TRANSCRIPT_POOL_SIZE);
    executor.setMaxPoolSize(TRANSCRIPT_POOL_SIZE);
    executor.setAllowCoreThreadTimeOut(true);
    executor.setKeepAliveSeconds(30);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("transcript-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
