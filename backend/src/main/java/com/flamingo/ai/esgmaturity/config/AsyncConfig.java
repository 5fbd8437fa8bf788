package com.flamingo.ai.esgmaturity.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for scoring units and provider calls. */
@Configuration
public class AsyncConfig {

  /**
   * When the queue is full the submitting thread runs the unit itself, which throttles large
   * batches instead of failing them.
   */
  @Bean(name = "scoringUnitExecutor")
  public Executor scoringUnitExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("score-unit-");
    executor.setRejectedExecutionHandler(
        (task, pool) -> {
          if (pool.isShutdown()) {
            throw new RejectedExecutionException("Scoring executor is shut down");
          }
          task.run();
        });
    executor.initialize();
    return executor;
  }

  /**
   * Provider calls run here. Tasks are submitted as interruptible futures so the time limiter can
   * interrupt a hung provider and free its thread.
   */
  @Bean(name = "providerCallExecutor")
  public AsyncTaskExecutor providerCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("provider-");
    executor.initialize();
    return executor;
  }
}
