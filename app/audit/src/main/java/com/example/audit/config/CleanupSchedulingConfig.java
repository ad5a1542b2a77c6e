/*
 * Where: Audit scheduling configuration
 * What: Provides the single-threaded task scheduler the cleanup loop runs on
 * Why: Scheduled and forced cleanup cycles must never overlap
 */
package com.example.audit.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class CleanupSchedulingConfig {

  public static final String THREAD_NAME_PREFIX = "audit-cleanup-";
  static final int AWAIT_TERMINATION_SECONDS = 30;

  @Bean
  public ThreadPoolTaskScheduler auditCleanupTaskScheduler(Clock clock) {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    // one thread: cycles are serialized by the pool, not by a lock
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
    // trigger instants are computed from the application clock
    scheduler.setClock(clock);
    // a cancelled next-run must not hold up shutdown
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
    return scheduler;
  }
}
