/*
 * Where: Audit cleanup engine
 * What: Bounds the number of cleanup runs in flight
 * Why: Scheduled, forced and manual runs share one database and must not pile up
 */
package com.example.audit.service;

import com.example.audit.config.AuditRetentionProperties;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;

@Component
public class CleanupConcurrencyGuard {

  private final int maxConcurrent;
  private final Semaphore permits;

  public CleanupConcurrencyGuard(AuditRetentionProperties properties) {
    this.maxConcurrent = properties.maxConcurrentCleanupTasks();
    this.permits = new Semaphore(maxConcurrent);
  }

  /** Takes a permit without waiting, or fails with {@link CleanupConcurrencyLimitException}. */
  public Permit acquire(CleanupTrigger trigger) {
    if (!permits.tryAcquire()) {
      throw new CleanupConcurrencyLimitException(maxConcurrent, trigger);
    }
    return new Permit();
  }

  public boolean hasHeadroom() {
    return permits.availablePermits() > 0;
  }

  public int activeRuns() {
    return maxConcurrent - permits.availablePermits();
  }

  public int maxConcurrent() {
    return maxConcurrent;
  }

  public final class Permit implements AutoCloseable {

    private final AtomicBoolean released = new AtomicBoolean();

    private Permit() {}

    @Override
    public void close() {
      if (released.compareAndSet(false, true)) {
        permits.release();
      }
    }
  }
}
