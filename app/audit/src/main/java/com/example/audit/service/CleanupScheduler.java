/*
 * Where: Audit cleanup scheduling
 * What: Runs retention on the cleanup task scheduler, on an interval or on demand
 * Why: One explicit IDLE/RUNNING cycle serializes scheduled and forced runs
 */
package com.example.audit.service;

import com.example.audit.archive.ArchiveLifecycleManager;
import com.example.audit.config.AuditRetentionProperties;
import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

@Component
public class CleanupScheduler {

  private static final Logger logger = LoggerFactory.getLogger(CleanupScheduler.class);

  private static final Duration MAX_ERROR_BACKOFF = Duration.ofHours(1);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);
  static final Duration DEFAULT_FORCED_RUN_TIMEOUT = Duration.ofHours(1);

  private final AuditCleanupService cleanupService;
  private final ArchiveLifecycleManager archiveLifecycleManager;
  private final CleanupConcurrencyGuard concurrencyGuard;
  private final AuditRetentionProperties properties;
  private final ThreadPoolTaskScheduler taskScheduler;
  private final Clock clock;
  private final Duration forcedRunTimeout;

  private final Object lock = new Object();
  // guarded by lock
  private final Deque<ForcedRequest> forcedRequests = new ArrayDeque<>();
  // guarded by lock
  private ScheduledFuture<?> nextRun;
  private final AtomicReference<SchedulerState> state =
      new AtomicReference<>(SchedulerState.IDLE);

  // written under lock
  private volatile boolean active;
  private volatile CancellationToken cancellation = CancellationToken.none();
  private volatile CompletableFuture<Void> inFlight = CompletableFuture.completedFuture(null);
  private volatile Instant lastRunStartedAt;
  private volatile Instant lastRunFinishedAt;
  private volatile Instant nextRunAt;
  private volatile CleanupReport lastReport;
  private volatile String lastError;

  @Autowired
  public CleanupScheduler(
      AuditCleanupService cleanupService,
      ArchiveLifecycleManager archiveLifecycleManager,
      CleanupConcurrencyGuard concurrencyGuard,
      AuditRetentionProperties properties,
      ThreadPoolTaskScheduler taskScheduler,
      Clock clock) {
    this(
        cleanupService,
        archiveLifecycleManager,
        concurrencyGuard,
        properties,
        taskScheduler,
        clock,
        DEFAULT_FORCED_RUN_TIMEOUT);
  }

  @VisibleForTesting
  CleanupScheduler(
      AuditCleanupService cleanupService,
      ArchiveLifecycleManager archiveLifecycleManager,
      CleanupConcurrencyGuard concurrencyGuard,
      AuditRetentionProperties properties,
      ThreadPoolTaskScheduler taskScheduler,
      Clock clock,
      Duration forcedRunTimeout) {
    this.cleanupService = cleanupService;
    this.archiveLifecycleManager = archiveLifecycleManager;
    this.concurrencyGuard = concurrencyGuard;
    this.properties = properties;
    this.taskScheduler = taskScheduler;
    this.clock = clock;
    this.forcedRunTimeout = forcedRunTimeout;
  }

  @PostConstruct
  public void start() {
    if (!properties.cleanupEnabled()) {
      logger.info("audit cleanup scheduler disabled");
      return;
    }
    synchronized (lock) {
      if (active) {
        return;
      }
      active = true;
      cancellation = new CancellationToken();
      // first cycle runs right after startup
      scheduleNextLocked(Duration.ZERO);
    }
    logger.info(
        "audit cleanup scheduler started interval={} archiveBeforeDelete={} autoCleanupArchives={}",
        properties.cleanupInterval(),
        properties.archiveBeforeDelete(),
        properties.autoCleanupArchives());
  }

  /**
   * Cancels the pending cycle and the in-flight run, then waits a bounded time for that run to
   * finish. Forced requests still queued fail with {@link CancellationException}.
   */
  @PreDestroy
  public void stop() {
    final CompletableFuture<Void> running;
    final List<ForcedRequest> pending;
    synchronized (lock) {
      if (!active) {
        return;
      }
      active = false;
      if (nextRun != null) {
        nextRun.cancel(false);
        nextRun = null;
      }
      nextRunAt = null;
      cancellation.cancel();
      running = inFlight;
      pending = drainLocked();
    }
    final CancellationException stopped =
        new CancellationException("audit cleanup scheduler stopped");
    pending.forEach(waiter -> waiter.future().completeExceptionally(stopped));
    try {
      running.get(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn("audit cleanup run did not stop within {}", SHUTDOWN_WAIT);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException ex) {
      logger.warn("audit cleanup run ended abnormally during shutdown", ex.getCause());
    }
    logger.info("audit cleanup scheduler stopped");
  }

  /**
   * Runs a full cleanup now and waits for its report.
   *
   * <p>Rejected with {@link CleanupConcurrencyLimitException} when no permit is free. Requests
   * that arrive while a run is in progress are served together by the next run. With the
   * scheduler disabled the run happens on the calling thread.
   */
  public CleanupReport forceRun(String requestedBy, String clientIp) {
    if (!concurrencyGuard.hasHeadroom()) {
      throw new CleanupConcurrencyLimitException(
          concurrencyGuard.maxConcurrent(), CleanupTrigger.FORCED);
    }
    final CleanupOptions options =
        CleanupOptions.forced(properties.archiveBeforeDelete(), requestedBy, clientIp);
    if (!properties.cleanupEnabled()) {
      logger.info("forced audit cleanup running inline requestedBy={}", requestedBy);
      return cleanupService.runCleanup(options);
    }
    final ForcedRequest request = new ForcedRequest(options, new CompletableFuture<>());
    synchronized (lock) {
      if (!active) {
        throw new CancellationException("audit cleanup scheduler is not running");
      }
      forcedRequests.addLast(request);
    }
    try {
      taskScheduler.execute(this::runForcedCycle);
    } catch (TaskRejectedException ex) {
      withdraw(request);
      throw new CancellationException("audit cleanup scheduler is shutting down");
    }
    logger.info("forced audit cleanup queued requestedBy={} state={}", requestedBy, state.get());
    return await(request);
  }

  public SchedulerStatus status() {
    final CleanupReport report = lastReport;
    final int pending;
    synchronized (lock) {
      pending = forcedRequests.size();
    }
    final boolean running = isLoopRunning();
    return new SchedulerStatus(
        properties.cleanupEnabled(),
        running,
        state.get(),
        lastRunStartedAt,
        lastRunFinishedAt,
        running ? nextRunAt : null,
        report == null ? null : report.runId(),
        report == null ? null : report.totalDeleted(),
        report == null ? null : report.failures().size(),
        lastError,
        pending,
        concurrencyGuard.activeRuns(),
        concurrencyGuard.maxConcurrent());
  }

  public boolean isLoopRunning() {
    return active;
  }

  private void runScheduledCycle() {
    scheduleNext(runCycle());
  }

  private void runForcedCycle() {
    synchronized (lock) {
      if (forcedRequests.isEmpty()) {
        // already folded into an earlier cycle
        return;
      }
    }
    scheduleNext(runCycle());
  }

  /** One cycle; returns the delay until the next scheduled run. Never throws. */
  @VisibleForTesting
  Duration runCycle() {
    final CompletableFuture<Void> done = new CompletableFuture<>();
    inFlight = done;
    final List<ForcedRequest> waiters = drainForcedRequests();
    final CleanupOptions options =
        waiters.isEmpty()
            ? CleanupOptions.scheduled(properties.archiveBeforeDelete())
            : waiters.get(0).options();
    state.set(SchedulerState.RUNNING);
    lastRunStartedAt = Instant.now(clock);
    CleanupReport report = null;
    Throwable failure = null;
    try {
      report = cleanupService.runCleanup(options, cancellation);
      lastReport = report;
      lastError = null;
      if (options.trigger() == CleanupTrigger.SCHEDULED && properties.autoCleanupArchives()) {
        purgeArchives();
      }
      return properties.cleanupInterval();
    } catch (CleanupConcurrencyLimitException ex) {
      failure = ex;
      logger.info("audit cleanup cycle skipped trigger={}: {}", options.trigger(), ex.getMessage());
      return properties.cleanupInterval();
    } catch (Throwable ex) {
      // errors included: the next cycle must still be scheduled
      failure = ex;
      final Duration backoff = errorBackoff();
      logger.error(
          "audit cleanup cycle failed trigger={}, retrying in {}", options.trigger(), backoff, ex);
      lastError = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      return backoff;
    } finally {
      completeWaiters(waiters, report, failure);
      lastRunFinishedAt = Instant.now(clock);
      state.set(SchedulerState.IDLE);
      done.complete(null);
    }
  }

  @VisibleForTesting
  Duration errorBackoff() {
    final Duration interval = properties.cleanupInterval();
    return interval.compareTo(MAX_ERROR_BACKOFF) < 0 ? interval : MAX_ERROR_BACKOFF;
  }

  private void scheduleNext(Duration delay) {
    synchronized (lock) {
      if (!active) {
        return;
      }
      try {
        scheduleNextLocked(delay);
      } catch (TaskRejectedException ex) {
        logger.info("audit cleanup not rescheduled, task scheduler is shutting down");
      }
    }
  }

  private void scheduleNextLocked(Duration delay) {
    if (nextRun != null) {
      nextRun.cancel(false);
    }
    final Instant at = Instant.now(clock).plus(delay);
    nextRunAt = at;
    nextRun = taskScheduler.schedule(this::runScheduledCycle, at);
  }

  private void purgeArchives() {
    try {
      final int purged = archiveLifecycleManager.purgeExpired();
      if (purged > 0) {
        logger.info("expired audit archives purged count={}", purged);
      }
    } catch (RuntimeException ex) {
      logger.warn("audit archive purge failed after scheduled cleanup", ex);
    }
  }

  private static void completeWaiters(
      List<ForcedRequest> waiters, CleanupReport report, Throwable failure) {
    for (ForcedRequest waiter : waiters) {
      if (report != null) {
        waiter.future().complete(report);
      } else if (failure != null) {
        waiter.future().completeExceptionally(failure);
      } else {
        waiter.future()
            .completeExceptionally(
                new IllegalStateException("audit cleanup cycle ended without a report"));
      }
    }
  }

  private List<ForcedRequest> drainForcedRequests() {
    synchronized (lock) {
      return drainLocked();
    }
  }

  private List<ForcedRequest> drainLocked() {
    final List<ForcedRequest> drained = new ArrayList<>(forcedRequests);
    forcedRequests.clear();
    return drained;
  }

  private void withdraw(ForcedRequest request) {
    synchronized (lock) {
      forcedRequests.remove(request);
    }
  }

  private CleanupReport await(ForcedRequest request) {
    try {
      return request.future().get(forcedRunTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      withdraw(request);
      throw new IllegalStateException(
          "forced audit cleanup did not finish within " + forcedRunTimeout, ex);
    } catch (InterruptedException ex) {
      withdraw(request);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while waiting for forced audit cleanup", ex);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("forced audit cleanup failed", cause);
    }
  }

  private record ForcedRequest(CleanupOptions options, CompletableFuture<CleanupReport> future) {}
}
