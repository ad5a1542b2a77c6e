/*
 * Where: Audit service layer
 * What: Records cleanup runs, deletions, failures and archive writes as Micrometer meters
 * Why: Retention has to be observable from Prometheus, including partial failures
 */
package com.example.audit.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class AuditRetentionMetrics {

  private static final String METRIC_RUN_TOTAL = "audit.retention.run.total";
  private static final String METRIC_RUN_DURATION = "audit.retention.run.duration";
  private static final String METRIC_RUN_REJECTED = "audit.retention.run.rejected.total";
  private static final String METRIC_DELETED_TOTAL = "audit.retention.deleted.total";
  private static final String METRIC_POLICY_FAILURE = "audit.retention.policy.failure.total";
  private static final String METRIC_ARCHIVE_WRITTEN = "audit.retention.archive.written.total";
  private static final String METRIC_LARGE_CLEANUP = "audit.retention.large_cleanup.alert.total";
  private static final String METRIC_LAST_DELETED = "audit.retention.last_run.deleted";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final AtomicLong lastRunDeleted = new AtomicLong();
  private final Timer runDurationTimer;
  private final Counter largeCleanupCounter;

  public AuditRetentionMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.runDurationTimer =
        Timer.builder(METRIC_RUN_DURATION)
            .description("Wall-clock duration of audit cleanup runs")
            .register(meterRegistry);
    this.largeCleanupCounter =
        Counter.builder(METRIC_LARGE_CLEANUP)
            .description("Cleanup runs that deleted more records than the alert threshold")
            .register(meterRegistry);
    Gauge.builder(METRIC_LAST_DELETED, lastRunDeleted, AtomicLong::get)
        .description("Records deleted by the most recent non-preview cleanup run")
        .register(meterRegistry);
  }

  public void recordRun(CleanupReport report) {
    final String result =
        report.preview() ? "preview" : report.hasFailures() ? "partial_failure" : "success";
    counter(
            METRIC_RUN_TOTAL,
            "Audit cleanup runs by trigger and result",
            Tags.of("trigger", report.trigger().name(), "result", result))
        .increment();
    runDurationTimer.record(Duration.ofMillis(Math.max(report.durationMs(), 0)));
    if (!report.preview()) {
      lastRunDeleted.set(report.totalDeleted());
    }
  }

  public void recordRejected(CleanupTrigger trigger) {
    counter(
            METRIC_RUN_REJECTED,
            "Cleanup runs rejected by the concurrency limit",
            Tags.of("trigger", trigger.name()))
        .increment();
  }

  public void recordDeleted(String actionType, long count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_DELETED_TOTAL, "Audit records deleted by retention", Tags.of("action", actionType))
        .increment(count);
  }

  public void recordPolicyFailure(String actionType, PolicyOutcome outcome) {
    counter(
            METRIC_POLICY_FAILURE,
            "Retention policies that failed within a run",
            Tags.of("action", actionType, "outcome", outcome.name()))
        .increment();
  }

  public void recordArchiveWritten(String actionType) {
    counter(METRIC_ARCHIVE_WRITTEN, "Audit archives written", Tags.of("action", actionType))
        .increment();
  }

  public void recordLargeCleanupAlert() {
    largeCleanupCounter.increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key =
        name
            + tags.stream()
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(",", "{", "}"));
    return counters.computeIfAbsent(
        key,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
