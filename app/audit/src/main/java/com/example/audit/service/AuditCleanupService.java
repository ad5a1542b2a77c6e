/*
 * Where: Audit service layer
 * What: Applies retention policies to audit_logs, archiving before deletion when asked
 * Why: Single entry point shared by the scheduler, forced runs and the admin API
 */
package com.example.audit.service;

import com.example.audit.api.response.RetentionConfigResponse;
import com.example.audit.archive.ArchiveWriteException;
import com.example.audit.archive.ArchiveWriter;
import com.example.audit.config.AuditRetentionProperties;
import com.example.audit.model.ActionFilter;
import com.example.audit.model.AuditActions;
import com.example.audit.model.AuditRecord;
import com.example.audit.policy.RetentionPolicy;
import com.example.audit.policy.RetentionPolicyResolver;
import com.example.audit.policy.RetentionRule;
import com.example.audit.repository.AuditLogRepository;
import com.example.common.TraceIds;
import com.google.common.collect.Lists;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditCleanupService {

  private static final Logger logger = LoggerFactory.getLogger(AuditCleanupService.class);

  public static final String MDC_RUN_ID = "cleanup_run_id";

  private final AuditLogRepository auditLogRepository;
  private final RetentionPolicyResolver policyResolver;
  private final ArchiveWriter archiveWriter;
  private final CleanupConcurrencyGuard concurrencyGuard;
  private final AuditRetentionMetrics metrics;
  private final AuditRetentionProperties properties;
  private final Clock clock;

  public CleanupReport runCleanup(CleanupOptions options) {
    return runCleanup(options, CancellationToken.none());
  }

  public CleanupReport runCleanup(CleanupOptions options, CancellationToken cancellation) {
    final CleanupConcurrencyGuard.Permit permit;
    try {
      permit = concurrencyGuard.acquire(options.trigger());
    } catch (CleanupConcurrencyLimitException ex) {
      metrics.recordRejected(options.trigger());
      logger.warn(
          "audit cleanup rejected trigger={} maxConcurrent={}",
          options.trigger(),
          ex.maxConcurrent());
      throw ex;
    }
    try (permit) {
      return execute(options, cancellation);
    }
  }

  public boolean defaultArchiveBeforeDelete() {
    return properties.archiveBeforeDelete();
  }

  /** Effective retention configuration, with the policy table that the next run would use. */
  public RetentionConfigResponse describeConfiguration() {
    return new RetentionConfigResponse(
        policyResolver.snapshot().asMap(),
        properties.cleanupEnabled(),
        properties.cleanupIntervalHours(),
        properties.archiveBeforeDelete(),
        properties.archivePath(),
        properties.archiveFormat().name(),
        properties.compressArchives(),
        properties.batchSize(),
        properties.maxConcurrentCleanupTasks(),
        properties.alertOnLargeCleanup(),
        properties.largeCleanupThreshold(),
        properties.archiveRetentionDays(),
        properties.autoCleanupArchives(),
        properties.maxArchiveSizeMb());
  }

  private CleanupReport execute(CleanupOptions options, CancellationToken cancellation) {
    final String runId = TraceIds.newRunId("cleanup");
    MDC.put(MDC_RUN_ID, runId);
    try {
      final Instant startedAt = Instant.now(clock);
      final RetentionPolicy policy = policyResolver.snapshot();
      final List<RetentionRule> rules = selectRules(policy, options);
      logger.info(
          "audit cleanup started trigger={} preview={} archiveBeforeDelete={} policies={}",
          options.trigger(),
          options.previewOnly(),
          options.archiveBeforeDelete(),
          rules.size());

      final List<PolicyResult> results = new ArrayList<>();
      for (RetentionRule rule : rules) {
        if (cancellation.isCancelled()) {
          results.add(cancelledBeforeStart(rule));
          continue;
        }
        results.add(processRule(rule, policy, options, cancellation));
      }

      final Instant finishedAt = Instant.now(clock);
      final long totalDeleted = results.stream().mapToLong(PolicyResult::deletedCount).sum();
      final boolean largeCleanup =
          !options.previewOnly()
              && properties.alertOnLargeCleanup()
              && totalDeleted > properties.largeCleanupThreshold();
      final CleanupReport report =
          new CleanupReport(
              runId,
              options.trigger(),
              startedAt,
              finishedAt,
              options.previewOnly(),
              largeCleanup,
              results);

      if (!options.previewOnly() && totalDeleted > 0) {
        writeMetaAudit(report, options);
      }
      if (largeCleanup) {
        metrics.recordLargeCleanupAlert();
        logger.warn(
            "large audit cleanup deleted={} threshold={} breakdown={}",
            totalDeleted,
            properties.largeCleanupThreshold(),
            report.deletedByAction());
      }
      metrics.recordRun(report);
      logger.info(
          "audit cleanup finished trigger={} preview={} matched={} deleted={} failures={} durationMs={}",
          options.trigger(),
          options.previewOnly(),
          report.totalMatched(),
          totalDeleted,
          report.failures().size(),
          report.durationMs());
      return report;
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private List<RetentionRule> selectRules(RetentionPolicy policy, CleanupOptions options) {
    final Integer override = options.retentionDaysOverride();
    if (options.allActions()) {
      return policy.rules().stream()
          .map(rule -> override == null ? rule : rule.withRetentionDays(override))
          .toList();
    }
    final String actionType = options.actionType();
    final int days = override != null ? override : policy.resolve(actionType);
    if (RetentionPolicy.DEFAULT_KEY.equals(actionType)) {
      return List.of(RetentionRule.fallback(days));
    }
    return List.of(RetentionRule.named(actionType, days));
  }

  private PolicyResult processRule(
      RetentionRule rule,
      RetentionPolicy policy,
      CleanupOptions options,
      CancellationToken cancellation) {
    final Instant cutoff = Instant.now(clock).minus(Duration.ofDays(rule.retentionDays()));
    final ActionFilter filter = rule.toFilter(policy.namedActions());
    final PolicyProgress progress = new PolicyProgress();
    try {
      progress.matched = auditLogRepository.countExpired(filter, cutoff);
      if (options.previewOnly()) {
        logger.info(
            "audit cleanup preview actionType={} retentionDays={} cutoff={} matched={}",
            rule.actionType(),
            rule.retentionDays(),
            cutoff,
            progress.matched);
        return progress.result(rule, cutoff, PolicyOutcome.PREVIEWED, null);
      }
      if (progress.matched > 0) {
        if (options.archiveBeforeDelete()) {
          archiveThenDelete(rule, filter, cutoff, progress, cancellation);
        } else {
          deleteInBatches(filter, cutoff, progress, cancellation);
        }
      }
      metrics.recordDeleted(rule.actionType(), progress.deleted);
      if (progress.deleted > 0) {
        logger.info(
            "audit cleanup deleted actionType={} retentionDays={} cutoff={} deleted={} archive={}",
            rule.actionType(),
            rule.retentionDays(),
            cutoff,
            progress.deleted,
            progress.archiveFile);
      }
      final PolicyOutcome outcome =
          progress.cancelled ? PolicyOutcome.CANCELLED : PolicyOutcome.SUCCEEDED;
      return progress.result(rule, cutoff, outcome, null);
    } catch (ArchiveWriteException ex) {
      logger.error(
          "audit archive failed, deletion skipped actionType={} matched={}",
          rule.actionType(),
          progress.matched,
          ex);
      return failed(rule, cutoff, progress, PolicyOutcome.ARCHIVE_FAILED, ex);
    } catch (DataAccessException ex) {
      logger.error(
          "audit cleanup storage failure actionType={} deletedSoFar={}",
          rule.actionType(),
          progress.deleted,
          ex);
      return failed(rule, cutoff, progress, PolicyOutcome.STORAGE_FAILED, ex);
    } catch (RuntimeException ex) {
      logger.error(
          "audit cleanup failed actionType={} deletedSoFar={}",
          rule.actionType(),
          progress.deleted,
          ex);
      return failed(rule, cutoff, progress, PolicyOutcome.FAILED, ex);
    }
  }

  private void archiveThenDelete(
      RetentionRule rule,
      ActionFilter filter,
      Instant cutoff,
      PolicyProgress progress,
      CancellationToken cancellation) {
    final List<AuditRecord> expired = auditLogRepository.findExpired(filter, cutoff);
    progress.matched = expired.size();
    if (expired.isEmpty()) {
      return;
    }
    final Path archive = archiveWriter.writeArchive(rule.actionType(), expired, cutoff);
    progress.archived = true;
    progress.archiveFile = archive.getFileName().toString();
    metrics.recordArchiveWritten(rule.actionType());

    // only ids that made it into the archive are deleted
    final List<Long> ids = expired.stream().map(AuditRecord::id).toList();
    for (List<Long> batch : Lists.partition(ids, properties.batchSize())) {
      if (cancellation.isCancelled()) {
        progress.cancelled = true;
        return;
      }
      progress.deleted += auditLogRepository.deleteByIds(batch);
    }
  }

  private void deleteInBatches(
      ActionFilter filter, Instant cutoff, PolicyProgress progress, CancellationToken cancellation) {
    final int batchSize = properties.batchSize();
    while (true) {
      if (cancellation.isCancelled()) {
        progress.cancelled = true;
        return;
      }
      final int deleted = auditLogRepository.deleteExpiredBatch(filter, cutoff, batchSize);
      progress.deleted += deleted;
      if (deleted < batchSize) {
        return;
      }
    }
  }

  private PolicyResult failed(
      RetentionRule rule,
      Instant cutoff,
      PolicyProgress progress,
      PolicyOutcome outcome,
      RuntimeException ex) {
    metrics.recordPolicyFailure(rule.actionType(), outcome);
    metrics.recordDeleted(rule.actionType(), progress.deleted);
    final String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    return progress.result(rule, cutoff, outcome, message);
  }

  private PolicyResult cancelledBeforeStart(RetentionRule rule) {
    final Instant cutoff = Instant.now(clock).minus(Duration.ofDays(rule.retentionDays()));
    return new PolicyProgress().result(rule, cutoff, PolicyOutcome.CANCELLED, null);
  }

  private void writeMetaAudit(CleanupReport report, CleanupOptions options) {
    final String requestedBy =
        options.requestedBy() == null || options.requestedBy().isBlank()
            ? AuditActions.SYSTEM_USER
            : options.requestedBy();
    final String clientIp =
        options.clientIp() == null || options.clientIp().isBlank()
            ? AuditActions.LOCAL_IP
            : options.clientIp();
    final AuditRecord entry =
        AuditRecord.newRecord(
            requestedBy,
            options.trigger().metaAuditAction(),
            metaAuditMessage(report),
            report.finishedAt(),
            clientIp);
    try {
      auditLogRepository.insert(entry);
    } catch (DataAccessException ex) {
      logger.error("failed to record audit cleanup meta-audit runId={}", report.runId(), ex);
    }
  }

  static String metaAuditMessage(CleanupReport report) {
    final String breakdown =
        report.deletedByAction().entrySet().stream()
            .map(entry -> entry.getKey() + ": " + entry.getValue())
            .collect(Collectors.joining(", "));
    final StringBuilder message =
        new StringBuilder()
            .append("Audit cleanup: ")
            .append(report.totalDeleted())
            .append(" records deleted in ")
            .append(report.durationMs())
            .append(" ms");
    if (!breakdown.isEmpty()) {
      message.append(". Breakdown: ").append(breakdown);
    }
    if (report.hasFailures()) {
      message
          .append(". Failed: ")
          .append(
              report.failures().stream()
                  .map(r -> r.actionType() + " (" + r.outcome() + ")")
                  .collect(Collectors.joining(", ")));
    }
    if (message.length() > AuditActions.MESSAGE_MAX_LENGTH) {
      message.setLength(AuditActions.MESSAGE_MAX_LENGTH - 3);
      message.append("...");
    }
    return message.toString();
  }

  private static final class PolicyProgress {
    private long matched;
    private long deleted;
    private boolean archived;
    private String archiveFile;
    private boolean cancelled;

    private PolicyResult result(
        RetentionRule rule, Instant cutoff, PolicyOutcome outcome, String error) {
      return new PolicyResult(
          rule.actionType(),
          rule.retentionDays(),
          cutoff,
          matched,
          deleted,
          archived,
          archiveFile,
          outcome,
          error);
    }
  }
}
