/*
 * Where: Audit cleanup engine output
 * What: Per-run summary with one result per processed policy
 * Why: Callers need partial success visible, not a single count
 */
package com.example.audit.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "policyResults is copied into an unmodifiable list in the constructor")
public record CleanupReport(
    String runId,
    CleanupTrigger trigger,
    Instant startedAt,
    Instant finishedAt,
    boolean preview,
    boolean largeCleanupAlert,
    List<PolicyResult> policyResults) {

  public CleanupReport {
    policyResults = policyResults == null ? List.of() : List.copyOf(policyResults);
  }

  public long totalDeleted() {
    return policyResults.stream().mapToLong(PolicyResult::deletedCount).sum();
  }

  public long totalMatched() {
    return policyResults.stream().mapToLong(PolicyResult::matchedCount).sum();
  }

  public long durationMs() {
    return Duration.between(startedAt, finishedAt).toMillis();
  }

  public boolean hasFailures() {
    return policyResults.stream().anyMatch(PolicyResult::failed);
  }

  public List<PolicyResult> failures() {
    return policyResults.stream().filter(PolicyResult::failed).toList();
  }

  public List<String> archiveFiles() {
    return policyResults.stream().map(PolicyResult::archiveFile).filter(Objects::nonNull).toList();
  }

  /** Deleted counts of the pairs that removed something, in processing order. */
  public Map<String, Long> deletedByAction() {
    final Map<String, Long> breakdown = new LinkedHashMap<>();
    for (PolicyResult result : policyResults) {
      if (result.deletedCount() > 0) {
        breakdown.merge(result.actionType(), result.deletedCount(), Long::sum);
      }
    }
    return breakdown;
  }

  public Map<String, Long> matchedByAction() {
    final Map<String, Long> breakdown = new LinkedHashMap<>();
    for (PolicyResult result : policyResults) {
      if (result.matchedCount() > 0) {
        breakdown.merge(result.actionType(), result.matchedCount(), Long::sum);
      }
    }
    return breakdown;
  }

  public Optional<PolicyResult> resultFor(String actionType) {
    return policyResults.stream().filter(r -> r.actionType().equals(actionType)).findFirst();
  }
}
