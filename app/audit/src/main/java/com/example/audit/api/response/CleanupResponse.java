/*
 * Where: Audit admin API response
 * What: Result of a manual or forced cleanup run
 * Why: Shows totals and per-policy outcomes so partial failures are visible to the caller
 */
package com.example.audit.api.response;

import com.example.audit.service.CleanupReport;
import com.example.audit.service.PolicyResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "collections are copied into unmodifiable views in the constructor")
public record CleanupResponse(
    String runId,
    String trigger,
    String message,
    long deletedCount,
    long matchedCount,
    Instant cutoffDate,
    Map<String, Long> detailedStats,
    List<PolicyResultResponse> policyResults,
    List<String> archiveFiles,
    long durationMs,
    @JsonProperty("is_preview") boolean preview,
    boolean largeCleanupAlert) {

  public CleanupResponse {
    detailedStats =
        detailedStats == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(detailedStats));
    policyResults = policyResults == null ? List.of() : List.copyOf(policyResults);
    archiveFiles = archiveFiles == null ? List.of() : List.copyOf(archiveFiles);
  }

  public static CleanupResponse from(CleanupReport report) {
    return new CleanupResponse(
        report.runId(),
        report.trigger().name(),
        message(report),
        report.totalDeleted(),
        report.totalMatched(),
        commonCutoff(report.policyResults()),
        report.preview() ? report.matchedByAction() : report.deletedByAction(),
        report.policyResults().stream().map(PolicyResultResponse::from).toList(),
        report.archiveFiles(),
        report.durationMs(),
        report.preview(),
        report.largeCleanupAlert());
  }

  private static String message(CleanupReport report) {
    final String base;
    if (report.preview()) {
      base = "Preview: " + report.totalMatched() + " records would be deleted";
    } else if (report.totalMatched() == 0) {
      base = "No records matched the cleanup criteria";
    } else {
      base = "Cleanup completed: " + report.totalDeleted() + " records deleted";
    }
    final int failures = report.failures().size();
    return failures == 0 ? base : base + " (" + failures + " policies failed)";
  }

  // a single cutoff only exists when every processed policy shares it
  private static Instant commonCutoff(List<PolicyResult> results) {
    if (results.isEmpty()) {
      return null;
    }
    final Instant first = results.get(0).cutoffDate();
    return results.stream().allMatch(r -> first.equals(r.cutoffDate())) ? first : null;
  }
}
