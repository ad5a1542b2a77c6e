package com.example.audit.service;

import java.time.Instant;

/**
 * Outcome of one (action type, retention days) pair.
 *
 * <p>{@code deletedCount} is what was actually removed, also when the pair failed halfway.
 */
public record PolicyResult(
    String actionType,
    int retentionDays,
    Instant cutoffDate,
    long matchedCount,
    long deletedCount,
    boolean archived,
    String archiveFile,
    PolicyOutcome outcome,
    String error) {

  public boolean failed() {
    return outcome.isFailure();
  }
}
