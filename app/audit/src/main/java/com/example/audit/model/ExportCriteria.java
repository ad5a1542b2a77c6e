/*
 * Where: Audit domain model
 * What: Filters for an on-demand export of audit records
 * Why: Exports select by time window, action and user rather than by retention cutoff
 */
package com.example.audit.model;

import java.time.Instant;

/**
 * Null fields do not filter. {@code actionType} matches as a substring of the action name;
 * both ends of the time window are inclusive.
 */
public record ExportCriteria(
    Instant startDate, Instant endDate, String actionType, String userId, int limit) {

  public ExportCriteria {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    actionType = actionType == null || actionType.isBlank() ? null : actionType;
    userId = userId == null || userId.isBlank() ? null : userId;
  }

  public boolean matches(AuditRecord record) {
    return (startDate == null || !record.createdAt().isBefore(startDate))
        && (endDate == null || !record.createdAt().isAfter(endDate))
        && (actionType == null || record.action().contains(actionType))
        && (userId == null || userId.equals(record.userId()));
  }
}
