/*
 * Where: Audit domain model
 * What: Snapshot of one audit_logs row
 * Why: Shared by the repository, the cleanup engine and the archive writer
 */
package com.example.audit.model;

import java.time.Instant;

public record AuditRecord(
    Long id,
    String userId,
    String action,
    String message,
    Instant createdAt,
    String ipAddress) {

  public static AuditRecord newRecord(
      String userId, String action, String message, Instant createdAt, String ipAddress) {
    return new AuditRecord(null, userId, action, message, createdAt, ipAddress);
  }
}
