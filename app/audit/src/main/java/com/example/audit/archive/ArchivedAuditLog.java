package com.example.audit.archive;

import com.example.audit.model.AuditRecord;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** One record as stored in a JSON archive. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "userId", "action", "message", "createdAt", "ipAddress"})
public record ArchivedAuditLog(
    Long id, String userId, String action, String message, Instant createdAt, String ipAddress) {

  public static ArchivedAuditLog from(AuditRecord record) {
    return new ArchivedAuditLog(
        record.id(),
        record.userId(),
        record.action(),
        record.message(),
        record.createdAt(),
        record.ipAddress());
  }
}
