package com.example.audit.api.response;

import com.example.audit.service.PolicyResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PolicyResultResponse(
    String actionType,
    int retentionDays,
    Instant cutoffDate,
    long matchedCount,
    long deletedCount,
    boolean archived,
    String archiveFile,
    String outcome,
    String error) {

  public static PolicyResultResponse from(PolicyResult result) {
    return new PolicyResultResponse(
        result.actionType(),
        result.retentionDays(),
        result.cutoffDate(),
        result.matchedCount(),
        result.deletedCount(),
        result.archived(),
        result.archiveFile(),
        result.outcome().name(),
        result.error());
  }
}
