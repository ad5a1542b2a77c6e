package com.example.audit.api.response;

import com.example.audit.service.SchedulerStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SchedulerStatusResponse(
    boolean enabled,
    boolean loopRunning,
    String state,
    Instant lastRunStartedAt,
    Instant lastRunFinishedAt,
    Instant nextRunAt,
    String lastRunId,
    Long lastRunDeleted,
    Integer lastRunFailures,
    String lastError,
    int pendingForcedRequests,
    int activeRuns,
    int maxConcurrentRuns) {

  public static SchedulerStatusResponse from(SchedulerStatus status) {
    return new SchedulerStatusResponse(
        status.enabled(),
        status.loopRunning(),
        status.state().name(),
        status.lastRunStartedAt(),
        status.lastRunFinishedAt(),
        status.nextRunAt(),
        status.lastRunId(),
        status.lastRunDeleted(),
        status.lastRunFailures(),
        status.lastError(),
        status.pendingForcedRequests(),
        status.activeRuns(),
        status.maxConcurrentRuns());
  }
}
