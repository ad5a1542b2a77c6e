package com.example.audit.service;

import java.time.Instant;

/** Point-in-time view of the cleanup scheduler; fields are null until the first run. */
public record SchedulerStatus(
    boolean enabled,
    boolean loopRunning,
    SchedulerState state,
    Instant lastRunStartedAt,
    Instant lastRunFinishedAt,
    Instant nextRunAt,
    String lastRunId,
    Long lastRunDeleted,
    Integer lastRunFailures,
    String lastError,
    int pendingForcedRequests,
    int activeRuns,
    int maxConcurrentRuns) {}
