package com.example.audit.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActionStatistic(
    String action, long count, double percentage, Instant firstOccurrence, Instant lastOccurrence) {}
