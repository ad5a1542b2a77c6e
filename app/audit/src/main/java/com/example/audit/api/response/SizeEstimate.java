package com.example.audit.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SizeEstimate(
    double avgSizePerRecordBytes,
    long estimatedTotalKb,
    double dailyGrowthRecords,
    double dailyGrowthKb,
    double predicted30DaysKb) {}
