/*
 * Where: Audit admin API
 * What: Storage statistics of the audit_logs table
 * Why: Operators size retention policies from real growth numbers
 */
package com.example.audit.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "lists are copied into unmodifiable lists in the constructor")
public record DatabaseStatsResponse(
    long totalRecords,
    long recordsLast7Days,
    long recordsLast30Days,
    Instant oldestRecord,
    Instant newestRecord,
    List<ActionStatistic> topActions,
    List<MonthlyStatistic> monthlyDistribution,
    SizeEstimate sizeEstimate,
    Instant generatedAt) {

  public DatabaseStatsResponse {
    topActions = topActions == null ? List.of() : List.copyOf(topActions);
    monthlyDistribution =
        monthlyDistribution == null ? List.of() : List.copyOf(monthlyDistribution);
  }
}
