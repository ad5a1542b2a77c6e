/*
 * Where: Audit service layer
 * What: Aggregates counts, action distribution and a size estimate for audit_logs
 * Why: Backs the database-size admin endpoint
 */
package com.example.audit.service;

import com.example.audit.api.response.ActionStatistic;
import com.example.audit.api.response.DatabaseStatsResponse;
import com.example.audit.api.response.MonthlyStatistic;
import com.example.audit.api.response.SizeEstimate;
import com.example.audit.repository.AuditLogRepository;
import com.example.audit.repository.MonthlyActionCount;
import com.google.common.base.Stopwatch;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AuditStatisticsService {

  private static final Logger logger = LoggerFactory.getLogger(AuditStatisticsService.class);

  static final int TOP_ACTIONS = 10;
  static final int MONTHS = 6;
  static final int TOP_ACTIONS_PER_MONTH = 3;
  // fixed per-row overhead plus the ip/timestamp columns, on top of the message
  static final double ROW_OVERHEAD_BYTES = 50d;
  static final double COLUMN_OVERHEAD_BYTES = 20d;

  private final AuditLogRepository auditLogRepository;
  private final Clock clock;

  public DatabaseStatsResponse databaseStats() {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final Instant now = Instant.now(clock);
    final long total = auditLogRepository.countAll();
    final long last7Days = auditLogRepository.countCreatedSince(now.minus(Duration.ofDays(7)));
    final long last30Days = auditLogRepository.countCreatedSince(now.minus(Duration.ofDays(30)));

    final List<ActionStatistic> topActions =
        auditLogRepository.findTopActions(TOP_ACTIONS).stream()
            .map(
                occurrence ->
                    new ActionStatistic(
                        occurrence.action(),
                        occurrence.count(),
                        percentage(occurrence.count(), total),
                        occurrence.firstSeen(),
                        occurrence.lastSeen()))
            .toList();

    final Instant monthlySince =
        YearMonth.from(now.atOffset(ZoneOffset.UTC))
            .minusMonths(MONTHS - 1L)
            .atDay(1)
            .atStartOfDay()
            .toInstant(ZoneOffset.UTC);
    final List<MonthlyStatistic> monthly =
        monthlyDistribution(auditLogRepository.countByMonthAndActionSince(monthlySince));

    final DatabaseStatsResponse stats =
        new DatabaseStatsResponse(
            total,
            last7Days,
            last30Days,
            auditLogRepository.findOldestCreatedAt().orElse(null),
            auditLogRepository.findNewestCreatedAt().orElse(null),
            topActions,
            monthly,
            sizeEstimate(total, last7Days),
            now);
    logger.info(
        "audit statistics computed totalRecords={} durationMs={}",
        total,
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return stats;
  }

  private SizeEstimate sizeEstimate(long total, long last7Days) {
    final double avgMessageLength = total > 0 ? auditLogRepository.averageMessageLength() : 0d;
    final double perRecord = ROW_OVERHEAD_BYTES + avgMessageLength + COLUMN_OVERHEAD_BYTES;
    final double dailyGrowthRecords = last7Days / 7d;
    final double dailyGrowthKb = dailyGrowthRecords * perRecord / 1024d;
    return new SizeEstimate(
        round(perRecord),
        Math.round(total * perRecord / 1024d),
        round(dailyGrowthRecords),
        round(dailyGrowthKb),
        round(dailyGrowthKb * 30));
  }

  static List<MonthlyStatistic> monthlyDistribution(List<MonthlyActionCount> rows) {
    final Map<String, List<MonthlyActionCount>> byMonth = new TreeMap<>();
    for (MonthlyActionCount row : rows) {
      byMonth.computeIfAbsent(row.yearMonth(), ignored -> new ArrayList<>()).add(row);
    }
    final List<MonthlyStatistic> result = new ArrayList<>();
    byMonth.forEach(
        (month, counts) -> {
          final long monthTotal = counts.stream().mapToLong(MonthlyActionCount::count).sum();
          final Map<String, Long> top = new LinkedHashMap<>();
          counts.stream()
              .sorted(
                  (left, right) -> {
                    final int byCount = Long.compare(right.count(), left.count());
                    return byCount != 0 ? byCount : left.action().compareTo(right.action());
                  })
              .limit(TOP_ACTIONS_PER_MONTH)
              .forEach(count -> top.put(count.action(), count.count()));
          result.add(new MonthlyStatistic(month, monthTotal, top));
        });
    return result;
  }

  private static double percentage(long count, long total) {
    return total == 0 ? 0d : round(count * 100d / total);
  }

  private static double round(double value) {
    return Math.round(value * 100d) / 100d;
  }
}
