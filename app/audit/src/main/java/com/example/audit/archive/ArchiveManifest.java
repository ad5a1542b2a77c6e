/*
 * Where: Audit archive format
 * What: Header describing one archive file
 * Why: Lets operators inspect an archive without reading every record
 */
package com.example.audit.archive;

import com.example.audit.model.AuditRecord;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({
  "actionType",
  "cutoffDate",
  "archiveDate",
  "logCount",
  "dateRange",
  "statistics"
})
public record ArchiveManifest(
    String actionType,
    Instant cutoffDate,
    Instant archiveDate,
    long logCount,
    ArchiveDateRange dateRange,
    ArchiveStatistics statistics) {

  static final int TOP_ACTIONS = 5;

  public static ArchiveManifest describe(
      String actionType, List<AuditRecord> records, Instant cutoffDate, Instant archiveDate) {
    return new ArchiveManifest(
        actionType,
        cutoffDate,
        archiveDate,
        records.size(),
        dateRange(records),
        statistics(records));
  }

  private static ArchiveDateRange dateRange(List<AuditRecord> records) {
    final List<Instant> createdAt =
        records.stream().map(AuditRecord::createdAt).filter(Objects::nonNull).toList();
    if (createdAt.isEmpty()) {
      return null;
    }
    return new ArchiveDateRange(
        createdAt.stream().min(Comparator.naturalOrder()).orElseThrow(),
        createdAt.stream().max(Comparator.naturalOrder()).orElseThrow());
  }

  private static ArchiveStatistics statistics(List<AuditRecord> records) {
    final long uniqueUsers =
        records.stream().map(AuditRecord::userId).filter(Objects::nonNull).distinct().count();
    final Map<String, Long> byAction =
        records.stream()
            .collect(Collectors.groupingBy(AuditRecord::action, Collectors.counting()));
    final Map<String, Long> topActions =
        byAction.entrySet().stream()
            .sorted(
                Map.Entry.<String, Long>comparingByValue()
                    .reversed()
                    .thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_ACTIONS)
            .collect(
                Collectors.toMap(
                    Map.Entry::getKey,
                    Map.Entry::getValue,
                    (left, right) -> left,
                    LinkedHashMap::new));
    return new ArchiveStatistics(records.size(), uniqueUsers, byAction.size(), topActions);
  }
}
