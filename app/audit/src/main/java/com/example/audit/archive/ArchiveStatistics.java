package com.example.audit.archive;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Summary of the archived records; {@code topActions} keeps descending count order. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"totalLogs", "uniqueUsers", "uniqueActions", "topActions"})
public record ArchiveStatistics(
    long totalLogs, long uniqueUsers, long uniqueActions, Map<String, Long> topActions) {

  public ArchiveStatistics {
    topActions =
        topActions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(topActions));
  }
}
