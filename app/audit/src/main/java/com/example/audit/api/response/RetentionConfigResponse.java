package com.example.audit.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "policies is copied into an unmodifiable map in the constructor")
public record RetentionConfigResponse(
    Map<String, Integer> policies,
    boolean cleanupEnabled,
    int cleanupIntervalHours,
    boolean archiveBeforeDelete,
    String archivePath,
    String archiveFormat,
    boolean compressArchives,
    int batchSize,
    int maxConcurrentCleanupTasks,
    boolean alertOnLargeCleanup,
    int largeCleanupThreshold,
    int archiveRetentionDays,
    boolean autoCleanupArchives,
    int maxArchiveSizeMb) {

  public RetentionConfigResponse {
    policies =
        policies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(policies));
  }
}
