/*
 * Where: Audit application configuration binding
 * What: Holds retention policies, archive settings and cleanup scheduling knobs
 * Why: Operators tune retention per environment without code changes
 */
package com.example.audit.config;

import com.example.audit.archive.ArchiveFormat;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Retention settings under {@code audit.retention}.
 *
 * <p>Policy keys containing underscores must be bracketed in YAML ({@code "[BOOK_VIEWED]": 30}),
 * otherwise the binder strips the underscore from the map key.
 */
@ConfigurationProperties(prefix = "audit.retention")
@Validated
public record AuditRetentionProperties(
    Map<String, Integer> policies,
    @DefaultValue("true") boolean cleanupEnabled,
    @DefaultValue("24") @Positive int cleanupIntervalHours,
    @DefaultValue("true") boolean archiveBeforeDelete,
    @DefaultValue("archives/audit") @NotBlank String archivePath,
    @DefaultValue("JSON") @NotNull ArchiveFormat archiveFormat,
    @DefaultValue("true") boolean compressArchives,
    @DefaultValue("1000") @Positive @Max(10000) int batchSize,
    @DefaultValue("3") @Positive int maxConcurrentCleanupTasks,
    @DefaultValue("true") boolean alertOnLargeCleanup,
    @DefaultValue("10000") @PositiveOrZero int largeCleanupThreshold,
    @DefaultValue("2555") @Positive int archiveRetentionDays,
    @DefaultValue("false") boolean autoCleanupArchives,
    @DefaultValue("0") @PositiveOrZero int maxArchiveSizeMb) {

  public AuditRetentionProperties {
    // insertion order drives the order policies are processed in
    policies =
        policies == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(policies));
  }

  @AssertTrue(message = "audit.retention.policies values must be positive")
  public boolean isEveryPolicyPositive() {
    return policies.values().stream().allMatch(days -> days != null && days > 0);
  }

  public Duration cleanupInterval() {
    return Duration.ofHours(cleanupIntervalHours);
  }
}
