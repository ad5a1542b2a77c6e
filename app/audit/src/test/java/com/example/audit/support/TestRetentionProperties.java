package com.example.audit.support;

import com.example.audit.archive.ArchiveFormat;
import com.example.audit.config.AuditRetentionProperties;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/** Fluent builder for retention properties in unit tests. */
public final class TestRetentionProperties {

  private final Map<String, Integer> policies = new LinkedHashMap<>();
  private boolean cleanupEnabled = false;
  private int cleanupIntervalHours = 24;
  private boolean archiveBeforeDelete = false;
  private String archivePath = "target/test-archives";
  private ArchiveFormat archiveFormat = ArchiveFormat.JSON;
  private boolean compressArchives = false;
  private int batchSize = 1000;
  private int maxConcurrentCleanupTasks = 3;
  private boolean alertOnLargeCleanup = true;
  private int largeCleanupThreshold = 10000;
  private int archiveRetentionDays = 2555;
  private boolean autoCleanupArchives = false;
  private int maxArchiveSizeMb = 0;

  private TestRetentionProperties() {}

  public static TestRetentionProperties builder() {
    return new TestRetentionProperties();
  }

  public TestRetentionProperties policy(String actionType, int days) {
    policies.put(actionType, days);
    return this;
  }

  public TestRetentionProperties cleanupEnabled(boolean value) {
    cleanupEnabled = value;
    return this;
  }

  public TestRetentionProperties cleanupIntervalHours(int value) {
    cleanupIntervalHours = value;
    return this;
  }

  public TestRetentionProperties archiveBeforeDelete(boolean value) {
    archiveBeforeDelete = value;
    return this;
  }

  public TestRetentionProperties archivePath(Path value) {
    archivePath = value.toString();
    return this;
  }

  public TestRetentionProperties archiveFormat(ArchiveFormat value) {
    archiveFormat = value;
    return this;
  }

  public TestRetentionProperties compressArchives(boolean value) {
    compressArchives = value;
    return this;
  }

  public TestRetentionProperties batchSize(int value) {
    batchSize = value;
    return this;
  }

  public TestRetentionProperties maxConcurrentCleanupTasks(int value) {
    maxConcurrentCleanupTasks = value;
    return this;
  }

  public TestRetentionProperties largeCleanupThreshold(int value) {
    largeCleanupThreshold = value;
    return this;
  }

  public TestRetentionProperties alertOnLargeCleanup(boolean value) {
    alertOnLargeCleanup = value;
    return this;
  }

  public TestRetentionProperties archiveRetentionDays(int value) {
    archiveRetentionDays = value;
    return this;
  }

  public TestRetentionProperties autoCleanupArchives(boolean value) {
    autoCleanupArchives = value;
    return this;
  }

  public TestRetentionProperties maxArchiveSizeMb(int value) {
    maxArchiveSizeMb = value;
    return this;
  }

  public AuditRetentionProperties build() {
    return new AuditRetentionProperties(
        policies,
        cleanupEnabled,
        cleanupIntervalHours,
        archiveBeforeDelete,
        archivePath,
        archiveFormat,
        compressArchives,
        batchSize,
        maxConcurrentCleanupTasks,
        alertOnLargeCleanup,
        largeCleanupThreshold,
        archiveRetentionDays,
        autoCleanupArchives,
        maxArchiveSizeMb);
  }
}
