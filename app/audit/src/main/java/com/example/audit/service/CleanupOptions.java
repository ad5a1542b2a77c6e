/*
 * Where: Audit cleanup engine input
 * What: Typed options of one cleanup run
 * Why: Every entry point (scheduler, forced run, admin API) describes a run the same way
 */
package com.example.audit.service;

public record CleanupOptions(
    String actionType,
    Integer retentionDaysOverride,
    boolean archiveBeforeDelete,
    boolean previewOnly,
    CleanupTrigger trigger,
    String requestedBy,
    String clientIp) {

  public static final String ALL_ACTIONS = "all";
  public static final int MIN_RETENTION_DAYS = 1;
  public static final int MAX_RETENTION_DAYS = 3650;

  public CleanupOptions {
    if (actionType != null && actionType.isBlank()) {
      actionType = null;
    }
    if (retentionDaysOverride != null
        && (retentionDaysOverride < MIN_RETENTION_DAYS
            || retentionDaysOverride > MAX_RETENTION_DAYS)) {
      throw new IllegalArgumentException(
          "retention days must be between "
              + MIN_RETENTION_DAYS
              + " and "
              + MAX_RETENTION_DAYS
              + ": "
              + retentionDaysOverride);
    }
    if (trigger == null) {
      trigger = CleanupTrigger.MANUAL;
    }
  }

  public static CleanupOptions scheduled(boolean archiveBeforeDelete) {
    return new CleanupOptions(
        null, null, archiveBeforeDelete, false, CleanupTrigger.SCHEDULED, null, null);
  }

  public static CleanupOptions forced(
      boolean archiveBeforeDelete, String requestedBy, String clientIp) {
    return new CleanupOptions(
        null, null, archiveBeforeDelete, false, CleanupTrigger.FORCED, requestedBy, clientIp);
  }

  public static CleanupOptions manual(
      String actionType,
      Integer retentionDaysOverride,
      boolean archiveBeforeDelete,
      boolean previewOnly,
      String requestedBy,
      String clientIp) {
    return new CleanupOptions(
        actionType,
        retentionDaysOverride,
        archiveBeforeDelete,
        previewOnly,
        CleanupTrigger.MANUAL,
        requestedBy,
        clientIp);
  }

  public boolean allActions() {
    return actionType == null || ALL_ACTIONS.equalsIgnoreCase(actionType);
  }
}
