package com.example.audit.policy;

import com.example.audit.model.ActionFilter;
import java.util.Collection;

/**
 * One (action type, retention days) pair of a cleanup run.
 *
 * <p>A fallback rule carries the DEFAULT key and matches every action not named by another
 * policy.
 */
public record RetentionRule(String actionType, int retentionDays, boolean fallback) {

  public RetentionRule {
    if (actionType == null || actionType.isBlank()) {
      throw new IllegalArgumentException("actionType is required");
    }
    if (retentionDays <= 0) {
      throw new IllegalArgumentException("retentionDays must be positive: " + retentionDays);
    }
  }

  public static RetentionRule named(String actionType, int retentionDays) {
    return new RetentionRule(actionType, retentionDays, false);
  }

  public static RetentionRule fallback(int retentionDays) {
    return new RetentionRule(RetentionPolicy.DEFAULT_KEY, retentionDays, true);
  }

  public RetentionRule withRetentionDays(int days) {
    return new RetentionRule(actionType, days, fallback);
  }

  public ActionFilter toFilter(Collection<String> namedActions) {
    return fallback ? ActionFilter.allExcept(namedActions) : ActionFilter.only(actionType);
  }
}
