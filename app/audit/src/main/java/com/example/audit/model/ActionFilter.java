/*
 * Where: Audit domain model
 * What: Selects the actions a retention rule applies to
 * Why: Named policies match one action exactly, DEFAULT matches everything not named elsewhere
 */
package com.example.audit.model;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record ActionFilter(String action, Set<String> excludedActions) {

  public ActionFilter {
    excludedActions = excludedActions == null ? Set.of() : Set.copyOf(excludedActions);
  }

  public static ActionFilter only(String action) {
    if (action == null || action.isBlank()) {
      throw new IllegalArgumentException("action is required");
    }
    return new ActionFilter(action, Set.of());
  }

  public static ActionFilter allExcept(Collection<String> namedActions) {
    return new ActionFilter(null, namedActions == null ? Set.of() : Set.copyOf(namedActions));
  }

  public boolean fallback() {
    return action == null;
  }

  public boolean matches(String candidate) {
    if (!fallback()) {
      return action.equals(candidate);
    }
    return !excludedActions.contains(candidate);
  }

  /** Excluded actions in a stable order, for SQL binding and logs. */
  public List<String> sortedExclusions() {
    return List.copyOf(new TreeSet<>(excludedActions));
  }
}
