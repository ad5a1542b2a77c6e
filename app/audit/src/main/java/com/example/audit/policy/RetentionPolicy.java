/*
 * Where: Audit retention policy
 * What: Immutable mapping from action type to retention days
 * Why: One cleanup run must see a single consistent policy table
 */
package com.example.audit.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

public final class RetentionPolicy {

  public static final String DEFAULT_KEY = "DEFAULT";

  /** Used when neither the action nor DEFAULT is configured. */
  public static final int FALLBACK_RETENTION_DAYS = 180;

  private static final Map<String, Integer> BUILT_IN;

  static {
    final Map<String, Integer> builtIn = new LinkedHashMap<>();
    builtIn.put("LOGIN", 180);
    builtIn.put("LOGOUT", 90);
    builtIn.put("REGISTER", 365);
    builtIn.put("PROFILE_UPDATED", 365);
    builtIn.put("BOOK_CREATED", 730);
    builtIn.put("BOOK_DELETED", 730);
    builtIn.put("BOOK_DOWNLOADED", 90);
    builtIn.put("BOOK_VIEWED", 30);
    builtIn.put("FAVORITE_ADDED", 90);
    builtIn.put("FAVORITE_REMOVED", 90);
    builtIn.put("UNAUTHORIZED_ACCESS", 365);
    builtIn.put("RATE_LIMIT_EXCEEDED", 90);
    builtIn.put("SYSTEM_ERROR", 365);
    builtIn.put(DEFAULT_KEY, 180);
    BUILT_IN = Collections.unmodifiableMap(builtIn);
  }

  private final Map<String, Integer> namedPolicies;
  private final Integer defaultDays;

  private RetentionPolicy(Map<String, Integer> namedPolicies, Integer defaultDays) {
    this.namedPolicies = namedPolicies;
    this.defaultDays = defaultDays;
  }

  public static RetentionPolicy of(Map<String, Integer> policies) {
    final Map<String, Integer> named = new LinkedHashMap<>();
    Integer defaultDays = null;
    for (Map.Entry<String, Integer> entry : policies.entrySet()) {
      final String actionType = entry.getKey();
      final Integer days = entry.getValue();
      if (actionType == null || actionType.isBlank()) {
        throw new IllegalArgumentException("policy action type must not be blank");
      }
      if (days == null || days <= 0) {
        throw new IllegalArgumentException(
            "retention days must be positive for " + actionType + ": " + days);
      }
      if (DEFAULT_KEY.equals(actionType)) {
        defaultDays = days;
      } else {
        named.put(actionType, days);
      }
    }
    return new RetentionPolicy(Collections.unmodifiableMap(named), defaultDays);
  }

  public static RetentionPolicy builtIn() {
    return of(BUILT_IN);
  }

  /** Exact action match, then DEFAULT, then {@link #FALLBACK_RETENTION_DAYS}. */
  public int resolve(String actionType) {
    if (actionType != null && !DEFAULT_KEY.equals(actionType)) {
      final Integer days = namedPolicies.get(actionType);
      if (days != null) {
        return days;
      }
    }
    return defaultDays != null ? defaultDays : FALLBACK_RETENTION_DAYS;
  }

  public Set<String> namedActions() {
    return namedPolicies.keySet();
  }

  public OptionalInt defaultDays() {
    return defaultDays == null ? OptionalInt.empty() : OptionalInt.of(defaultDays);
  }

  /** Named rules in configuration order, then the DEFAULT rule when one is configured. */
  public List<RetentionRule> rules() {
    final List<RetentionRule> rules = new ArrayList<>();
    namedPolicies.forEach((actionType, days) -> rules.add(RetentionRule.named(actionType, days)));
    if (defaultDays != null) {
      rules.add(RetentionRule.fallback(defaultDays));
    }
    return rules;
  }

  public Map<String, Integer> asMap() {
    final Map<String, Integer> all = new LinkedHashMap<>(namedPolicies);
    if (defaultDays != null) {
      all.put(DEFAULT_KEY, defaultDays);
    }
    return Collections.unmodifiableMap(all);
  }
}
