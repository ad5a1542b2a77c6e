/*
 * Where: Common utilities
 * What: Generates identifiers for correlating log lines of one unit of work
 * Why: Cleanup runs and HTTP requests need an id that can be put into the MDC
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String newRunId(String prefix) {
    final String id = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    return prefix == null || prefix.isBlank() ? id : prefix + "-" + id;
  }
}
