/*
 * Where: Common utilities
 * What: Converts between Instant and JDBC Timestamp in both directions
 * Why: Bind time values with an explicit type and map nullable columns without repetition
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps the same point in time regardless of DB session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
