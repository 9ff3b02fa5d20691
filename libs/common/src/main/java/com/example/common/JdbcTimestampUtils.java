/*
 * Where: Common utilities
 * What: Converts between Instant and JDBC Timestamp
 * Why: PostgreSQL JDBC cannot infer a SQL type for a bare Instant parameter
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it as-is regardless of the DB session zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
