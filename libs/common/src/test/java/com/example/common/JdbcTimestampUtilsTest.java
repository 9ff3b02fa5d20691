package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant INSTANT = Instant.parse("2026-03-02T23:00:30.123Z");

  @Test
  void convertsBothDirectionsWithoutShiftingTheInstant() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(INSTANT);

    assertThat(timestamp.getTime()).isEqualTo(INSTANT.toEpochMilli());
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(INSTANT);
  }

  @Test
  void passesNullThrough() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
