package com.example.push.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void convertsBothDirectionsAndKeepsNull() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30.123Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
