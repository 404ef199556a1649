package com.company.signals.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void parsesOffsetAndLocalTimestamps() {
        assertThat(TimeUtils.parseTimestamp("2024-03-01T10:00:00Z")).contains(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(TimeUtils.parseTimestamp("2024-03-01T12:00:00+02:00"))
                .contains(Instant.parse("2024-03-01T10:00:00Z"));
        assertThat(TimeUtils.parseTimestamp("2024-03-01T10:00:00.123456"))
                .contains(Instant.parse("2024-03-01T10:00:00.123456Z"));
    }

    @Test
    void rejectsBlankAndGarbage() {
        assertThat(TimeUtils.parseTimestamp(null)).isEmpty();
        assertThat(TimeUtils.parseTimestamp(" ")).isEmpty();
        assertThat(TimeUtils.parseTimestamp("last tuesday")).isEmpty();
    }

    @Test
    void formatsDurations() {
        assertThat(TimeUtils.formatDuration(null)).isNull();
        assertThat(TimeUtils.formatDuration(42_000L)).isEqualTo("42s");
        assertThat(TimeUtils.formatDuration(125_000L)).isEqualTo("2m 5s");
        assertThat(TimeUtils.formatDuration(3_900_000L)).isEqualTo("1h 5m");
    }
}
