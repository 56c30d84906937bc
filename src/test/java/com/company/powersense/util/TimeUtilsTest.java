package com.company.powersense.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeUtilsTest {

    @Test
    void parsesAcceptedTimestampForms() {
        Instant expected = Instant.parse("2025-01-01T10:15:00Z");

        assertThat(TimeUtils.parseTimestamp("2025-01-01T10:15:00Z")).contains(expected);
        assertThat(TimeUtils.parseTimestamp("2025-01-01T11:15:00+01:00")).contains(expected);
        assertThat(TimeUtils.parseTimestamp("2025-01-01T10:15:00")).contains(expected);
        assertThat(TimeUtils.parseTimestamp("2025-01-01 10:15:00")).contains(expected);
        assertThat(TimeUtils.parseTimestamp("2025-01-01T10:15")).contains(expected);
        assertThat(TimeUtils.parseTimestamp("2025-01-01")).contains(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void rejectsGarbage() {
        assertThat(TimeUtils.parseTimestamp(null)).isEmpty();
        assertThat(TimeUtils.parseTimestamp("  ")).isEmpty();
        assertThat(TimeUtils.parseTimestamp("01/01/2025 10:15")).isEmpty();
        assertThat(TimeUtils.parseTimestamp("2025-13-01T00:00:00Z")).isEmpty();
    }

    @Test
    void combinesDateAndShortTime() {
        assertThat(TimeUtils.combineDateAndTime("2025-01-01", "23:45"))
                .contains(Instant.parse("2025-01-01T23:45:00Z"));
        assertThat(TimeUtils.combineDateAndTime("2025-01-01T00:00:00", "23:45:30"))
                .contains(Instant.parse("2025-01-01T23:45:30Z"));
        assertThat(TimeUtils.combineDateAndTime(null, "23:45")).isEmpty();
    }

    @Test
    void recognisesDateAndTimeLikeText() {
        assertThat(TimeUtils.isDateLike("2025-01-01")).isTrue();
        assertThat(TimeUtils.isDateLike("2025-01-01T10:00")).isTrue();
        assertThat(TimeUtils.isDateLike("France")).isFalse();
        assertThat(TimeUtils.isTimeLike("10:00")).isTrue();
        assertThat(TimeUtils.isTimeLike("10:00:30")).isTrue();
        assertThat(TimeUtils.isTimeLike("10h00")).isFalse();
    }

    @Test
    void chunksRangeIntoHalfOpenWindows() {
        Instant start = Instant.parse("2025-01-01T00:00:00Z");
        Instant end = Instant.parse("2025-01-03T12:00:00Z");

        List<Instant[]> windows = TimeUtils.chunkTimeRange(start, end, Duration.ofHours(24));

        assertThat(windows).hasSize(3);
        assertThat(windows.get(0)).containsExactly(start, Instant.parse("2025-01-02T00:00:00Z"));
        assertThat(windows.get(1)[0]).isEqualTo(windows.get(0)[1]);
        assertThat(windows.get(2)).containsExactly(Instant.parse("2025-01-03T00:00:00Z"), end);
    }

    @Test
    void emptyRangeHasNoWindows() {
        Instant t = Instant.parse("2025-01-01T00:00:00Z");
        assertThat(TimeUtils.chunkTimeRange(t, t, Duration.ofHours(1))).isEmpty();
    }

    @Test
    void chunkStepMustBePositive() {
        Instant t = Instant.parse("2025-01-01T00:00:00Z");
        assertThatThrownBy(() -> TimeUtils.chunkTimeRange(t, t.plusSeconds(60), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void isoSecondsAlwaysCarriesSeconds() {
        assertThat(TimeUtils.toIsoSeconds(Instant.parse("2025-01-01T10:00:00.123Z")))
                .isEqualTo("2025-01-01T10:00:00Z");
    }
}
