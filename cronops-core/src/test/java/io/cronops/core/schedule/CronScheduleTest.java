package io.cronops.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.cronops.core.error.ValidationException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CronScheduleTest {

    @Test
    void shouldEvaluateWeekdayScheduleInLocalTime() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * 1-5", "America/New_York");

        // Monday 10:00 EDT, so the next slot is Tuesday 09:00 EDT
        Instant next = schedule.nextAfter(Instant.parse("2026-10-19T14:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-10-20T13:00:00Z"));
    }

    @Test
    void shouldSkipWeekendForWeekdaySchedule() {
        CronSchedule schedule = CronSchedule.parse("0 9 * * 1-5", "UTC");

        Instant next = schedule.nextAfter(Instant.parse("2026-10-23T10:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-10-26T09:00:00Z"));
    }

    @Test
    void shouldFireAtEndOfSpringForwardGap() {
        CronSchedule schedule = CronSchedule.parse("30 2 * * *", "America/New_York");

        // 02:30 does not exist on 2026-03-08 in New York; clocks jump from 02:00 EST to 03:00 EDT
        Instant next = schedule.nextAfter(Instant.parse("2026-03-08T06:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-03-08T07:00:00Z"));
    }

    @Test
    void shouldFireOnlyOnceDuringFallBackOverlap() {
        CronSchedule schedule = CronSchedule.parse("30 1 * * *", "America/New_York");

        Instant first = schedule.nextAfter(Instant.parse("2026-11-01T04:00:00Z")).orElseThrow();
        Instant second = schedule.nextAfter(first).orElseThrow();

        assertThat(first).isEqualTo(Instant.parse("2026-11-01T05:30:00Z"));
        assertThat(second).isEqualTo(Instant.parse("2026-11-02T06:30:00Z"));
    }

    @Test
    void shouldNotRepeatOverlappedTimeWhenStartingInSecondOccurrence() {
        CronSchedule schedule = CronSchedule.parse("30 1 * * *", "America/New_York");

        // 06:00Z is 01:00 EST, the second pass through the 01:xx hour
        Instant next = schedule.nextAfter(Instant.parse("2026-11-01T06:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-11-02T06:30:00Z"));
    }

    @Test
    void shouldJumpEverySecondScheduleToEndOfRepeatedHour() {
        CronSchedule schedule = CronSchedule.parse("* * * * * *", "America/New_York");

        assertThat(schedule.nextAfter(Instant.parse("2026-11-01T06:10:00Z")))
            .contains(Instant.parse("2026-11-01T07:00:00Z"));
        assertThat(schedule.nextAfter(Instant.parse("2026-11-01T06:59:59Z")))
            .contains(Instant.parse("2026-11-01T07:00:00Z"));
        assertThat(schedule.nextAfter(Instant.parse("2026-11-01T05:59:58Z")))
            .contains(Instant.parse("2026-11-01T05:59:59Z"));
        assertThat(schedule.nextAfter(Instant.parse("2026-11-01T05:59:59Z")))
            .contains(Instant.parse("2026-11-01T07:00:00Z"));
    }

    @Test
    void shouldReturnInstantStrictlyAfterReference() {
        CronSchedule schedule = CronSchedule.parse("*/15 * * * *", null);

        Instant onSlot = Instant.parse("2026-10-19T12:15:00Z");

        assertThat(schedule.zone().getId()).isEqualTo("UTC");
        assertThat(schedule.nextAfter(onSlot)).contains(Instant.parse("2026-10-19T12:30:00Z"));
    }

    @Test
    void shouldAcceptSixFieldExpressionWithSeconds() {
        CronSchedule schedule = CronSchedule.parse("30 0 12 * * *", "UTC");

        Instant next = schedule.nextAfter(Instant.parse("2026-10-19T12:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2026-10-19T12:00:30Z"));
    }

    @Test
    void shouldRejectMalformedExpressions() {
        assertThatThrownBy(() -> CronSchedule.parse("", "UTC"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CronSchedule.parse("* * *", "UTC"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("5 fields");
        assertThatThrownBy(() -> CronSchedule.parse("61 * * * *", "UTC"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CronSchedule.parse("every minute please", "UTC"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldRejectUnknownTimezone() {
        assertThatThrownBy(() -> CronSchedule.parse("0 * * * *", "Mars/Olympus_Mons"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Mars/Olympus_Mons");
    }
}
