package com.bot.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleSpecTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2030, 6, 1, 10, 0, 0);

    @Test
    void parse_intervals() {
        assertEquals(ScheduleSpec.every(Duration.ofSeconds(30)), ScheduleSpec.parse("30s"));
        assertEquals(ScheduleSpec.every(Duration.ofMinutes(5)), ScheduleSpec.parse("5m"));
        assertEquals(ScheduleSpec.every(Duration.ofHours(2)), ScheduleSpec.parse(" 2H "));
        assertEquals(ScheduleSpec.every(Duration.ofDays(1)), ScheduleSpec.parse("1d"));
    }

    @Test
    void parse_dailyAndOnce() {
        ScheduleSpec daily = ScheduleSpec.parse("08:30");
        assertEquals(ScheduleSpec.Kind.DAILY, daily.getKind());
        assertEquals(LocalTime.of(8, 30), daily.getTimeOfDay());
        assertTrue(daily.isRepeating());
        assertEquals(Duration.ofDays(1), daily.period());

        ScheduleSpec once = ScheduleSpec.parse("2031-01-01 12:00:00");
        assertEquals(ScheduleSpec.Kind.ONCE, once.getKind());
        assertEquals(LocalDateTime.of(2031, 1, 1, 12, 0), once.getAt());
        assertFalse(once.isRepeating());
        assertNull(once.period());
    }

    @Test
    void parse_rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpec.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpec.parse("25:99"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpec.parse("0s"));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpec.parse(""));
    }

    @Test
    void initialDelay_daily_rollsOverToTomorrowWhenPast() {
        assertEquals(Duration.ofMinutes(30), ScheduleSpec.dailyAt(LocalTime.of(10, 30)).initialDelay(NOW));
        assertEquals(Duration.ofHours(23), ScheduleSpec.dailyAt(LocalTime.of(9, 0)).initialDelay(NOW));
        assertEquals(Duration.ofDays(1), ScheduleSpec.dailyAt(LocalTime.of(10, 0)).initialDelay(NOW));
    }

    @Test
    void initialDelay_once_mustBeInFuture() {
        assertEquals(Duration.ofHours(2), ScheduleSpec.once(NOW.plusHours(2)).initialDelay(NOW));
        assertThrows(IllegalArgumentException.class, () -> ScheduleSpec.once(NOW).initialDelay(NOW));
    }

    @Test
    void initialDelay_interval_isOnePeriod() {
        assertEquals(Duration.ofSeconds(30), ScheduleSpec.parse("30s").initialDelay(NOW));
    }
}
