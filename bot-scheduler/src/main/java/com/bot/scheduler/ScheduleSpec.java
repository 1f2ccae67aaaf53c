package com.bot.scheduler;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * When a scheduled task runs. Three kinds:
 * <ul>
 *   <li>{@link Kind#INTERVAL} – every fixed duration, first run one interval from now ({@code "30s"}, {@code "5m"}, {@code "2h"}, {@code "1d"})</li>
 *   <li>{@link Kind#DAILY} – every day at a local time ({@code "08:30"})</li>
 *   <li>{@link Kind#ONCE} – once at a local date-time ({@code "2030-01-01 12:00:00"})</li>
 * </ul>
 */
public final class ScheduleSpec {

    public enum Kind { INTERVAL, DAILY, ONCE }

    private static final Pattern INTERVAL_PATTERN = Pattern.compile("(\\d+)\\s*([smhd])");
    private static final Pattern DAILY_PATTERN = Pattern.compile("\\d{1,2}:\\d{2}");
    private static final DateTimeFormatter DAILY_FORMAT = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter ONCE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Kind kind;
    private final Duration interval;
    private final LocalTime timeOfDay;
    private final LocalDateTime at;

    private ScheduleSpec(Kind kind, Duration interval, LocalTime timeOfDay, LocalDateTime at) {
        this.kind = kind;
        this.interval = interval;
        this.timeOfDay = timeOfDay;
        this.at = at;
    }

    public static ScheduleSpec every(Duration interval) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        return new ScheduleSpec(Kind.INTERVAL, interval, null, null);
    }

    public static ScheduleSpec dailyAt(LocalTime timeOfDay) {
        return new ScheduleSpec(Kind.DAILY, null, Objects.requireNonNull(timeOfDay, "timeOfDay"), null);
    }

    public static ScheduleSpec once(LocalDateTime at) {
        return new ScheduleSpec(Kind.ONCE, null, null, Objects.requireNonNull(at, "at"));
    }

    /**
     * Parses {@code "<n>s|m|h|d"}, {@code "HH:mm"} or {@code "yyyy-MM-dd HH:mm:ss"}.
     *
     * @throws IllegalArgumentException if the text matches none of them
     */
    public static ScheduleSpec parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Schedule must be non-blank");
        }
        String t = text.trim();
        Matcher m = INTERVAL_PATTERN.matcher(t.toLowerCase(Locale.ROOT));
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "s":
                    return every(Duration.ofSeconds(n));
                case "m":
                    return every(Duration.ofMinutes(n));
                case "h":
                    return every(Duration.ofHours(n));
                default:
                    return every(Duration.ofDays(n));
            }
        }
        try {
            if (DAILY_PATTERN.matcher(t).matches()) {
                return dailyAt(LocalTime.parse(t, DAILY_FORMAT));
            }
            return once(LocalDateTime.parse(t, ONCE_FORMAT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognised schedule: " + text, e);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /** Period for INTERVAL; null otherwise. */
    public Duration getInterval() {
        return interval;
    }

    /** Local time for DAILY; null otherwise. */
    public LocalTime getTimeOfDay() {
        return timeOfDay;
    }

    /** Date-time for ONCE; null otherwise. */
    public LocalDateTime getAt() {
        return at;
    }

    /** True if the task repeats (INTERVAL or DAILY). */
    public boolean isRepeating() {
        return kind != Kind.ONCE;
    }

    /** Period between runs for repeating specs; null for ONCE. */
    public Duration period() {
        switch (kind) {
            case INTERVAL:
                return interval;
            case DAILY:
                return Duration.ofDays(1);
            default:
                return null;
        }
    }

    /**
     * Delay from {@code now} until the first run. For DAILY, a time already past today is
     * scheduled for tomorrow.
     *
     * @throws IllegalArgumentException for a ONCE spec whose time is not in the future
     */
    public Duration initialDelay(LocalDateTime now) {
        switch (kind) {
            case INTERVAL:
                return interval;
            case DAILY: {
                LocalDateTime next = now.toLocalDate().atTime(timeOfDay);
                if (!next.isAfter(now)) {
                    next = next.plusDays(1);
                }
                return Duration.between(now, next);
            }
            default: {
                if (!at.isAfter(now)) {
                    throw new IllegalArgumentException("One-shot schedule is in the past: " + at.format(ONCE_FORMAT));
                }
                return Duration.between(now, at);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleSpec)) return false;
        ScheduleSpec that = (ScheduleSpec) o;
        return kind == that.kind && Objects.equals(interval, that.interval)
                && Objects.equals(timeOfDay, that.timeOfDay) && Objects.equals(at, that.at);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, interval, timeOfDay, at);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INTERVAL:
                return "every " + interval;
            case DAILY:
                return "daily at " + timeOfDay;
            default:
                return "once at " + at.format(ONCE_FORMAT);
        }
    }
}
