package com.insightflo.news.search;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Inclusive publication window.
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("DateRange needs both start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("DateRange end " + end + " is before start " + start);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    public static DateRange today(Clock clock) {
        LocalDate today = LocalDate.now(clock);
        ZoneId zone = clock.getZone();
        Instant start = today.atStartOfDay(zone).toInstant();
        return new DateRange(start, today.plusDays(1).atStartOfDay(zone).toInstant());
    }

    public static DateRange lastWeek(Clock clock) {
        return lastDays(clock, 7);
    }

    public static DateRange lastMonth(Clock clock) {
        return lastDays(clock, 30);
    }

    public static DateRange lastYear(Clock clock) {
        return lastDays(clock, 365);
    }

    private static DateRange lastDays(Clock clock, int days) {
        Instant now = clock.instant();
        return new DateRange(now.minus(Duration.ofDays(days)), now);
    }
}
