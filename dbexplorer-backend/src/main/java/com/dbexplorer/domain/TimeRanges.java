package com.dbexplorer.domain;

import lombok.Value;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Day boundaries in the user's time zone, expressed as instants for comparison with stored timestamps.
 */
public final class TimeRanges {

    @Value
    public static class Range {
        Instant start;
        Instant end;
    }

    private TimeRanges() {
    }

    public static LocalDate today(ZoneId zone, Clock clock) {
        return LocalDate.now(clock.withZone(zone));
    }

    /**
     * Start (inclusive) and end (exclusive) of today in the given zone.
     */
    public static Range todayRange(ZoneId zone, Clock clock) {
        return day(today(zone, clock), zone);
    }

    public static Range day(LocalDate date, ZoneId zone) {
        Instant start = date.atStartOfDay(zone).toInstant();
        Instant end = date.plusDays(1).atStartOfDay(zone).toInstant();
        return new Range(start, end);
    }

    /**
     * Local midnight {@code days} days before today.
     *
     * @param days number of days back, 0 for today's midnight
     * @param zone user time zone
     * @param clock clock
     * @return instant of that midnight
     */
    public static Instant daysAgo(int days, ZoneId zone, Clock clock) {
        return today(zone, clock).minusDays(days).atStartOfDay(zone).toInstant();
    }
}
