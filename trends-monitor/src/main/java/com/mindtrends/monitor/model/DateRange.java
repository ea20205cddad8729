package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive calendar-date range.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range needs both a start and an end");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Date range start " + start + " is after end " + end);
        }
    }

    public static DateRange of(String start, String end) {
        return new DateRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    /** Number of calendar days in the range, both ends included. */
    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
