package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Inclusive run of dates with no reconciled value.
 */
public record DataGap(LocalDate start, LocalDate end, GapReason reason) {

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
