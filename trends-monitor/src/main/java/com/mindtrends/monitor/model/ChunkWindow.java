package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * One bounded request to the upstream source: a construct over an inclusive date window.
 */
public record ChunkWindow(String construct, LocalDate startDate, LocalDate endDate) {

    /** {@code endDate - startDate} in days; the quantity the upstream span limit applies to. */
    public long spanDays() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public DateRange toRange() {
        return new DateRange(startDate, endDate);
    }

    @Override
    public String toString() {
        return construct + "[" + startDate + ".." + endDate + "]";
    }
}
