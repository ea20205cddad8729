package com.mindtrends.monitor.model;

/**
 * Summary of a construct's behavior over the baseline range.
 *
 * @param std sample standard deviation
 * @param mad raw median absolute deviation (not rescaled to a normal-consistent estimate)
 */
public record BaselineStatistics(String construct,
                                 DateRange range,
                                 double mean,
                                 double std,
                                 double median,
                                 double mad,
                                 long observedDays) {

    public double coverage() {
        return range.days() == 0 ? 0.0 : (double) observedDays / range.days();
    }
}
