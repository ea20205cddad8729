package com.mindtrends.monitor.model;

import java.time.LocalDate;

/**
 * One detector's verdict on one observation.
 *
 * @param relativeChange standardized distance from the baseline mean; null until the
 *                       baseline comparison has run or when the baseline has no spread
 */
public record AnomalyRecord(String construct,
                            LocalDate date,
                            String detectorName,
                            double value,
                            double score,
                            boolean flagged,
                            Double relativeChange) {

    public static AnomalyRecord of(String construct, LocalDate date, String detectorName,
                                   double value, double score, boolean flagged) {
        return new AnomalyRecord(construct, date, detectorName, value, score, flagged, null);
    }

    public AnomalyRecord withRelativeChange(Double change) {
        return new AnomalyRecord(construct, date, detectorName, value, score, flagged, change);
    }
}
