package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineStatistics;
import com.mindtrends.monitor.model.ObservationSeries;

import java.util.List;

/**
 * One anomaly detection method.
 *
 * Implementations are pure: the same series and baseline always give the same records.
 * They emit one record per observation they could evaluate and return an empty list,
 * never an exception, when the series is too short or has no spread.
 */
public interface AnomalyDetector {

    /** Stable identifier written to the anomaly report. */
    String name();

    /**
     * @param baseline statistics of the construct's baseline period, or null when none
     *                 could be computed
     */
    List<AnomalyRecord> evaluate(ObservationSeries series, BaselineStatistics baseline);
}
