package com.mindtrends.monitor.detection;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineStatistics;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.ObservationSeries;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares each observation with the mean and std of the {@code window} observations
 * before it. The reference moves with the series, so steady trends and slow seasonal
 * drift are not reported, only departures from the recent level.
 *
 * The trailing window restarts after every marked {@code DataGap}, so it never mixes values
 * from both sides of a missing stretch. The first {@code window} observations of the series,
 * and of each stretch after a gap, have no full trailing window; they are judged against the
 * baseline statistics when given and skipped otherwise.
 */
@Component
@Order(4)
public class RollingStatisticsDetector implements AnomalyDetector {

    public static final String NAME = "rolling_stats";

    private final int window;
    private final double threshold;

    @Autowired
    public RollingStatisticsDetector(TrendsMonitorProperties properties) {
        this(properties.getDetection().getRolling().getWindow(), properties.getDetection().getRolling().getThreshold());
    }

    public RollingStatisticsDetector(int window, double threshold) {
        if (window < 2) {
            throw new IllegalArgumentException("Rolling window must be at least 2, got " + window);
        }
        this.window = window;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AnomalyRecord> evaluate(ObservationSeries series, BaselineStatistics baseline) {
        boolean seeded = baseline != null && baseline.std() > 0.0;
        if (series.size() <= window && !seeded) {
            return List.of();
        }

        double[] values = series.values();
        int[] segmentStarts = series.segmentStarts();
        List<DailyValue> points = series.observations();
        List<AnomalyRecord> records = new ArrayList<>(values.length);

        for (int i = 0; i < values.length; i++) {
            double mean;
            double std;
            if (i - segmentStarts[i] >= window) {
                mean = SeriesStatistics.mean(values, i - window, i);
                std = SeriesStatistics.std(values, i - window, i);
            } else if (seeded) {
                mean = baseline.mean();
                std = baseline.std();
            } else {
                continue;
            }
            if (!(std > 0.0)) {
                continue;
            }

            double score = Math.abs(values[i] - mean) / std;
            DailyValue point = points.get(i);
            records.add(AnomalyRecord.of(series.construct(), point.date(), NAME, point.value(), score, score > threshold));
        }
        return records;
    }
}
