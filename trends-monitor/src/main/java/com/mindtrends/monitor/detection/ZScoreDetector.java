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
 * Flags observations more than {@code threshold} standard deviations from the mean.
 * The baseline mean and std are used when available, the whole series otherwise.
 */
@Component
@Order(1)
public class ZScoreDetector implements AnomalyDetector {

    public static final String NAME = "zscore";

    private final double threshold;

    @Autowired
    public ZScoreDetector(TrendsMonitorProperties properties) {
        this(properties.getDetection().getZscoreThreshold());
    }

    public ZScoreDetector(double threshold) {
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AnomalyRecord> evaluate(ObservationSeries series, BaselineStatistics baseline) {
        if (series.size() < 2) {
            return List.of();
        }

        double mean;
        double std;
        if (baseline != null && baseline.std() > 0.0) {
            mean = baseline.mean();
            std = baseline.std();
        } else {
            double[] values = series.values();
            mean = SeriesStatistics.mean(values);
            std = SeriesStatistics.std(values);
        }
        if (!(std > 0.0)) {
            return List.of();
        }

        List<AnomalyRecord> records = new ArrayList<>(series.size());
        for (DailyValue point : series.observations()) {
            double score = Math.abs(point.value() - mean) / std;
            records.add(AnomalyRecord.of(series.construct(), point.date(), NAME, point.value(), score, score > threshold));
        }
        return records;
    }
}
