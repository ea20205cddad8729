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
 * Robust z-score: {@code 0.6745 * |x - median| / MAD}.
 *
 * Median and MAD barely move when a few extreme spikes are present, so the spikes do not
 * mask themselves the way they inflate a standard deviation. When more than half the
 * values are identical MAD is 0; the spread then falls back to the mean absolute
 * deviation scaled to be comparable ({@code |x - median| / (1.2533 * meanAD)}).
 */
@Component
@Order(2)
public class ModifiedZScoreDetector implements AnomalyDetector {

    public static final String NAME = "modified_zscore";

    static final double CONSISTENCY = 0.6745;

    private final double threshold;

    @Autowired
    public ModifiedZScoreDetector(TrendsMonitorProperties properties) {
        this(properties.getDetection().getMadThreshold());
    }

    public ModifiedZScoreDetector(double threshold) {
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

        double median;
        double scale;
        if (baseline != null && baseline.mad() > 0.0) {
            median = baseline.median();
            scale = baseline.mad() / CONSISTENCY;
        } else {
            double[] values = series.values();
            median = SeriesStatistics.median(values);
            double mad = SeriesStatistics.mad(values);
            scale = mad > 0.0
                    ? mad / CONSISTENCY
                    : SeriesStatistics.MEAN_AD_CONSISTENCY * SeriesStatistics.meanAbsoluteDeviation(values, median);
        }
        if (!(scale > 0.0)) {
            return List.of();
        }

        List<AnomalyRecord> records = new ArrayList<>(series.size());
        for (DailyValue point : series.observations()) {
            double score = Math.abs(point.value() - median) / scale;
            records.add(AnomalyRecord.of(series.construct(), point.date(), NAME, point.value(), score, score > threshold));
        }
        return records;
    }
}
