package com.mindtrends.monitor.detection;

import com.amazon.randomcutforest.RandomCutForest;
import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineStatistics;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.ObservationSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Unsupervised isolation scoring with a Random Cut Forest.
 *
 * Each observation becomes a point {@code [value, value - trailingMean, trailingStd]} over
 * the {@code featureWindow} observations before it, so a value can stand out either by
 * level or by how sharply it breaks from its recent context. The trailing window restarts
 * after a marked gap. The forest is trained on the
 * whole series and then scores every point; the top {@code contamination} fraction by
 * score is flagged, whatever the absolute score. A fixed seed keeps reruns identical.
 */
@Slf4j
@Component
@Order(3)
public class IsolationForestDetector implements AnomalyDetector {

    public static final String NAME = "isolation_forest";

    private static final int DIMENSIONS = 3;

    private final TrendsMonitorProperties.Detection.Isolation settings;

    @Autowired
    public IsolationForestDetector(TrendsMonitorProperties properties) {
        this(properties.getDetection().getIsolation());
    }

    public IsolationForestDetector(TrendsMonitorProperties.Detection.Isolation settings) {
        if (settings.getContamination() < 0.0 || settings.getContamination() > 0.5) {
            throw new IllegalArgumentException("Contamination must be in [0, 0.5], got " + settings.getContamination());
        }
        this.settings = settings;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<AnomalyRecord> evaluate(ObservationSeries series, BaselineStatistics baseline) {
        int n = series.size();
        if (n < Math.max(2, settings.getMinPoints())) {
            return List.of();
        }

        double[][] features = features(series.values(), series.segmentStarts(), Math.max(1, settings.getFeatureWindow()));
        double[] scores = score(features);

        int flagCount = Math.min(n, (int) Math.ceil(settings.getContamination() * n));
        boolean[] flagged = new boolean[n];
        IntStream.range(0, n)
                .boxed()
                .sorted(Comparator.<Integer>comparingDouble(i -> scores[i]).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .limit(flagCount)
                .forEach(i -> flagged[i] = true);

        List<DailyValue> points = series.observations();
        List<AnomalyRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            DailyValue point = points.get(i);
            records.add(AnomalyRecord.of(series.construct(), point.date(), NAME, point.value(), scores[i], flagged[i]));
        }
        log.debug("Isolation scoring for {}: {} points, {} flagged", series.construct(), n, flagCount);
        return records;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    double[][] features(double[] values, int[] segmentStarts, int window) {
        double[][] features = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            int from = Math.max(segmentStarts[i], i - window);
            double trailingMean = from == i ? values[i] : SeriesStatistics.mean(values, from, i);
            double trailingStd = i - from < 2 ? 0.0 : SeriesStatistics.std(values, from, i);
            features[i] = new double[] {values[i], values[i] - trailingMean, trailingStd};
        }
        return features;
    }

    private double[] score(double[][] features) {
        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(DIMENSIONS)
                .numberOfTrees(settings.getNumberOfTrees())
                .sampleSize(settings.getSampleSize())
                .randomSeed(settings.getRandomSeed())
                .outputAfter(1)
                .build();

        for (double[] point : features) {
            forest.update(point);
        }

        double[] scores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scores[i] = forest.getAnomalyScore(features[i]);
        }
        return scores;
    }
}
