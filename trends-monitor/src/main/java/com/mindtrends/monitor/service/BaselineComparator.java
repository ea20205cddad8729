package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.detection.SeriesStatistics;
import com.mindtrends.monitor.model.AnomalyRecord;
import com.mindtrends.monitor.model.BaselineResult;
import com.mindtrends.monitor.model.BaselineStatistics;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.DateRange;
import com.mindtrends.monitor.model.ObservationSeries;
import com.mindtrends.monitor.model.PeriodImpact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Describes a construct's baseline period and measures everything else against it.
 *
 * Statistics are only produced when the baseline range is almost fully covered by
 * reconciled data; a baseline built from a fraction of the period would silently shift
 * every relative change computed from it.
 */
@Component
@Slf4j
public class BaselineComparator {

    private final double coverageTolerance;

    @Autowired
    public BaselineComparator(TrendsMonitorProperties properties) {
        this(properties.getBaseline().getCoverageTolerance());
    }

    public BaselineComparator(double coverageTolerance) {
        if (coverageTolerance < 0.0 || coverageTolerance >= 1.0) {
            throw new IllegalArgumentException("Coverage tolerance must be in [0, 1), got " + coverageTolerance);
        }
        this.coverageTolerance = coverageTolerance;
    }

    public BaselineResult compare(ObservationSeries series, DateRange baselineRange) {
        List<DailyValue> points = series.within(baselineRange);
        double coverage = (double) points.size() / baselineRange.days();

        if (points.size() < 2 || 1.0 - coverage > coverageTolerance) {
            String reason = String.format(Locale.ROOT, "%d of %d baseline days observed (%.1f%%)",
                    points.size(), baselineRange.days(), coverage * 100.0);
            log.warn("Insufficient baseline for {} over {}: {}", series.construct(), baselineRange, reason);
            return BaselineResult.insufficient(series.construct(), baselineRange, coverage, reason);
        }

        double[] values = points.stream().mapToDouble(DailyValue::value).toArray();
        BaselineStatistics statistics = new BaselineStatistics(
                series.construct(),
                baselineRange,
                SeriesStatistics.mean(values),
                SeriesStatistics.std(values),
                SeriesStatistics.median(values),
                SeriesStatistics.mad(values),
                points.size());

        log.debug("Baseline for {}: mean={} std={} median={} mad={}", series.construct(),
                statistics.mean(), statistics.std(), statistics.median(), statistics.mad());
        return BaselineResult.of(statistics);
    }

    /**
     * Adds {@code (value - baseline.mean) / baseline.std} to every record. Records are returned
     * unchanged when the baseline is insufficient or has no spread.
     */
    public List<AnomalyRecord> annotate(List<AnomalyRecord> records, BaselineResult baseline) {
        Optional<BaselineStatistics> statistics = baseline.statisticsIfSufficient();
        if (statistics.isEmpty() || !(statistics.get().std() > 0.0)) {
            return records;
        }
        double mean = statistics.get().mean();
        double std = statistics.get().std();
        return records.stream()
                .map(r -> r.withRelativeChange((r.value() - mean) / std))
                .toList();
    }

    /**
     * Mean, percent change against the baseline mean, and peak of a comparison period.
     * Empty when the baseline is insufficient, its mean is zero, or the period has no data.
     */
    public Optional<PeriodImpact> impact(ObservationSeries series, BaselineResult baseline, DateRange period) {
        Optional<BaselineStatistics> statistics = baseline.statisticsIfSufficient();
        List<DailyValue> points = series.within(period);
        if (statistics.isEmpty() || statistics.get().mean() == 0.0 || points.isEmpty()) {
            return Optional.empty();
        }

        double baselineMean = statistics.get().mean();
        double periodMean = points.stream().mapToDouble(DailyValue::value).average().orElse(0.0);
        DailyValue peak = points.get(0);
        for (DailyValue point : points) {
            if (point.value() > peak.value()) {
                peak = point;
            }
        }

        return Optional.of(new PeriodImpact(series.construct(), period, baselineMean, periodMean,
                (periodMean - baselineMean) / baselineMean * 100.0, peak.value(), peak.date()));
    }
}
