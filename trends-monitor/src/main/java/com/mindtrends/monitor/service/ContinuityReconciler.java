package com.mindtrends.monitor.service;

import com.mindtrends.monitor.config.TrendsMonitorProperties;
import com.mindtrends.monitor.model.CalibrationLink;
import com.mindtrends.monitor.model.CalibrationLink.DegenerateReason;
import com.mindtrends.monitor.model.ChunkResult;
import com.mindtrends.monitor.model.DailyValue;
import com.mindtrends.monitor.model.DataGap;
import com.mindtrends.monitor.model.FetchFailure;
import com.mindtrends.monitor.model.GapReason;
import com.mindtrends.monitor.model.ObservationSeries;
import com.mindtrends.monitor.model.SeriesChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges the chunk results for one construct into a single series on one scale.
 *
 * The upstream normalises every window to its own 0-100 range, so raw values from two
 * windows are not comparable. For each pair of chronologically adjacent successful chunks
 * the shared dates give a ratio {@code mean(earlier) / mean(later)}; multiplying the later
 * chunk (and, cumulatively, everything after it) by that ratio puts the whole series on the
 * first chunk's scale. When the overlap is missing or averages zero the ratio falls back to
 * 1.0 and the link is marked low-confidence.
 *
 * Dates no successful chunk covers become {@link DataGap}s, attributed to the failed window
 * that should have supplied them. Stretches no window claimed at all are only marked when
 * longer than the tolerated gap.
 */
@Component
@Slf4j
public class ContinuityReconciler {

    public enum OverlapPolicy {
        /** Keep the later chunk's rescaled value on shared dates. */
        PREFER_LATER,
        /** Average every chunk's rescaled value on shared dates. */
        AVERAGE
    }

    private final OverlapPolicy overlapPolicy;
    private final int maxToleratedGapDays;

    @Autowired
    public ContinuityReconciler(TrendsMonitorProperties properties) {
        this(properties.getReconciliation().getOverlapPolicy(),
                properties.getReconciliation().getMaxToleratedGapDays());
    }

    public ContinuityReconciler(OverlapPolicy overlapPolicy, int maxToleratedGapDays) {
        this.overlapPolicy = overlapPolicy;
        this.maxToleratedGapDays = Math.max(0, maxToleratedGapDays);
    }

    public ObservationSeries reconcile(String construct, List<? extends ChunkResult> results) {
        List<ChunkResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparing((ChunkResult r) -> r.window().startDate())
                .thenComparing(r -> r.window().endDate()));

        List<SeriesChunk> successes = new ArrayList<>();
        List<ChunkResult> failures = new ArrayList<>();
        for (ChunkResult result : ordered) {
            if (result instanceof SeriesChunk && !((SeriesChunk) result).values().isEmpty()) {
                successes.add((SeriesChunk) result);
            } else {
                failures.add(result);
            }
        }

        if (successes.isEmpty()) {
            List<DataGap> gaps = findGaps(ordered, Map.of(), failures);
            log.warn("No usable chunks for {}: {} windows failed", construct, failures.size());
            return ObservationSeries.empty(construct, gaps);
        }

        List<CalibrationLink> links = new ArrayList<>();
        double[] scales = new double[successes.size()];
        scales[0] = 1.0;
        for (int k = 1; k < successes.size(); k++) {
            CalibrationLink link = calibrate(successes.get(k - 1), successes.get(k));
            if (link.lowConfidence()) {
                log.warn("Low-confidence calibration {} -> {}: {}", link.from(), link.to(), link.reason());
            }
            links.add(link);
            scales[k] = scales[k - 1] * link.ratio();
        }

        Map<LocalDate, Double> merged = merge(successes, scales);
        List<DataGap> gaps = findGaps(ordered, merged, failures);

        List<DailyValue> observations = new ArrayList<>(merged.size());
        merged.forEach((date, value) -> observations.add(new DailyValue(date, value)));

        ObservationSeries series = new ObservationSeries(construct, observations, gaps, links);
        log.info("Reconciled {}: {} observations from {} chunks, {} gaps ({} days), {} low-confidence links",
                construct, series.size(), successes.size(), gaps.size(), series.gapDays(), series.lowConfidenceLinks());
        return series;
    }

    // ── Calibration ──────────────────────────────────────────────────────────

    CalibrationLink calibrate(SeriesChunk earlier, SeriesChunk later) {
        Map<LocalDate, Double> earlierByDate = new HashMap<>();
        for (DailyValue value : earlier.values()) {
            earlierByDate.put(value.date(), value.value());
        }

        double earlierSum = 0.0;
        double laterSum = 0.0;
        int overlap = 0;
        for (DailyValue value : later.values()) {
            Double match = earlierByDate.get(value.date());
            if (match != null) {
                earlierSum += match;
                laterSum += value.value();
                overlap++;
            }
        }

        if (overlap == 0) {
            return new CalibrationLink(earlier.window(), later.window(), 1.0, 0, true, DegenerateReason.NO_OVERLAP);
        }
        if (earlierSum == 0.0 || laterSum == 0.0) {
            return new CalibrationLink(earlier.window(), later.window(), 1.0, overlap, true,
                    DegenerateReason.ZERO_OVERLAP_MEAN);
        }
        // Equal counts, so the ratio of sums is the ratio of means
        return new CalibrationLink(earlier.window(), later.window(), earlierSum / laterSum, overlap, false, null);
    }

    private Map<LocalDate, Double> merge(List<SeriesChunk> chunks, double[] scales) {
        TreeMap<LocalDate, Double> merged = new TreeMap<>();
        Map<LocalDate, Integer> counts = new HashMap<>();
        for (int k = 0; k < chunks.size(); k++) {
            for (DailyValue value : chunks.get(k).values()) {
                double rescaled = value.value() * scales[k];
                if (overlapPolicy == OverlapPolicy.AVERAGE) {
                    merged.merge(value.date(), rescaled, Double::sum);
                    counts.merge(value.date(), 1, Integer::sum);
                } else {
                    merged.put(value.date(), rescaled);
                }
            }
        }
        if (overlapPolicy == OverlapPolicy.AVERAGE) {
            merged.replaceAll((date, sum) -> sum / counts.get(date));
        }
        return merged;
    }

    // ── Gaps ─────────────────────────────────────────────────────────────────

    private List<DataGap> findGaps(List<ChunkResult> ordered, Map<LocalDate, Double> covered,
                                   List<ChunkResult> failures) {
        List<DataGap> gaps = new ArrayList<>();
        if (ordered.isEmpty()) {
            return gaps;
        }

        LocalDate first = ordered.get(0).window().startDate();
        LocalDate last = ordered.stream().map(r -> r.window().endDate()).max(Comparator.naturalOrder()).orElse(first);

        LocalDate runStart = null;
        GapReason runReason = null;
        for (LocalDate date = first; !date.isAfter(last); date = date.plusDays(1)) {
            GapReason reason = covered.containsKey(date) ? null : reasonFor(date, failures);
            if (runStart != null && reason != runReason) {
                addGap(gaps, runStart, date.minusDays(1), runReason);
                runStart = null;
            }
            if (reason != null && runStart == null) {
                runStart = date;
                runReason = reason;
            }
        }
        if (runStart != null) {
            addGap(gaps, runStart, last, runReason);
        }
        return gaps;
    }

    private GapReason reasonFor(LocalDate date, List<ChunkResult> failures) {
        GapReason reason = GapReason.NO_COVERAGE;
        for (ChunkResult failure : failures) {
            if (!failure.window().contains(date)) {
                continue;
            }
            if (failure instanceof FetchFailure && !((FetchFailure) failure).retriable()) {
                return GapReason.PERMANENT_FETCH_FAILURE;
            }
            reason = GapReason.RETRIES_EXHAUSTED;
        }
        return reason;
    }

    private void addGap(List<DataGap> gaps, LocalDate start, LocalDate end, GapReason reason) {
        DataGap gap = new DataGap(start, end, reason);
        if (reason == GapReason.NO_COVERAGE && gap.days() <= maxToleratedGapDays) {
            return;
        }
        gaps.add(gap);
    }
}
