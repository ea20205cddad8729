package com.mindtrends.monitor.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Canonical reconciled series for one construct.
 *
 * Observations are on a single scale (the first successfully fetched chunk's) with strictly
 * increasing dates. Missing stretches that matter are listed in {@link #gaps()}; the
 * calibration links record how each chunk was rescaled. Instances are immutable.
 */
public record ObservationSeries(String construct,
                                List<DailyValue> observations,
                                List<DataGap> gaps,
                                List<CalibrationLink> calibration) {

    public ObservationSeries {
        observations = observations == null ? List.of() : List.copyOf(observations);
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        calibration = calibration == null ? List.of() : List.copyOf(calibration);
        for (int i = 1; i < observations.size(); i++) {
            LocalDate previous = observations.get(i - 1).date();
            LocalDate current = observations.get(i).date();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Observation dates must be strictly increasing for " + construct
                                + ": " + previous + " then " + current);
            }
        }
    }

    public static ObservationSeries empty(String construct, List<DataGap> gaps) {
        return new ObservationSeries(construct, List.of(), gaps, List.of());
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).value();
        }
        return values;
    }

    public Optional<LocalDate> firstDate() {
        return isEmpty() ? Optional.empty() : Optional.of(observations.get(0).date());
    }

    public Optional<LocalDate> lastDate() {
        return isEmpty() ? Optional.empty() : Optional.of(observations.get(observations.size() - 1).date());
    }

    public Optional<Double> valueOn(LocalDate date) {
        int idx = Collections.binarySearch(observations, new DailyValue(date, 0.0),
                (a, b) -> a.date().compareTo(b.date()));
        return idx >= 0 ? Optional.of(observations.get(idx).value()) : Optional.empty();
    }

    /** Observations whose date falls inside {@code range}, in date order. */
    public List<DailyValue> within(DateRange range) {
        List<DailyValue> selected = new ArrayList<>();
        for (DailyValue point : observations) {
            if (range.contains(point.date())) {
                selected.add(point);
            }
        }
        return selected;
    }

    /**
     * For each observation, the index of the first observation after the last marked gap
     * before it. Trailing windows that start there never reach across a gap.
     */
    public int[] segmentStarts() {
        int[] starts = new int[observations.size()];
        for (int i = 1; i < starts.length; i++) {
            LocalDate previous = observations.get(i - 1).date();
            LocalDate current = observations.get(i).date();
            boolean gapBetween = gaps.stream()
                    .anyMatch(gap -> gap.start().isAfter(previous) && gap.start().isBefore(current));
            starts[i] = gapBetween ? i : starts[i - 1];
        }
        return starts;
    }

    public long gapDays() {
        return gaps.stream().mapToLong(DataGap::days).sum();
    }

    public long lowConfidenceLinks() {
        return calibration.stream().filter(CalibrationLink::lowConfidence).count();
    }
}
