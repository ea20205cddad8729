package com.mindtrends.monitor.detection;

import java.util.Arrays;

/**
 * Descriptive statistics over plain value arrays. Empty input yields NaN.
 */
public final class SeriesStatistics {

    /** Scales mean absolute deviation to a normal-consistent spread when MAD is zero. */
    static final double MEAN_AD_CONSISTENCY = 1.253314;

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    public static double mean(double[] values, int from, int to) {
        if (to <= from) return Double.NaN;
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /** Sample standard deviation (n - 1 denominator); 0 for a single value. */
    public static double std(double[] values) {
        return std(values, 0, values.length);
    }

    public static double std(double[] values, int from, int to) {
        int n = to - from;
        if (n <= 0) return Double.NaN;
        if (n == 1) return 0.0;
        double mean = mean(values, from, to);
        double sumSquares = 0.0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (n - 1));
    }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /** Median absolute deviation around the median, unscaled. */
    public static double mad(double[] values) {
        return median(absoluteDeviations(values, median(values)));
    }

    public static double meanAbsoluteDeviation(double[] values, double center) {
        return mean(absoluteDeviations(values, center));
    }

    private static double[] absoluteDeviations(double[] values, double center) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return deviations;
    }
}
