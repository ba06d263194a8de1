package com.trendsentinel.core.detection;

import java.util.Arrays;

/**
 * Descriptive statistics shared by the detectors.
 *
 * <p>
 * All methods take a half-open index range {@code [from, to)} so callers can
 * work on windows without copying.
 * </p>
 */
final class Statistics {

    private Statistics() {
        // utility class
    }

    static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    /**
     * Sample standard deviation (n − 1 denominator).
     *
     * @return the deviation, or {@code NaN} for fewer than two values
     */
    static double sampleStdDev(double[] values, int from, int to, double mean) {
        int n = to - from;
        if (n < 2) {
            return Double.NaN;
        }
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (n - 1));
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1
                ? sorted[mid]
                : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param values   non-empty input
     * @param fraction percentile as a fraction in [0, 1]
     */
    static double percentile(double[] values, double fraction) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double rank = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
