package com.energysentinel.core.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double} arrays.
 *
 * <p>
 * Standard deviations use the sample (n - 1) denominator and quantiles use
 * linear interpolation between closest ranks, so results line up with the
 * usual data-frame conventions.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    private Stats() {
        // utility class, not instantiable
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation; {@code NaN} for fewer than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    public static double max(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return values.length == 0 ? Double.NaN : max;
    }

    /**
     * Quantile with linear interpolation.
     *
     * @param values unsorted values; not modified
     * @param q      quantile in [0, 1]
     * @return the interpolated quantile, {@code NaN} when {@code values} is
     *         empty
     */
    public static double quantile(double[] values, double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("quantile must be in [0, 1], got: " + q);
        }
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return quantileOfSorted(sorted, q);
    }

    static double quantileOfSorted(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    /**
     * Replace {@code NaN} entries by linear interpolation on position. Leading
     * and trailing runs take the nearest valid value. An array without any
     * valid value is returned unchanged.
     *
     * @param values values with {@code NaN} marking gaps; not modified
     * @return interpolated copy
     */
    public static double[] interpolate(double[] values) {
        double[] out = values.clone();
        int firstValid = -1;
        for (int i = 0; i < out.length; i++) {
            if (!Double.isNaN(out[i])) {
                firstValid = i;
                break;
            }
        }
        if (firstValid < 0) {
            return out;
        }
        for (int i = 0; i < firstValid; i++) {
            out[i] = out[firstValid];
        }
        int previous = firstValid;
        for (int i = firstValid + 1; i < out.length; i++) {
            if (Double.isNaN(out[i])) {
                continue;
            }
            int gap = i - previous;
            for (int j = previous + 1; j < i; j++) {
                out[j] = out[previous] + (out[i] - out[previous]) * (j - previous) / gap;
            }
            previous = i;
        }
        for (int i = previous + 1; i < out.length; i++) {
            out[i] = out[previous];
        }
        return out;
    }
}
