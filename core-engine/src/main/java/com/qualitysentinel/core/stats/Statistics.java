package com.qualitysentinel.core.stats;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptive statistics over a finite sequence of values.
 *
 * <p>
 * Every function is pure. Variance and standard deviation are population
 * measures (divide by {@code N}). Empty input yields {@code 0} rather than
 * an exception or {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    /** Scale factor relating MAD to the standard deviation of a normal distribution. */
    public static final double MAD_CONSISTENCY = 0.6745;

    private Statistics() {
        // utility class, not instantiable
    }

    public static double mean(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * @return middle value, or the average of the two middle values for an
     *         even length
     */
    public static double median(double[] values) {
        return medianOfSorted(sorted(values));
    }

    public static double variance(double[] values) {
        return variance(values, mean(values));
    }

    static double variance(double[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Quantile by linear interpolation between the order statistics at
     * {@code floor(q·(n-1))} and {@code ceil(q·(n-1))}.
     *
     * @param values input values, in any order
     * @param q      quantile in {@code [0, 1]}
     * @return the interpolated quantile
     * @throws IllegalArgumentException if {@code q} is outside {@code [0, 1]}
     */
    public static double quantile(double[] values, double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("quantile must be in [0, 1], got: " + q);
        }
        return quantileOfSorted(sorted(values), q);
    }

    public static double iqr(double[] values) {
        double[] sorted = sorted(values);
        return quantileOfSorted(sorted, 0.75) - quantileOfSorted(sorted, 0.25);
    }

    /**
     * Median absolute deviation from the median.
     */
    public static double mad(double[] values) {
        return mad(values, median(values));
    }

    static double mad(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        Arrays.sort(deviations);
        return medianOfSorted(deviations);
    }

    /**
     * Third standardized moment; 0 when the standard deviation is 0.
     */
    public static double skewness(double[] values) {
        double mean = mean(values);
        return standardizedMoment(values, mean, Math.sqrt(variance(values, mean)), 3);
    }

    /**
     * Excess kurtosis (fourth standardized moment minus 3); 0 when the
     * standard deviation is 0.
     */
    public static double kurtosis(double[] values) {
        double mean = mean(values);
        double stdDev = Math.sqrt(variance(values, mean));
        return stdDev == 0 ? 0 : standardizedMoment(values, mean, stdDev, 4) - 3;
    }

    /**
     * Lag-{@code k} autocorrelation of the demeaned series, normalised by the
     * total sum of squares.
     *
     * @param values input series
     * @param lag    lag {@code k >= 0}
     * @return correlation in {@code [-1, 1]}; 0 if the series is not longer
     *         than {@code lag} or has zero variance
     */
    public static double autocorrelation(double[] values, int lag) {
        if (lag < 0) {
            throw new IllegalArgumentException("lag must be >= 0, got: " + lag);
        }
        if (values.length <= lag) {
            return 0;
        }
        double mean = mean(values);
        double numerator = 0;
        for (int i = 0; i < values.length - lag; i++) {
            numerator += (values[i] - mean) * (values[i + lag] - mean);
        }
        double denominator = 0;
        for (double v : values) {
            denominator += (v - mean) * (v - mean);
        }
        return denominator != 0 ? numerator / denominator : 0;
    }

    /**
     * Compute every descriptive statistic in one pass over a sorted copy.
     *
     * @param values input values, not modified
     * @return the summary; all zeros for an empty input
     */
    public static StatisticalSummary summarize(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            return StatisticalSummary.EMPTY;
        }
        double[] sorted = sorted(values);
        double mean = mean(values);
        double variance = variance(values, mean);
        double stdDev = Math.sqrt(variance);
        double median = medianOfSorted(sorted);
        double q1 = quantileOfSorted(sorted, 0.25);
        double q3 = quantileOfSorted(sorted, 0.75);
        return new StatisticalSummary(
                values.length,
                mean,
                median,
                stdDev,
                variance,
                standardizedMoment(values, mean, stdDev, 3),
                stdDev == 0 ? 0 : standardizedMoment(values, mean, stdDev, 4) - 3,
                sorted[0],
                sorted[sorted.length - 1],
                q1,
                q3,
                q3 - q1,
                mad(values, median));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double[] sorted(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    private static double medianOfSorted(double[] sorted) {
        int n = sorted.length;
        if (n == 0) {
            return 0;
        }
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }

    private static double quantileOfSorted(double[] sorted, double q) {
        if (sorted.length == 0) {
            return 0;
        }
        double index = q * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }

    private static double standardizedMoment(double[] values, double mean, double stdDev, int order) {
        if (stdDev == 0 || values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += Math.pow((v - mean) / stdDev, order);
        }
        return sum / values.length;
    }
}
