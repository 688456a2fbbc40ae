package com.qualitysentinel.core.stats;

/**
 * Immutable bundle of descriptive statistics, produced by
 * {@link Statistics#summarize(double[])}.
 *
 * @since 1.0.0
 */
public final class StatisticalSummary {

    static final StatisticalSummary EMPTY = new StatisticalSummary(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    private final int count;
    private final double mean;
    private final double median;
    private final double standardDeviation;
    private final double variance;
    private final double skewness;
    private final double kurtosis;
    private final double min;
    private final double max;
    private final double q1;
    private final double q3;
    private final double iqr;
    private final double mad;

    StatisticalSummary(int count, double mean, double median, double standardDeviation, double variance,
            double skewness, double kurtosis, double min, double max, double q1, double q3, double iqr,
            double mad) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.standardDeviation = standardDeviation;
        this.variance = variance;
        this.skewness = skewness;
        this.kurtosis = kurtosis;
        this.min = min;
        this.max = max;
        this.q1 = q1;
        this.q3 = q3;
        this.iqr = iqr;
        this.mad = mad;
    }

    public int getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public double getVariance() {
        return variance;
    }

    public double getSkewness() {
        return skewness;
    }

    /** Excess kurtosis. */
    public double getKurtosis() {
        return kurtosis;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    public double getIqr() {
        return iqr;
    }

    public double getMad() {
        return mad;
    }

    @Override
    public String toString() {
        return "StatisticalSummary{" +
                "n=" + count +
                ", mean=" + mean +
                ", median=" + median +
                ", stdDev=" + standardDeviation +
                ", q1=" + q1 +
                ", q3=" + q3 +
                ", mad=" + mad +
                '}';
    }
}
