package com.qualitysentinel.core.stats;

import java.util.Objects;

/**
 * Ordinary least squares fit of values against their index {@code 0..n-1}.
 *
 * @since 1.0.0
 */
public final class LinearRegression {

    private final double slope;
    private final double intercept;
    private final double rSquared;

    private LinearRegression(double slope, double intercept, double rSquared) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
    }

    /**
     * Fit {@code y = slope·x + intercept} with {@code x} the index.
     *
     * <p>
     * Slope is 0 when fewer than two points exist; R² is 0 when the values
     * have no variance.
     * </p>
     *
     * @param values the dependent values
     * @return the fit
     */
    public static LinearRegression fit(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int n = values.length;
        if (n == 0) {
            return new LinearRegression(0, 0, 0);
        }
        double xMean = (n - 1) / 2.0;
        double yMean = Statistics.mean(values);

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            numerator += dx * (values[i] - yMean);
            denominator += dx * dx;
        }
        double slope = denominator != 0 ? numerator / denominator : 0;
        double intercept = yMean - slope * xMean;

        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < n; i++) {
            double residual = values[i] - (slope * i + intercept);
            ssRes += residual * residual;
            ssTot += (values[i] - yMean) * (values[i] - yMean);
        }
        double rSquared = ssTot != 0 ? 1 - ssRes / ssTot : 0;
        return new LinearRegression(slope, intercept, rSquared);
    }

    /**
     * @param x index at which to evaluate the fitted line
     * @return {@code slope·x + intercept}
     */
    public double predict(double x) {
        return slope * x + intercept;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double getRSquared() {
        return rSquared;
    }

    @Override
    public String toString() {
        return "LinearRegression{slope=" + slope + ", intercept=" + intercept + ", r2=" + rSquared + '}';
    }
}
