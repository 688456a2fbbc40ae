package com.qualitysentinel.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LinearRegression}.
 */
class LinearRegressionTest {

    @Test
    @DisplayName("Should fit an exact line with R² = 1")
    void shouldFitExactLine() {
        double[] values = new double[50];
        for (int i = 0; i < values.length; i++) {
            values[i] = 2 * i + 5;
        }

        LinearRegression fit = LinearRegression.fit(values);

        assertThat(fit.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(fit.getIntercept()).isCloseTo(5.0, within(1e-9));
        assertThat(fit.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(fit.predict(50)).isCloseTo(105.0, within(1e-9));
    }

    @Test
    @DisplayName("Should report zero slope and R² for a constant series")
    void shouldHandleConstantSeries() {
        LinearRegression fit = LinearRegression.fit(new double[] {4, 4, 4, 4});

        assertThat(fit.getSlope()).isZero();
        assertThat(fit.getIntercept()).isEqualTo(4.0);
        assertThat(fit.getRSquared()).isZero();
    }

    @Test
    @DisplayName("Should tolerate degenerate inputs")
    void shouldHandleDegenerateInputs() {
        assertThat(LinearRegression.fit(new double[0]).getSlope()).isZero();
        LinearRegression single = LinearRegression.fit(new double[] {7});
        assertThat(single.getSlope()).isZero();
        assertThat(single.predict(3)).isEqualTo(7.0);
    }

    @Test
    @DisplayName("R² should drop below 1 for noisy data")
    void shouldReportImperfectFit() {
        LinearRegression fit = LinearRegression.fit(new double[] {1, 3, 2, 5, 4, 6});

        assertThat(fit.getSlope()).isPositive();
        assertThat(fit.getRSquared()).isBetween(0.0, 1.0).isLessThan(1.0);
    }
}
