package com.qualitysentinel.core.trend;

import com.qualitysentinel.core.model.TrendAnalysis;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeasonalityDetector}.
 */
class SeasonalityDetectorTest {

    private final SeasonalityDetector detector = new SeasonalityDetector(24);

    @Test
    @DisplayName("Should detect a periodic signal with zero phase")
    void shouldDetectPeriodicSignal() {
        double[] values = new double[120];
        for (int i = 0; i < values.length; i++) {
            values[i] = Math.sin(2 * Math.PI * i / 12.0);
        }

        TrendAnalysis.Seasonality seasonality = detector.detect(values);

        assertThat(seasonality.isDetected()).isTrue();
        assertThat(seasonality.getPeriod()).isBetween(2, 30);
        assertThat(seasonality.getAmplitude()).isGreaterThan(0.3);
        assertThat(seasonality.getPhase()).isZero();
    }

    @Test
    @DisplayName("Should not detect seasonality in a constant series")
    void shouldIgnoreConstantSeries() {
        double[] values = new double[120];
        Arrays.fill(values, 1.0);

        TrendAnalysis.Seasonality seasonality = detector.detect(values);

        assertThat(seasonality.isDetected()).isFalse();
        assertThat(seasonality.getPeriod()).isNull();
        assertThat(seasonality.getAmplitude()).isNull();
    }

    @Test
    @DisplayName("Should not scan lags when the series is too short")
    void shouldIgnoreShortSeries() {
        assertThat(detector.detect(new double[] {1, 5, 1, 5, 1, 5, 1}).isDetected()).isFalse();
    }
}
