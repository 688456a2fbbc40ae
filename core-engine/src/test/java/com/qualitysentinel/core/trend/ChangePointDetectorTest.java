package com.qualitysentinel.core.trend;

import com.qualitysentinel.core.model.EntityType;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.TrendAnalysis.ChangePoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChangePointDetector}.
 */
class ChangePointDetectorTest {

    private static final Instant START = Instant.parse("2025-03-01T00:00:00Z");

    private final ChangePointDetector detector = new ChangePointDetector(0.05);

    @Test
    @DisplayName("Should locate a step from 10 to 90 at index 40 with magnitude 80")
    void shouldLocateStepChange() {
        double[] values = new double[80];
        Arrays.fill(values, 0, 40, 10.0);
        Arrays.fill(values, 40, 80, 90.0);

        List<ChangePoint> changePoints = detector.detect(series(values));

        assertThat(changePoints).isNotEmpty();
        ChangePoint strongest = changePoints.stream()
                .max(Comparator.comparingDouble(ChangePoint::getMagnitude))
                .orElseThrow();
        assertThat(strongest.getIndex()).isEqualTo(40);
        assertThat(strongest.getMagnitude()).isCloseTo(80.0, within(1e-9));
        assertThat(strongest.getConfidence()).isEqualTo(1.0);
        assertThat(strongest.getTimestamp()).isEqualTo(START.plusSeconds(40));
    }

    @Test
    @DisplayName("Should report nothing for a flat series")
    void shouldIgnoreFlatSeries() {
        double[] values = new double[80];
        Arrays.fill(values, 5.0);

        assertThat(detector.detect(series(values))).isEmpty();
    }

    @Test
    @DisplayName("Should report nothing when the window would be below 2")
    void shouldIgnoreShortSeries() {
        assertThat(detector.detect(series(new double[] {1, 1, 1, 1, 9, 9, 9, 9, 9}))).isEmpty();
        assertThat(ChangePointDetector.windowFor(9)).isEqualTo(1);
        assertThat(ChangePointDetector.windowFor(500)).isEqualTo(20);
    }

    @Test
    @DisplayName("A higher sensitivity should report fewer points for a noisy shift")
    void shouldRespectSensitivity() {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i < 50 ? 0.5 : 0.6) + (i % 2 == 0 ? 0.05 : -0.05);
        }

        int sensitive = detector.detect(series(values)).size();
        int strict = new ChangePointDetector(3.0).detect(series(values)).size();

        assertThat(sensitive).isGreaterThanOrEqualTo(strict);
        assertThat(strict).isPositive();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries series(double[] values) {
        return MetricSeries.ofValues("doc-1", EntityType.DOCUMENT, "overall_quality_score", START, values);
    }
}
