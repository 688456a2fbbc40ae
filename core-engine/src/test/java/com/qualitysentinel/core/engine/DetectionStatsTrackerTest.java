package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.DetectionStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DetectionStatsTrackerTest {

    @Test
    @DisplayName("Fresh tracker should report the assumed precision")
    void shouldStartAtAssumedPrecision() {
        DetectionStatsTracker tracker = new DetectionStatsTracker();

        assertThat(tracker.accuracyFor(0)).isEqualTo(0.9);
        assertThat(tracker.accuracyFor(10)).isCloseTo(0.9, within(1e-12));

        DetectionStatistics stats = tracker.snapshot(List.of("zscore"));
        assertThat(stats.getTotalDetections()).isZero();
        assertThat(stats.getAccuracy()).isEqualTo(0.9);
        assertThat(stats.getAverageProcessingTimeMs()).isZero();
        assertThat(stats.getAlgorithmsEnabled()).containsExactly("zscore");
    }

    @Test
    @DisplayName("Recording runs should count detections and average processing time")
    void shouldRecordRuns() {
        DetectionStatsTracker tracker = new DetectionStatsTracker();

        tracker.record(10, 0.9);
        tracker.record(30, 1.0);

        DetectionStatistics stats = tracker.snapshot(List.of());
        assertThat(stats.getTotalDetections()).isEqualTo(2);
        assertThat(stats.getAccuracy()).isEqualTo(0.5);
        assertThat(stats.getAverageProcessingTimeMs()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Average should cover only the most recent samples")
    void shouldCapProcessingSamples() {
        DetectionStatsTracker tracker = new DetectionStatsTracker();
        tracker.record(1_000, 1.0);
        for (int i = 0; i < DetectionStatsTracker.PROCESSING_TIME_SAMPLES; i++) {
            tracker.record(10, 1.0);
        }

        assertThat(tracker.snapshot(List.of()).getAverageProcessingTimeMs()).isEqualTo(10.0);
    }
}
