package com.qualitysentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link QualitySnapshot} and {@link QualityMetric}.
 */
class QualitySnapshotTest {

    @Test
    @DisplayName("Snapshot should expand into the overall metric followed by dimension metrics")
    void shouldExpandIntoMetrics() {
        Instant at = Instant.parse("2025-03-01T12:00:00Z");
        QualitySnapshot snapshot = QualitySnapshot.builder()
                .entityId("doc-1")
                .entityType(EntityType.DOCUMENT)
                .timestamp(at)
                .overallScore(0.82)
                .dimension("clarity", 0.7)
                .dimension("completeness", 0.9)
                .build();

        List<QualityMetric> metrics = snapshot.toMetrics();

        assertThat(metrics).extracting(QualityMetric::getMetricType)
                .containsExactly("overall_quality_score", "clarity_score", "completeness_score");
        assertThat(metrics).extracting(QualityMetric::getValue).containsExactly(0.82, 0.7, 0.9);
        assertThat(metrics).allSatisfy(m -> {
            assertThat(m.getTimestamp()).isEqualTo(at);
            assertThat(m.getEntityId()).isEqualTo("doc-1");
        });
    }

    @Test
    @DisplayName("Dimension matching should accept the bare name and the _score metric type")
    void shouldMatchDimension() {
        QualityMetric metric = QualityMetric.builder()
                .entityId("doc-1")
                .entityType(EntityType.DOCUMENT)
                .metricType("clarity_score")
                .value(0.5)
                .timestamp("2025-03-01T12:00:00Z")
                .build();

        assertThat(metric.matchesDimension("clarity")).isTrue();
        assertThat(metric.matchesDimension("clarity_score")).isTrue();
        assertThat(metric.matchesDimension("completeness")).isFalse();
        assertThat(metric.getUnit()).isEqualTo("score");
    }
}
