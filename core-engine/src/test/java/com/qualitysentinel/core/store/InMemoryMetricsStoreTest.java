package com.qualitysentinel.core.store;

import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.AnomalySeverity;
import com.qualitysentinel.core.model.DetectionSummary;
import com.qualitysentinel.core.model.EntityType;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.model.TrendDirection;
import com.qualitysentinel.core.stats.Statistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemoryMetricsStore}.
 */
class InMemoryMetricsStoreTest {

    private static final Instant NOW = Instant.parse("2025-07-31T12:00:00Z");

    private InMemoryMetricsStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricsStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Query should return newest metrics first up to the limit")
    void shouldQueryNewestFirst() {
        store.insertMetrics(List.of(
                metric("doc-1", "overall_quality_score", 0.80, 1),
                metric("doc-1", "overall_quality_score", 0.82, 3),
                metric("doc-1", "overall_quality_score", 0.81, 2),
                metric("doc-2", "overall_quality_score", 0.10, 4)));

        List<QualityMetric> result = store.query("doc-1", null, 2);

        assertThat(result).extracting(QualityMetric::getValue).containsExactly(0.82, 0.81);
    }

    @Test
    @DisplayName("Dimension filter should match both the bare name and its _score type")
    void shouldFilterByDimension() {
        store.insertMetrics(List.of(
                metric("doc-1", "clarity_score", 0.7, 1),
                metric("doc-1", "clarity", 0.6, 2),
                metric("doc-1", "coherence_score", 0.9, 3)));

        assertThat(store.query("doc-1", "clarity", 10))
                .extracting(QualityMetric::getMetricType)
                .containsExactly("clarity", "clarity_score");
        assertThat(store.query("doc-1", "missing", 10)).isEmpty();
    }

    @Test
    @DisplayName("Anomaly query should apply the filter and limit, newest first")
    void shouldQueryAnomaliesWithFilter() {
        store.insertAnomaly(anomaly("doc-1", AnomalySeverity.HIGH, NOW.minusSeconds(30)));
        store.insertAnomaly(anomaly("doc-1", AnomalySeverity.LOW, NOW.minusSeconds(20)));
        store.insertAnomaly(anomaly("doc-1", AnomalySeverity.HIGH, NOW.minusSeconds(10)));
        store.insertAnomaly(anomaly("doc-2", AnomalySeverity.HIGH, NOW));

        List<AnomalyRecord> high = store.queryAnomalies(AnomalyFilter.builder()
                .entityId("doc-1")
                .severity(AnomalySeverity.HIGH)
                .build());
        List<AnomalyRecord> limited = store.queryAnomalies(AnomalyFilter.builder().limit(1).build());
        List<AnomalyRecord> windowed = store.queryAnomalies(AnomalyFilter.builder()
                .from(NOW.minusSeconds(20))
                .to(NOW.minusSeconds(10))
                .build());

        assertThat(high).extracting(AnomalyRecord::getDetectedAt)
                .containsExactly(NOW.minusSeconds(10), NOW.minusSeconds(30));
        assertThat(limited).extracting(AnomalyRecord::getEntityId).containsExactly("doc-2");
        assertThat(windowed).hasSize(2);
    }

    @Test
    @DisplayName("Trend query should return the latest analysis for the dimension name or metric type")
    void shouldReturnLatestTrend() {
        store.insertTrend(trend("doc-1", "clarity_score", NOW.minusSeconds(60)));
        TrendAnalysis latest = trend("doc-1", "clarity_score", NOW);
        store.insertTrend(latest);
        store.insertTrend(trend("doc-1", "coherence_score", NOW.plusSeconds(60)));

        assertThat(store.queryTrend("doc-1", "clarity_score")).contains(latest);
        assertThat(store.queryTrend("doc-1", "clarity")).contains(latest);
        assertThat(store.queryTrend("doc-1", null).map(TrendAnalysis::getDimension))
                .contains("coherence_score");
        assertThat(store.queryTrend("doc-9", null)).isEmpty();
    }

    @Test
    @DisplayName("Summaries should be returned newest first")
    void shouldQuerySummaries() {
        store.insertDetectionSummary(summary("doc-1", NOW.minusSeconds(5)));
        store.insertDetectionSummary(summary("doc-1", NOW));

        assertThat(store.querySummaries("doc-1", 10))
                .extracting(DetectionSummary::getAnalysisTimestamp)
                .containsExactly(NOW, NOW.minusSeconds(5));
    }

    @Test
    @DisplayName("Retention deletes should remove only records created before the cutoff")
    void shouldDeleteOlderThanCutoff() {
        store.insertAnomaly(anomaly("doc-1", AnomalySeverity.HIGH, NOW));
        store.insertTrend(trend("doc-1", "clarity_score", NOW));
        store.insertDetectionSummary(summary("doc-1", NOW));
        store.insertStatistics("doc-1", "clarity_score", "3_points",
                Statistics.summarize(new double[] { 1, 2, 3 }), NOW);

        assertThat(store.deleteAnomaliesOlderThan(NOW)).isZero();
        assertThat(store.deleteTrendsOlderThan(NOW)).isZero();

        Instant later = NOW.plusSeconds(1);
        assertThat(store.deleteAnomaliesOlderThan(later)).isEqualTo(1);
        assertThat(store.deleteTrendsOlderThan(later)).isEqualTo(1);
        assertThat(store.deleteSummariesOlderThan(later)).isEqualTo(1);
        assertThat(store.deleteStatisticsOlderThan(later)).isEqualTo(1);
        assertThat(store.queryAnomalies(AnomalyFilter.all())).isEmpty();
        assertThat(store.queryTrend("doc-1", null)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static QualityMetric metric(String entityId, String metricType, double value, long second) {
        return QualityMetric.builder()
                .entityId(entityId)
                .entityType(EntityType.DOCUMENT)
                .metricType(metricType)
                .value(value)
                .timestamp(NOW.plusSeconds(second))
                .build();
    }

    static AnomalyRecord anomaly(String entityId, AnomalySeverity severity, Instant detectedAt) {
        return AnomalyRecord.builder()
                .severity(severity)
                .entityId(entityId)
                .entityType(EntityType.DOCUMENT)
                .detectedAt(detectedAt)
                .algorithm("zscore")
                .score(0.9)
                .confidence(0.8)
                .description("test anomaly")
                .context(new AnomalyRecord.Context(0.1, 0.8, 0.8, 0.01, 50))
                .metadata(new AnomalyRecord.Metadata("overall_quality_score", "50_points"))
                .build();
    }

    static TrendAnalysis trend(String entityId, String dimension, Instant analyzedAt) {
        return TrendAnalysis.builder()
                .entityId(entityId)
                .entityType(EntityType.DOCUMENT)
                .dimension(dimension)
                .analyzedAt(analyzedAt)
                .timeRange(new TrendAnalysis.TimeRange(analyzedAt.minusSeconds(100), analyzedAt))
                .trend(new TrendAnalysis.Trend(TrendDirection.STABLE, 0.0, 0.5, 0))
                .seasonality(TrendAnalysis.Seasonality.none())
                .forecast(new TrendAnalysis.Forecast(0, List.of(), 0.5))
                .changePoints(List.of())
                .statistics(new TrendAnalysis.Statistics(0.8, 0.01, 0.1, true))
                .build();
    }

    static DetectionSummary summary(String entityId, Instant at) {
        return DetectionSummary.builder()
                .entityId(entityId)
                .analysisTimestamp(at)
                .anomaliesCount(1)
                .trendsCount(1)
                .detectionAccuracy(0.9)
                .processingTimeMs(12)
                .algorithmsUsed(List.of("zscore"))
                .dataPointsAnalyzed(50)
                .build();
    }
}
