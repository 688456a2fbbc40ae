package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.detection.AlgorithmFactory;
import com.qualitysentinel.core.detection.OutlierAlgorithm;
import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.DetectionResult;
import com.qualitysentinel.core.model.DetectionSummary;
import com.qualitysentinel.core.model.EntityType;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.QualitySnapshot;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.store.InMemoryMetricsStore;
import com.qualitysentinel.core.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Tests for {@link QualityAnomalyDetector} against an in-memory store.
 */
class QualityAnomalyDetectorTest {

    private static final Instant NOW = Instant.parse("2025-07-31T12:00:00Z");
    private static final Instant SERIES_START = NOW.minus(Duration.ofHours(3));
    private static final int SPIKE_INDEX = 100;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryMetricsStore store;
    private QualityAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricsStore(clock);
    }

    @AfterEach
    void tearDown() {
        if (detector != null) {
            detector.close();
        }
    }

    @Nested
    @DisplayName("Batch detection")
    class BatchDetection {

        @Test
        @DisplayName("Each algorithm should flag the spike exactly once and one trend should be produced")
        void shouldFlagSpike() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(result.getAnomalies()).hasSize(3);
            assertThat(result.getAnomalies()).extracting(AnomalyRecord::getAlgorithm)
                    .containsExactlyInAnyOrder("zscore", "modified_zscore", "iqr");
            assertThat(result.getAnomalies()).extracting(AnomalyRecord::getDetectedAt)
                    .containsOnly(timestampAt(SPIKE_INDEX));
            assertThat(result.getAnomalies()).allSatisfy(a -> assertThat(a.getContext().getCurrentValue())
                    .isEqualTo(0.1));
            assertThat(result.getTrends()).singleElement()
                    .extracting(TrendAnalysis::getDimension)
                    .isEqualTo(QualityMetric.OVERALL_QUALITY_SCORE);
            assertThat(result.getSummary().getTotalAnomalies()).isEqualTo(3);
            assertThat(result.getMetadata().getDataPointsAnalyzed()).isEqualTo(120);
            assertThat(result.getMetadata().getAlgorithmsUsed())
                    .containsExactly("zscore", "modified_zscore", "iqr");
            assertThat(result.getMetadata().getAnalysisTimestamp()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Results should be persisted: summary, anomalies and trend")
        void shouldPersistOutcome() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(store.queryAnomalies(AnomalyFilter.forEntity("doc-1"))).hasSize(3);
            assertThat(store.queryTrend("doc-1", QualityMetric.OVERALL_QUALITY_SCORE)).isPresent();
            assertThat(store.querySummaries("doc-1", 10)).singleElement()
                    .satisfies(summary -> {
                        assertThat(summary.getAnomaliesCount()).isEqualTo(3);
                        assertThat(summary.getTrendsCount()).isEqualTo(1);
                        assertThat(summary.getDataPointsAnalyzed()).isEqualTo(120);
                    });
            assertThat(detector.getAnomalies(AnomalyFilter.forEntity("doc-1"))).hasSize(3);
        }

        @Test
        @DisplayName("Should fail with the available and required counts when data is insufficient")
        void shouldRejectInsufficientData() {
            List<QualityMetric> metrics = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                metrics.add(metric("doc-1", QualityMetric.OVERALL_QUALITY_SCORE, 0.8, i));
            }
            store.insertMetrics(metrics);
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            Throwable thrown = catchThrowable(
                    () -> detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null));

            assertThat(thrown).isInstanceOf(InsufficientDataException.class);
            InsufficientDataException e = (InsufficientDataException) thrown;
            assertThat(e.getAvailable()).isEqualTo(10);
            assertThat(e.getRequired()).isEqualTo(20);
            assertThat(store.querySummaries("doc-1", 10)).isEmpty();
        }

        @Test
        @DisplayName("A metric type with too few points should be skipped")
        void shouldSkipSmallGroups() {
            store.insertMetrics(spikedSeries("doc-1"));
            List<QualityMetric> clarity = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                clarity.add(metric("doc-1", "clarity_score", 0.5, i));
            }
            store.insertMetrics(clarity);
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(result.getAnomalies()).extracting(a -> a.getMetadata().getQualityDimension())
                    .containsOnly(QualityMetric.OVERALL_QUALITY_SCORE);
            assertThat(result.getTrends()).hasSize(1);
            assertThat(result.getMetadata().getDataPointsAnalyzed()).isEqualTo(130);
        }

        @Test
        @DisplayName("Dimension filter should restrict the analysed metrics")
        void shouldFilterByDimension() {
            List<QualityMetric> clarity = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                clarity.add(metric("doc-1", "clarity_score", i % 2 == 0 ? 0.6 : 0.62, i));
            }
            store.insertMetrics(spikedSeries("doc-1"));
            store.insertMetrics(clarity);
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, "clarity");

            assertThat(result.getMetadata().getDataPointsAnalyzed()).isEqualTo(30);
            assertThat(result.getAnomalies()).isEmpty();
        }

        @Test
        @DisplayName("Repeated runs over unchanged data should give the same anomalies")
        void shouldBeIdempotentWithoutCaching() {
            store.insertMetrics(spikedSeries("doc-1"));
            DetectionConfig config = DetectionConfig.defaults();
            config.getPerformance().setEnableCaching(false);
            detector = new QualityAnomalyDetector(store, config, clock);

            DetectionResult first = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);
            DetectionResult second = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(fingerprint(second)).isEqualTo(fingerprint(first));
            assertThat(store.querySummaries("doc-1", 10)).hasSize(2);
        }

        @Test
        @DisplayName("Caller-provided metrics should be analysed without reading the store")
        void shouldAnalyseProvidedMetrics() {
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            DetectionResult result = detector.detectAnomalies("doc-7", EntityType.CHUNK, spikedSeries("doc-7"));

            assertThat(result.getAnomalies()).hasSize(3);
            assertThat(result.getAnomalies()).extracting(AnomalyRecord::getEntityType)
                    .containsOnly(EntityType.CHUNK);
            assertThat(store.queryAnomalies(AnomalyFilter.forEntity("doc-7"))).hasSize(3);
        }

        @Test
        @DisplayName("An algorithm that throws should not stop the others")
        void shouldIsolateFailingAlgorithm() {
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            List<OutlierAlgorithm> algorithms = new ArrayList<>();
            algorithms.add(new OutlierAlgorithm() {
                @Override
                public List<AnomalyRecord> detect(MetricSeries series) {
                    throw new IllegalStateException("broken detector");
                }

                @Override
                public String getName() {
                    return "broken";
                }
            });
            algorithms.addAll(AlgorithmFactory.createEnabled(DetectionConfig.defaults()));
            detector.replaceAlgorithms(algorithms);

            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, spikedSeries("doc-1"));

            assertThat(result.getAnomalies()).extracting(AnomalyRecord::getAlgorithm)
                    .containsExactly("zscore", "modified_zscore", "iqr");
            assertThat(result.getTrends()).hasSize(1);
            assertThat(result.getMetadata().getAlgorithmsUsed())
                    .containsExactly("broken", "zscore", "modified_zscore", "iqr");
        }

        @Test
        @DisplayName("Parallel per-type analysis should match the sequential result")
        void shouldMatchSequentialWhenParallel() {
            List<QualityMetric> metrics = new ArrayList<>(spikedSeries("doc-1"));
            metrics.addAll(spikedSeries("doc-1", QualityMetric.dimensionMetricType("clarity")));
            metrics.addAll(spikedSeries("doc-1", QualityMetric.dimensionMetricType("coherence")));

            DetectionConfig sequentialConfig = DetectionConfig.defaults();
            sequentialConfig.getPerformance().setEnableParallelProcessing(false);
            DetectionResult sequential;
            try (QualityAnomalyDetector sequentialDetector =
                         new QualityAnomalyDetector(new InMemoryMetricsStore(clock), sequentialConfig, clock)) {
                sequential = sequentialDetector.detectAnomalies("doc-1", EntityType.DOCUMENT, metrics);
            }
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            DetectionResult parallel = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, metrics);

            assertThat(parallel.getAnomalies()).hasSize(9);
            assertThat(parallel.getTrends()).extracting(TrendAnalysis::getDimension)
                    .containsExactly("overall_quality_score", "clarity_score", "coherence_score");
            assertThat(fingerprint(parallel)).isEqualTo(fingerprint(sequential));
            assertThat(parallel.getTrends()).extracting(TrendAnalysis::getDimension)
                    .isEqualTo(sequential.getTrends().stream().map(TrendAnalysis::getDimension).toList());
        }

        @Test
        @DisplayName("A failing store write should not fail the run")
        void shouldReturnResultWhenPersistFails() {
            InMemoryMetricsStore failing = new InMemoryMetricsStore(clock) {
                @Override
                public void insertDetectionSummary(DetectionSummary summary) {
                    throw new StoreUnavailableException("store down");
                }
            };
            failing.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(failing, DetectionConfig.defaults(), clock);

            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(result.getAnomalies()).hasSize(3);
            assertThat(failing.queryAnomalies(AnomalyFilter.all())).isEmpty();
        }

        @Test
        @DisplayName("Detected anomalies should be delivered to listeners")
        void shouldNotifyListeners() throws InterruptedException {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            CountDownLatch latch = new CountDownLatch(3);
            detector.addListener(anomaly -> latch.countDown());

            detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("A second run for a busy entity should be rejected while other entities proceed")
        void shouldRejectConcurrentRunForSameEntity() throws Exception {
            CountDownLatch queryStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            InMemoryMetricsStore blocking = new InMemoryMetricsStore(clock) {
                @Override
                public List<QualityMetric> query(String entityId, String dimension, int limit) {
                    if (entityId.equals("blocked")) {
                        queryStarted.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return super.query(entityId, dimension, limit);
                }
            };
            blocking.insertMetrics(spikedSeries("blocked"));
            blocking.insertMetrics(spikedSeries("other"));
            detector = new QualityAnomalyDetector(blocking, DetectionConfig.defaults(), clock);

            CompletableFuture<DetectionResult> first =
                    detector.detectAnomaliesAsync("blocked", EntityType.DOCUMENT, null);
            assertThat(queryStarted.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> detector.detectAnomalies("blocked", EntityType.DOCUMENT, (String) null))
                    .isInstanceOf(AnalysisInProgressException.class)
                    .hasMessageContaining("blocked");
            assertThat(detector.detectAnomaliesAsync("blocked", EntityType.DOCUMENT, null))
                    .isCompletedExceptionally();
            assertThat(detector.detectAnomalies("other", EntityType.DOCUMENT, (String) null).getAnomalies())
                    .hasSize(3);

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).getAnomalies()).hasSize(3);

            assertThat(detector.detectAnomalies("blocked", EntityType.DOCUMENT, (String) null).getAnomalies())
                    .hasSize(3);
        }

        @Test
        @DisplayName("The entity should be released after a failed run")
        void shouldReleaseEntityAfterFailure() {
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            assertThatThrownBy(() -> detector.detectAnomalies("empty", EntityType.DOCUMENT, (String) null))
                    .isInstanceOf(InsufficientDataException.class);
            assertThatThrownBy(() -> detector.detectAnomalies("empty", EntityType.DOCUMENT, (String) null))
                    .isInstanceOf(InsufficientDataException.class);
        }
    }

    @Nested
    @DisplayName("Real-time detection")
    class Realtime {

        @Test
        @DisplayName("Should flag a deviating snapshot and notify listeners without persisting")
        void shouldFlagDeviatingSnapshot() throws InterruptedException {
            store.insertMetrics(steadySeries("doc-1", 60));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            CountDownLatch latch = new CountDownLatch(1);
            detector.addListener(anomaly -> latch.countDown());

            List<AnomalyRecord> anomalies = detector.detectRealtimeAnomaly(snapshot("doc-1", 0.1));

            assertThat(anomalies).singleElement().satisfies(anomaly -> {
                assertThat(anomaly.getAlgorithm()).isEqualTo("zscore_realtime");
                assertThat(anomaly.getDetectedAt()).isEqualTo(NOW);
                assertThat(anomaly.getContext().getCurrentValue()).isEqualTo(0.1);
            });
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(store.queryAnomalies(AnomalyFilter.all())).isEmpty();
        }

        @Test
        @DisplayName("A value in line with history should not be flagged")
        void shouldIgnoreNormalSnapshot() {
            store.insertMetrics(steadySeries("doc-1", 60));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            assertThat(detector.detectRealtimeAnomaly(snapshot("doc-1", 0.81))).isEmpty();
        }

        @Test
        @DisplayName("Should return empty for unknown entities, short history and null input")
        void shouldReturnEmptyOnMissingInput() {
            store.insertMetrics(steadySeries("short", 5));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            assertThat(detector.detectRealtimeAnomaly(snapshot("unknown", 0.1))).isEmpty();
            assertThat(detector.detectRealtimeAnomaly(snapshot("short", 0.1))).isEmpty();
            assertThat(detector.detectRealtimeAnomaly(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Queries and configuration")
    class QueriesAndConfiguration {

        @Test
        @DisplayName("Trend query should serve the latest analysis per dimension")
        void shouldReturnTrendAnalysis() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(detector.getTrendAnalysis("doc-1", QualityMetric.OVERALL_QUALITY_SCORE))
                    .contains(result.getTrends().get(0));
            assertThat(detector.getTrendAnalysis("doc-1", null)).isPresent();
            assertThat(detector.getTrendAnalysis("doc-2", null)).isEmpty();
        }

        @Test
        @DisplayName("Trend query should accept a bare dimension name for a _score metric type")
        void shouldResolveBareDimensionName() {
            store.insertMetrics(spikedSeries("doc-1", "clarity_score"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);
            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(detector.getTrendAnalysis("doc-1", "clarity")).contains(result.getTrends().get(0));

            detector.updateConfiguration(Map.of("performance", Map.of("enableCaching", false)));
            assertThat(detector.getTrendAnalysis("doc-1", "clarity"))
                    .hasValueSatisfying(t -> assertThat(t.getDimension()).isEqualTo("clarity_score"));
            assertThat(detector.getTrendAnalysis("doc-1", "coherence")).isEmpty();
        }

        @Test
        @DisplayName("Queries should return empty when the store fails")
        void shouldDegradeQueriesOnStoreFailure() {
            InMemoryMetricsStore failing = new InMemoryMetricsStore(clock) {
                @Override
                public List<AnomalyRecord> queryAnomalies(AnomalyFilter filter) {
                    throw new StoreUnavailableException("store down");
                }
            };
            detector = new QualityAnomalyDetector(failing, DetectionConfig.defaults(), clock);

            assertThat(detector.getAnomalies(AnomalyFilter.all())).isEmpty();
        }

        @Test
        @DisplayName("Statistics should count completed runs")
        void shouldTrackStatistics() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            assertThat(detector.getDetectionStatistics().getTotalDetections()).isZero();
            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(result.getSummary().getDetectionAccuracy()).isBetween(0.0, 1.0);
            assertThat(detector.getDetectionStatistics().getTotalDetections()).isEqualTo(1);
            assertThat(detector.getDetectionStatistics().getAlgorithmsEnabled())
                    .containsExactly("zscore", "modified_zscore", "iqr");
        }

        @Test
        @DisplayName("Configuration updates should apply to subsequent runs")
        void shouldApplyConfigurationUpdate() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            detector.updateConfiguration(Map.of(
                    "algorithms", Map.of("zscore", Map.of("enabled", false)),
                    "performance", Map.of("enableCaching", false)));
            DetectionResult result = detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null);

            assertThat(detector.getConfiguration().getEnabledAlgorithmNames())
                    .containsExactly("modified_zscore", "iqr");
            assertThat(result.getAnomalies()).extracting(AnomalyRecord::getAlgorithm)
                    .containsExactlyInAnyOrder("modified_zscore", "iqr");
        }

        @Test
        @DisplayName("A rejected update should leave the live configuration untouched")
        void shouldKeepConfigurationOnRejectedUpdate() {
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            assertThatThrownBy(() -> detector.updateConfiguration(
                    Map.of("algorithms", Map.of("zscore", Map.of("treshold", 4.0)))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("treshold");
            assertThatThrownBy(() -> detector.updateConfiguration(
                    Map.of("algorithms", Map.of("zscore", Map.of("threshold", -1.0)))))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(detector.getConfiguration().getAlgorithms().getZscore().getThreshold()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Returned configuration should be a copy")
        void shouldReturnConfigurationCopy() {
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            detector.getConfiguration().getAlgorithms().getZscore().setThreshold(9.0);

            assertThat(detector.getConfiguration().getAlgorithms().getZscore().getThreshold()).isEqualTo(3.0);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Manual purge should remove records past the retention period")
        void shouldPurgeExpiredRecords() {
            InMemoryMetricsStore oldStore = new InMemoryMetricsStore(
                    Clock.fixed(NOW.minus(Duration.ofDays(8)), ZoneOffset.UTC));
            oldStore.insertDetectionSummary(DetectionSummary.builder()
                    .entityId("doc-1")
                    .analysisTimestamp(NOW.minus(Duration.ofDays(8)))
                    .build());
            detector = new QualityAnomalyDetector(oldStore, DetectionConfig.defaults(), clock);

            assertThat(detector.purgeExpiredRecords()).isEqualTo(1);
            assertThat(oldStore.querySummaries("doc-1", 10)).isEmpty();
        }

        @Test
        @DisplayName("A closed detector should reject batch runs and stay closed on repeated close")
        void shouldRejectUseAfterClose() {
            store.insertMetrics(spikedSeries("doc-1"));
            detector = new QualityAnomalyDetector(store, DetectionConfig.defaults(), clock);

            detector.close();
            detector.close();

            assertThatThrownBy(() -> detector.detectAnomalies("doc-1", EntityType.DOCUMENT, (String) null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("closed");
            assertThat(detector.detectRealtimeAnomaly(snapshot("doc-1", 0.1))).isEmpty();
        }

        @Test
        @DisplayName("An invalid initial configuration should be rejected")
        void shouldRejectInvalidConfig() {
            DetectionConfig config = DetectionConfig.defaults();
            config.getDataProcessing().setMinDataPoints(1);

            assertThatThrownBy(() -> new QualityAnomalyDetector(store, config, clock))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** 120 overall scores alternating 0.80 / 0.82 with a drop to 0.1 at {@link #SPIKE_INDEX}. */
    private static List<QualityMetric> spikedSeries(String entityId) {
        return spikedSeries(entityId, QualityMetric.OVERALL_QUALITY_SCORE);
    }

    private static List<QualityMetric> spikedSeries(String entityId, String metricType) {
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            double value = i == SPIKE_INDEX ? 0.1 : (i % 2 == 0 ? 0.80 : 0.82);
            metrics.add(metric(entityId, metricType, value, i));
        }
        return metrics;
    }

    private static List<String> fingerprint(DetectionResult result) {
        return result.getAnomalies().stream()
                .map(a -> a.getAlgorithm() + "@" + a.getDetectedAt() + "=" + a.getSeverity() + "/" + a.getScore())
                .toList();
    }

    private static List<QualityMetric> steadySeries(String entityId, int size) {
        List<QualityMetric> metrics = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            metrics.add(metric(entityId, QualityMetric.OVERALL_QUALITY_SCORE, i % 2 == 0 ? 0.80 : 0.82, i));
        }
        return metrics;
    }

    private static QualityMetric metric(String entityId, String metricType, double value, int index) {
        return QualityMetric.builder()
                .entityId(entityId)
                .entityType(EntityType.DOCUMENT)
                .metricType(metricType)
                .value(value)
                .timestamp(timestampAt(index))
                .build();
    }

    private static Instant timestampAt(int index) {
        return SERIES_START.plus(Duration.ofMinutes(index));
    }

    private static QualitySnapshot snapshot(String entityId, double overallScore) {
        return QualitySnapshot.builder()
                .entityId(entityId)
                .entityType(EntityType.DOCUMENT)
                .timestamp(NOW)
                .overallScore(overallScore)
                .build();
    }
}
