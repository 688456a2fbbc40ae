package com.qualitysentinel.core.store;

import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.DetectionSummary;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.stats.StatisticalSummary;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract consumed by the detection engine.
 *
 * <p>
 * Every record kind carries a store-assigned creation time that drives
 * retention: the {@code delete*OlderThan} methods remove records created
 * strictly before the cutoff. Implementations serialize their own writes;
 * the engine does not require atomicity across calls.
 * </p>
 *
 * <p>
 * Every method may throw {@link StoreUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricsStore {

    /**
     * Read the newest metrics of an entity.
     *
     * @param entityId  the entity
     * @param dimension optional dimension; {@code null} returns every metric
     *                  type, otherwise only metrics matching
     *                  {@link QualityMetric#matchesDimension(String)}
     * @param limit     maximum number of metrics
     * @return metrics, newest first
     */
    List<QualityMetric> query(String entityId, String dimension, int limit);

    /**
     * Append raw metrics. Used by the upstream scoring feed; the engine never
     * writes raw scores itself.
     */
    void insertMetrics(List<QualityMetric> metrics);

    void insertAnomaly(AnomalyRecord anomaly);

    void insertTrend(TrendAnalysis trend);

    void insertDetectionSummary(DetectionSummary summary);

    /**
     * Record descriptive statistics computed for one (entity, dimension)
     * series.
     *
     * @param timeWindow label of the window the statistics cover, e.g.
     *                   {@code 120_points}
     */
    void insertStatistics(String entityId, String dimension, String timeWindow, StatisticalSummary statistics,
            Instant computedAt);

    /**
     * @return anomalies matching {@code filter}, newest {@code detectedAt} first
     */
    List<AnomalyRecord> queryAnomalies(AnomalyFilter filter);

    /**
     * @param dimension optional dimension name or its {@code _score} metric
     *                  type; {@code null} matches any dimension
     * @return the analysis with the latest {@code analyzedAt}
     */
    Optional<TrendAnalysis> queryTrend(String entityId, String dimension);

    /**
     * @return summaries of the entity, newest {@code analysisTimestamp} first
     */
    List<DetectionSummary> querySummaries(String entityId, int limit);

    /** @return number of records removed */
    int deleteAnomaliesOlderThan(Instant cutoff);

    /** @return number of records removed */
    int deleteTrendsOlderThan(Instant cutoff);

    /** @return number of records removed */
    int deleteSummariesOlderThan(Instant cutoff);

    /** @return number of records removed */
    int deleteStatisticsOlderThan(Instant cutoff);
}
