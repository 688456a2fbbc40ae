package com.qualitysentinel.core.store;

import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.DetectionSummary;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.stats.StatisticalSummary;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe {@link MetricsStore} backed by concurrent maps.
 *
 * <p>
 * Suitable for tests and for embedding the engine without a database.
 * Records are stamped with the injected {@link Clock} on insert.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryMetricsStore implements MetricsStore {

    private final Map<String, Stored<QualityMetric>> metrics = new ConcurrentHashMap<>();
    private final Map<String, Stored<AnomalyRecord>> anomalies = new ConcurrentHashMap<>();
    private final Map<String, Stored<TrendAnalysis>> trends = new ConcurrentHashMap<>();
    private final Map<String, Stored<DetectionSummary>> summaries = new ConcurrentHashMap<>();
    private final Map<String, Stored<StatisticalSummary>> statistics = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMetricsStore() {
        this(Clock.systemUTC());
    }

    public InMemoryMetricsStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public List<QualityMetric> query(String entityId, String dimension, int limit) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        return metrics.values().stream()
                .map(Stored::value)
                .filter(m -> m.getEntityId().equals(entityId))
                .filter(m -> dimension == null || m.matchesDimension(dimension))
                .sorted(Comparator.comparing(QualityMetric::getTimestamp).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void insertMetrics(List<QualityMetric> batch) {
        Objects.requireNonNull(batch, "metrics must not be null");
        batch.forEach(m -> metrics.put(m.getId(), stamp(m)));
    }

    @Override
    public void insertAnomaly(AnomalyRecord anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        anomalies.put(anomaly.getId(), stamp(anomaly));
    }

    @Override
    public void insertTrend(TrendAnalysis trend) {
        Objects.requireNonNull(trend, "trend must not be null");
        trends.put(trend.getId(), stamp(trend));
    }

    @Override
    public void insertDetectionSummary(DetectionSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        summaries.put(summary.getId(), stamp(summary));
    }

    @Override
    public void insertStatistics(String entityId, String dimension, String timeWindow,
            StatisticalSummary summary, Instant computedAt) {
        Objects.requireNonNull(summary, "statistics must not be null");
        statistics.put(UUID.randomUUID().toString(), stamp(summary));
    }

    @Override
    public List<AnomalyRecord> queryAnomalies(AnomalyFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return anomalies.values().stream()
                .map(Stored::value)
                .filter(filter::matches)
                .sorted(Comparator.comparing(AnomalyRecord::getDetectedAt).reversed())
                .limit(filter.getLimit())
                .toList();
    }

    @Override
    public Optional<TrendAnalysis> queryTrend(String entityId, String dimension) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        return trends.values().stream()
                .map(Stored::value)
                .filter(t -> t.getEntityId().equals(entityId))
                .filter(t -> dimension == null || t.getDimension().equals(dimension)
                        || t.getDimension().equals(QualityMetric.dimensionMetricType(dimension)))
                .max(Comparator.comparing(TrendAnalysis::getAnalyzedAt));
    }

    @Override
    public List<DetectionSummary> querySummaries(String entityId, int limit) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        return summaries.values().stream()
                .map(Stored::value)
                .filter(s -> s.getEntityId().equals(entityId))
                .sorted(Comparator.comparing(DetectionSummary::getAnalysisTimestamp).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteAnomaliesOlderThan(Instant cutoff) {
        return deleteOlderThan(anomalies, cutoff);
    }

    @Override
    public int deleteTrendsOlderThan(Instant cutoff) {
        return deleteOlderThan(trends, cutoff);
    }

    @Override
    public int deleteSummariesOlderThan(Instant cutoff) {
        return deleteOlderThan(summaries, cutoff);
    }

    @Override
    public int deleteStatisticsOlderThan(Instant cutoff) {
        return deleteOlderThan(statistics, cutoff);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> Stored<T> stamp(T value) {
        return new Stored<>(value, clock.instant());
    }

    private static <T> int deleteOlderThan(Map<String, Stored<T>> table, Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        AtomicInteger removed = new AtomicInteger();
        table.values().removeIf(stored -> {
            boolean expired = stored.createdAt().isBefore(cutoff);
            if (expired) {
                removed.incrementAndGet();
            }
            return expired;
        });
        return removed.get();
    }

    private static final class Stored<T> {
        private final T value;
        private final Instant createdAt;

        Stored(T value, Instant createdAt) {
            this.value = value;
            this.createdAt = createdAt;
        }

        T value() {
            return value;
        }

        Instant createdAt() {
            return createdAt;
        }
    }
}
