package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A real-time quality observation: the overall score of an entity plus its
 * per-dimension sub-scores, as produced by the scoring pipeline.
 *
 * @since 1.0.0
 */
public final class QualitySnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final EntityType entityType;
    private final Instant timestamp;
    private final double overallScore;
    private final Map<String, Double> dimensions;
    private final String trendDirection;

    private QualitySnapshot(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.timestamp = b.timestamp != null ? b.timestamp : Instant.now();
        this.overallScore = b.overallScore;
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(b.dimensions));
        this.trendDirection = b.trendDirection;
    }

    /**
     * Expand this snapshot into one overall metric plus one
     * {@code <dimension>_score} metric per dimension, all sharing the
     * snapshot timestamp.
     *
     * @return metrics in insertion order
     */
    public List<QualityMetric> toMetrics() {
        List<QualityMetric> metrics = new ArrayList<>(1 + dimensions.size());
        metrics.add(QualityMetric.builder()
                .entityId(entityId)
                .entityType(entityType)
                .metricType(QualityMetric.OVERALL_QUALITY_SCORE)
                .value(overallScore)
                .timestamp(timestamp)
                .source("snapshot")
                .tag("anomaly-detection")
                .build());
        dimensions.forEach((dimension, score) -> metrics.add(QualityMetric.builder()
                .entityId(entityId)
                .entityType(entityType)
                .metricType(QualityMetric.dimensionMetricType(dimension))
                .value(score)
                .timestamp(timestamp)
                .source("snapshot")
                .tag("anomaly-detection")
                .tag("dimension")
                .build()));
        return metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityId;
        private EntityType entityType = EntityType.DOCUMENT;
        private Instant timestamp;
        private double overallScore;
        private final Map<String, Double> dimensions = new LinkedHashMap<>();
        private String trendDirection;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder overallScore(double overallScore) {
            this.overallScore = overallScore;
            return this;
        }

        public Builder dimension(String name, double score) {
            this.dimensions.put(Objects.requireNonNull(name, "dimension name must not be null"), score);
            return this;
        }

        public Builder dimensions(Map<String, Double> dimensions) {
            if (dimensions != null) {
                this.dimensions.putAll(dimensions);
            }
            return this;
        }

        /**
         * @param trendDirection {@code up}, {@code down} or {@code stable}
         * @return this builder
         */
        public Builder trendDirection(String trendDirection) {
            this.trendDirection = trendDirection;
            return this;
        }

        public QualitySnapshot build() {
            return new QualitySnapshot(this);
        }
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getOverallScore() {
        return overallScore;
    }

    public Map<String, Double> getDimensions() {
        return dimensions;
    }

    public String getTrendDirection() {
        return trendDirection;
    }

    @Override
    public String toString() {
        return "QualitySnapshot{" +
                "entityId='" + entityId + '\'' +
                ", overallScore=" + overallScore +
                ", dimensions=" + dimensions +
                ", timestamp=" + timestamp +
                '}';
    }
}
