package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single anomaly flagged by one outlier algorithm for one data point.
 *
 * <p>
 * Records are immutable. Several algorithms may each emit a record for the
 * same data point; no cross-algorithm deduplication takes place.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code score} and {@code confidence} are clamped
 * to {@code [0, 1]} at build time; {@code id} defaults to a random UUID.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = AnomalyRecord.Builder.class)
public final class AnomalyRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final AnomalyType type;
    private final AnomalySeverity severity;
    private final String entityId;
    private final EntityType entityType;
    private final Instant detectedAt;
    private final String algorithm;
    private final double score;
    private final double confidence;
    private final String description;
    private final Context context;
    private final Metadata metadata;
    private final List<QualityMetric> relatedMetrics;

    private AnomalyRecord(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.type = b.type != null ? b.type : AnomalyType.STATISTICAL_OUTLIER;
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.algorithm = Objects.requireNonNull(b.algorithm, "algorithm must not be null");
        this.score = clamp(b.score);
        this.confidence = clamp(b.confidence);
        this.description = b.description;
        this.context = Objects.requireNonNull(b.context, "context must not be null");
        this.metadata = Objects.requireNonNull(b.metadata, "metadata must not be null");
        this.relatedMetrics = Collections.unmodifiableList(new ArrayList<>(b.relatedMetrics));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyRecord} instances.
     */
    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private AnomalyType type;
        private AnomalySeverity severity;
        private String entityId;
        private EntityType entityType;
        private Instant detectedAt;
        private String algorithm;
        private double score;
        private double confidence;
        private String description;
        private Context context;
        private Metadata metadata;
        private final List<QualityMetric> relatedMetrics = new ArrayList<>();

        @JsonProperty("id")
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        @JsonProperty("type")
        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        @JsonProperty("severity")
        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        @JsonProperty("entityId")
        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        @JsonProperty("entityType")
        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        @JsonProperty("detectedAt")
        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        @JsonProperty("algorithm")
        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        @JsonProperty("score")
        public Builder score(double score) {
            this.score = score;
            return this;
        }

        @JsonProperty("confidence")
        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        @JsonProperty("description")
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        @JsonProperty("context")
        public Builder context(Context context) {
            this.context = context;
            return this;
        }

        @JsonProperty("metadata")
        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        @JsonProperty("relatedMetrics")
        public Builder relatedMetrics(List<QualityMetric> relatedMetrics) {
            this.relatedMetrics.clear();
            if (relatedMetrics != null) {
                this.relatedMetrics.addAll(relatedMetrics);
            }
            return this;
        }

        public Builder relatedMetric(QualityMetric metric) {
            this.relatedMetrics.add(Objects.requireNonNull(metric, "metric must not be null"));
            return this;
        }

        /**
         * @return a new {@link AnomalyRecord}
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyRecord build() {
            return new AnomalyRecord(this);
        }
    }

    // ---------------------------------------------------------------
    // Nested value types
    // ---------------------------------------------------------------

    /**
     * The statistical context in which the anomaly was judged.
     */
    public static final class Context implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double currentValue;
        private final double expectedValue;
        private final double historicalMean;
        private final double historicalStdDev;
        private final int dataPoints;

        @JsonCreator
        public Context(@JsonProperty("currentValue") double currentValue,
                @JsonProperty("expectedValue") double expectedValue,
                @JsonProperty("historicalMean") double historicalMean,
                @JsonProperty("historicalStdDev") double historicalStdDev,
                @JsonProperty("dataPoints") int dataPoints) {
            this.currentValue = currentValue;
            this.expectedValue = expectedValue;
            this.historicalMean = historicalMean;
            this.historicalStdDev = historicalStdDev;
            this.dataPoints = dataPoints;
        }

        public double getCurrentValue() {
            return currentValue;
        }

        public double getExpectedValue() {
            return expectedValue;
        }

        public double getHistoricalMean() {
            return historicalMean;
        }

        public double getHistoricalStdDev() {
            return historicalStdDev;
        }

        public int getDataPoints() {
            return dataPoints;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Context that))
                return false;
            return Double.compare(currentValue, that.currentValue) == 0
                    && Double.compare(expectedValue, that.expectedValue) == 0
                    && Double.compare(historicalMean, that.historicalMean) == 0
                    && Double.compare(historicalStdDev, that.historicalStdDev) == 0
                    && dataPoints == that.dataPoints;
        }

        @Override
        public int hashCode() {
            return Objects.hash(currentValue, expectedValue, historicalMean, historicalStdDev, dataPoints);
        }

        @Override
        public String toString() {
            return "Context{current=" + currentValue + ", expected=" + expectedValue
                    + ", mean=" + historicalMean + ", stdDev=" + historicalStdDev
                    + ", dataPoints=" + dataPoints + '}';
        }
    }

    /**
     * Descriptive metadata: which dimension, which window, and the trend
     * direction reported by the producer (real-time path only).
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Metadata implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String qualityDimension;
        private final String timeWindow;
        private final String trendDirection;

        @JsonCreator
        public Metadata(@JsonProperty("qualityDimension") String qualityDimension,
                @JsonProperty("timeWindow") String timeWindow,
                @JsonProperty("trendDirection") String trendDirection) {
            this.qualityDimension = qualityDimension;
            this.timeWindow = timeWindow;
            this.trendDirection = trendDirection;
        }

        public Metadata(String qualityDimension, String timeWindow) {
            this(qualityDimension, timeWindow, null);
        }

        public String getQualityDimension() {
            return qualityDimension;
        }

        public String getTimeWindow() {
            return timeWindow;
        }

        public String getTrendDirection() {
            return trendDirection;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Metadata that))
                return false;
            return Objects.equals(qualityDimension, that.qualityDimension)
                    && Objects.equals(timeWindow, that.timeWindow)
                    && Objects.equals(trendDirection, that.trendDirection);
        }

        @Override
        public int hashCode() {
            return Objects.hash(qualityDimension, timeWindow, trendDirection);
        }

        @Override
        public String toString() {
            return "Metadata{dimension='" + qualityDimension + "', window='" + timeWindow
                    + "', trend=" + trendDirection + '}';
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public AnomalyType getType() {
        return type;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public double getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getDescription() {
        return description;
    }

    public Context getContext() {
        return context;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public List<QualityMetric> getRelatedMetrics() {
        return relatedMetrics;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyRecord that))
            return false;
        return Double.compare(score, that.score) == 0
                && Double.compare(confidence, that.confidence) == 0
                && id.equals(that.id)
                && type == that.type
                && severity == that.severity
                && entityId.equals(that.entityId)
                && entityType == that.entityType
                && detectedAt.equals(that.detectedAt)
                && algorithm.equals(that.algorithm)
                && Objects.equals(description, that.description)
                && context.equals(that.context)
                && metadata.equals(that.metadata)
                && relatedMetrics.equals(that.relatedMetrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, algorithm, detectedAt);
    }

    @Override
    public String toString() {
        return "AnomalyRecord{" +
                "algorithm='" + algorithm + '\'' +
                ", entityId='" + entityId + '\'' +
                ", severity=" + severity +
                ", score=" + score +
                ", detectedAt=" + detectedAt +
                ", dimension='" + metadata.getQualityDimension() + '\'' +
                '}';
    }
}
