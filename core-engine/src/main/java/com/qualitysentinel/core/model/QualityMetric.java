package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One scalar quality observation for an entity.
 *
 * <p>
 * Instances are produced by the upstream scoring pipeline and are
 * immutable. The engine only reads them.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code entityId}, {@code entityType},
 * {@code metricType} and {@code timestamp} are required; {@code id} defaults
 * to a random UUID and {@code unit} to {@code score}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QualityMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric type of the aggregate quality score. */
    public static final String OVERALL_QUALITY_SCORE = "overall_quality_score";

    /** Suffix of per-dimension metric types, e.g. {@code clarity_score}. */
    public static final String DIMENSION_SUFFIX = "_score";

    private final String id;
    private final String entityId;
    private final EntityType entityType;
    private final String metricType;
    private final double value;
    private final String unit;
    private final Instant timestamp;
    private final String source;
    private final Set<String> tags;

    private QualityMetric(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.metricType = Objects.requireNonNull(b.metricType, "metricType must not be null");
        this.value = b.value;
        this.unit = b.unit != null ? b.unit : "score";
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp must not be null");
        this.source = b.source;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(b.tags));
    }

    @JsonCreator
    static QualityMetric fromJson(@JsonProperty("id") String id,
            @JsonProperty("entityId") String entityId,
            @JsonProperty("entityType") EntityType entityType,
            @JsonProperty("metricType") String metricType,
            @JsonProperty("value") double value,
            @JsonProperty("unit") String unit,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("source") String source,
            @JsonProperty("tags") Set<String> tags) {
        return builder()
                .id(id)
                .entityId(entityId)
                .entityType(entityType)
                .metricType(metricType)
                .value(value)
                .unit(unit)
                .timestamp(timestamp)
                .source(source)
                .tags(tags)
                .build();
    }

    /**
     * Metric type used for a quality dimension.
     *
     * @param dimension dimension name, e.g. {@code clarity}
     * @return {@code clarity_score}
     */
    public static String dimensionMetricType(String dimension) {
        return dimension + DIMENSION_SUFFIX;
    }

    /**
     * Whether this metric belongs to the given dimension. Both the bare
     * dimension name and its {@code _score} metric type match.
     *
     * @param dimension dimension name or metric type
     * @return {@code true} on match
     */
    public boolean matchesDimension(String dimension) {
        return metricType.equals(dimension) || metricType.equals(dimensionMetricType(dimension));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link QualityMetric}.
     */
    public static class Builder {
        private String id;
        private String entityId;
        private EntityType entityType;
        private String metricType;
        private double value;
        private String unit;
        private Instant timestamp;
        private String source;
        private final Set<String> tags = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder metricType(String metricType) {
            this.metricType = metricType;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * @param isoTimestamp ISO-8601 instant, e.g. {@code 2025-07-31T10:15:30Z}
         * @return this builder
         * @throws java.time.format.DateTimeParseException if the text is not an
         *                                                 ISO-8601 instant
         */
        public Builder timestamp(String isoTimestamp) {
            this.timestamp = Instant.parse(isoTimestamp);
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public QualityMetric build() {
            return new QualityMetric(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getMetricType() {
        return metricType;
    }

    public double getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSource() {
        return source;
    }

    public Set<String> getTags() {
        return tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QualityMetric that))
            return false;
        return Double.compare(value, that.value) == 0
                && id.equals(that.id)
                && entityId.equals(that.entityId)
                && entityType == that.entityType
                && metricType.equals(that.metricType)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, entityType, metricType, value, timestamp);
    }

    @Override
    public String toString() {
        return "QualityMetric{" +
                "entityId='" + entityId + '\'' +
                ", metricType='" + metricType + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
