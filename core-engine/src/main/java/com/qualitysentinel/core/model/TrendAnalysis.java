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
 * Result of one trend analysis run over the series of a single
 * (entity, dimension) pair.
 *
 * <p>
 * A newer analysis supersedes an older one; analyses are never merged. The
 * latest by {@link #getAnalyzedAt()} is authoritative for queries.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = TrendAnalysis.Builder.class)
public final class TrendAnalysis implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String entityId;
    private final EntityType entityType;
    private final String dimension;
    private final Instant analyzedAt;
    private final TimeRange timeRange;
    private final Trend trend;
    private final Seasonality seasonality;
    private final Forecast forecast;
    private final List<ChangePoint> changePoints;
    private final Statistics statistics;

    private TrendAnalysis(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(b.entityType, "entityType must not be null");
        this.dimension = Objects.requireNonNull(b.dimension, "dimension must not be null");
        this.analyzedAt = Objects.requireNonNull(b.analyzedAt, "analyzedAt must not be null");
        this.timeRange = Objects.requireNonNull(b.timeRange, "timeRange must not be null");
        this.trend = Objects.requireNonNull(b.trend, "trend must not be null");
        this.seasonality = Objects.requireNonNull(b.seasonality, "seasonality must not be null");
        this.forecast = Objects.requireNonNull(b.forecast, "forecast must not be null");
        this.changePoints = Collections.unmodifiableList(new ArrayList<>(b.changePoints));
        this.statistics = Objects.requireNonNull(b.statistics, "statistics must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String entityId;
        private EntityType entityType;
        private String dimension;
        private Instant analyzedAt;
        private TimeRange timeRange;
        private Trend trend;
        private Seasonality seasonality;
        private Forecast forecast;
        private final List<ChangePoint> changePoints = new ArrayList<>();
        private Statistics statistics;

        @JsonProperty("id")
        public Builder id(String id) {
            this.id = id;
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

        @JsonProperty("dimension")
        public Builder dimension(String dimension) {
            this.dimension = dimension;
            return this;
        }

        @JsonProperty("analyzedAt")
        public Builder analyzedAt(Instant analyzedAt) {
            this.analyzedAt = analyzedAt;
            return this;
        }

        @JsonProperty("timeRange")
        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        @JsonProperty("trend")
        public Builder trend(Trend trend) {
            this.trend = trend;
            return this;
        }

        @JsonProperty("seasonality")
        public Builder seasonality(Seasonality seasonality) {
            this.seasonality = seasonality;
            return this;
        }

        @JsonProperty("forecast")
        public Builder forecast(Forecast forecast) {
            this.forecast = forecast;
            return this;
        }

        @JsonProperty("changePoints")
        public Builder changePoints(List<ChangePoint> changePoints) {
            this.changePoints.clear();
            if (changePoints != null) {
                this.changePoints.addAll(changePoints);
            }
            return this;
        }

        @JsonProperty("statistics")
        public Builder statistics(Statistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public TrendAnalysis build() {
            return new TrendAnalysis(this);
        }
    }

    // ---------------------------------------------------------------
    // Nested value types
    // ---------------------------------------------------------------

    public static final class TimeRange implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant start;
        private final Instant end;

        @JsonCreator
        public TimeRange(@JsonProperty("start") Instant start, @JsonProperty("end") Instant end) {
            this.start = Objects.requireNonNull(start, "start must not be null");
            this.end = Objects.requireNonNull(end, "end must not be null");
        }

        public Instant getStart() {
            return start;
        }

        public Instant getEnd() {
            return end;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof TimeRange that))
                return false;
            return start.equals(that.start) && end.equals(that.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end);
        }

        @Override
        public String toString() {
            return "[" + start + " .. " + end + "]";
        }
    }

    /**
     * Linear trend. {@code confidence} is the R² of the fit;
     * {@code significance} is not computed and stays 0.
     */
    public static final class Trend implements Serializable {

        private static final long serialVersionUID = 1L;

        private final TrendDirection direction;
        private final double slope;
        private final double confidence;
        private final double significance;

        @JsonCreator
        public Trend(@JsonProperty("direction") TrendDirection direction,
                @JsonProperty("slope") double slope,
                @JsonProperty("confidence") double confidence,
                @JsonProperty("significance") double significance) {
            this.direction = Objects.requireNonNull(direction, "direction must not be null");
            this.slope = slope;
            this.confidence = confidence;
            this.significance = significance;
        }

        public TrendDirection getDirection() {
            return direction;
        }

        public double getSlope() {
            return slope;
        }

        public double getConfidence() {
            return confidence;
        }

        public double getSignificance() {
            return significance;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Trend that))
                return false;
            return direction == that.direction
                    && Double.compare(slope, that.slope) == 0
                    && Double.compare(confidence, that.confidence) == 0
                    && Double.compare(significance, that.significance) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(direction, slope, confidence, significance);
        }

        @Override
        public String toString() {
            return "Trend{" + direction + ", slope=" + slope + ", r2=" + confidence + '}';
        }
    }

    /**
     * Autocorrelation-based seasonality. {@code period} and {@code amplitude}
     * are {@code null} unless {@code detected}; {@code phase} is always 0.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Seasonality implements Serializable {

        private static final long serialVersionUID = 1L;

        private final boolean detected;
        private final Integer period;
        private final Double amplitude;
        private final double phase;

        @JsonCreator
        public Seasonality(@JsonProperty("detected") boolean detected,
                @JsonProperty("period") Integer period,
                @JsonProperty("amplitude") Double amplitude,
                @JsonProperty("phase") double phase) {
            this.detected = detected;
            this.period = period;
            this.amplitude = amplitude;
            this.phase = phase;
        }

        public static Seasonality none() {
            return new Seasonality(false, null, null, 0);
        }

        public boolean isDetected() {
            return detected;
        }

        public Integer getPeriod() {
            return period;
        }

        public Double getAmplitude() {
            return amplitude;
        }

        public double getPhase() {
            return phase;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Seasonality that))
                return false;
            return detected == that.detected
                    && Objects.equals(period, that.period)
                    && Objects.equals(amplitude, that.amplitude)
                    && Double.compare(phase, that.phase) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(detected, period, amplitude, phase);
        }

        @Override
        public String toString() {
            return detected ? "Seasonality{period=" + period + ", amplitude=" + amplitude + '}'
                    : "Seasonality{none}";
        }
    }

    public static final class Forecast implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int horizon;
        private final List<Prediction> predictions;
        private final double accuracy;

        @JsonCreator
        public Forecast(@JsonProperty("horizon") int horizon,
                @JsonProperty("predictions") List<Prediction> predictions,
                @JsonProperty("accuracy") double accuracy) {
            this.horizon = horizon;
            this.predictions = predictions != null
                    ? Collections.unmodifiableList(new ArrayList<>(predictions))
                    : List.of();
            this.accuracy = accuracy;
        }

        public int getHorizon() {
            return horizon;
        }

        public List<Prediction> getPredictions() {
            return predictions;
        }

        public double getAccuracy() {
            return accuracy;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Forecast that))
                return false;
            return horizon == that.horizon
                    && Double.compare(accuracy, that.accuracy) == 0
                    && predictions.equals(that.predictions);
        }

        @Override
        public int hashCode() {
            return Objects.hash(horizon, predictions, accuracy);
        }
    }

    public static final class Prediction implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant timestamp;
        private final double value;
        private final ConfidenceInterval confidenceInterval;

        @JsonCreator
        public Prediction(@JsonProperty("timestamp") Instant timestamp,
                @JsonProperty("value") double value,
                @JsonProperty("confidenceInterval") ConfidenceInterval confidenceInterval) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
            this.value = value;
            this.confidenceInterval = Objects.requireNonNull(confidenceInterval,
                    "confidenceInterval must not be null");
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public double getValue() {
            return value;
        }

        public ConfidenceInterval getConfidenceInterval() {
            return confidenceInterval;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Prediction that))
                return false;
            return Double.compare(value, that.value) == 0
                    && timestamp.equals(that.timestamp)
                    && confidenceInterval.equals(that.confidenceInterval);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestamp, value, confidenceInterval);
        }
    }

    public static final class ConfidenceInterval implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double lower;
        private final double upper;

        @JsonCreator
        public ConfidenceInterval(@JsonProperty("lower") double lower, @JsonProperty("upper") double upper) {
            this.lower = lower;
            this.upper = upper;
        }

        public double getLower() {
            return lower;
        }

        public double getUpper() {
            return upper;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ConfidenceInterval that))
                return false;
            return Double.compare(lower, that.lower) == 0 && Double.compare(upper, that.upper) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lower, upper);
        }
    }

    /**
     * A mean shift located at {@code index} of the analysed series.
     */
    public static final class ChangePoint implements Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant timestamp;
        private final int index;
        private final double magnitude;
        private final double confidence;

        @JsonCreator
        public ChangePoint(@JsonProperty("timestamp") Instant timestamp,
                @JsonProperty("index") int index,
                @JsonProperty("magnitude") double magnitude,
                @JsonProperty("confidence") double confidence) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
            this.index = index;
            this.magnitude = magnitude;
            this.confidence = confidence;
        }

        public Instant getTimestamp() {
            return timestamp;
        }

        public int getIndex() {
            return index;
        }

        public double getMagnitude() {
            return magnitude;
        }

        public double getConfidence() {
            return confidence;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof ChangePoint that))
                return false;
            return index == that.index
                    && Double.compare(magnitude, that.magnitude) == 0
                    && Double.compare(confidence, that.confidence) == 0
                    && timestamp.equals(that.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(timestamp, index, magnitude, confidence);
        }

        @Override
        public String toString() {
            return "ChangePoint{index=" + index + ", magnitude=" + magnitude
                    + ", confidence=" + confidence + '}';
        }
    }

    public static final class Statistics implements Serializable {

        private static final long serialVersionUID = 1L;

        private final double mean;
        private final double variance;
        private final double autocorrelation;
        private final boolean stationarity;

        @JsonCreator
        public Statistics(@JsonProperty("mean") double mean,
                @JsonProperty("variance") double variance,
                @JsonProperty("autocorrelation") double autocorrelation,
                @JsonProperty("stationarity") boolean stationarity) {
            this.mean = mean;
            this.variance = variance;
            this.autocorrelation = autocorrelation;
            this.stationarity = stationarity;
        }

        public double getMean() {
            return mean;
        }

        public double getVariance() {
            return variance;
        }

        public double getAutocorrelation() {
            return autocorrelation;
        }

        public boolean isStationarity() {
            return stationarity;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Statistics that))
                return false;
            return Double.compare(mean, that.mean) == 0
                    && Double.compare(variance, that.variance) == 0
                    && Double.compare(autocorrelation, that.autocorrelation) == 0
                    && stationarity == that.stationarity;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mean, variance, autocorrelation, stationarity);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getDimension() {
        return dimension;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public Trend getTrend() {
        return trend;
    }

    public Seasonality getSeasonality() {
        return seasonality;
    }

    public Forecast getForecast() {
        return forecast;
    }

    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public Statistics getStatistics() {
        return statistics;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrendAnalysis that))
            return false;
        return id.equals(that.id)
                && entityId.equals(that.entityId)
                && entityType == that.entityType
                && dimension.equals(that.dimension)
                && analyzedAt.equals(that.analyzedAt)
                && timeRange.equals(that.timeRange)
                && trend.equals(that.trend)
                && seasonality.equals(that.seasonality)
                && forecast.equals(that.forecast)
                && changePoints.equals(that.changePoints)
                && statistics.equals(that.statistics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, dimension, analyzedAt);
    }

    @Override
    public String toString() {
        return "TrendAnalysis{" +
                "entityId='" + entityId + '\'' +
                ", dimension='" + dimension + '\'' +
                ", trend=" + trend +
                ", changePoints=" + changePoints.size() +
                ", analyzedAt=" + analyzedAt +
                '}';
    }
}
