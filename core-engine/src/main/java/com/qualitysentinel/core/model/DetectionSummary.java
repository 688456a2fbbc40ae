package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Persisted summary row of one batch detection run.
 *
 * @since 1.0.0
 */
public final class DetectionSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String entityId;
    private final Instant analysisTimestamp;
    private final int anomaliesCount;
    private final int trendsCount;
    private final double detectionAccuracy;
    private final long processingTimeMs;
    private final List<String> algorithmsUsed;
    private final int dataPointsAnalyzed;

    private DetectionSummary(Builder b) {
        this.id = b.id != null ? b.id : UUID.randomUUID().toString();
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.analysisTimestamp = Objects.requireNonNull(b.analysisTimestamp,
                "analysisTimestamp must not be null");
        this.anomaliesCount = b.anomaliesCount;
        this.trendsCount = b.trendsCount;
        this.detectionAccuracy = b.detectionAccuracy;
        this.processingTimeMs = b.processingTimeMs;
        this.algorithmsUsed = b.algorithmsUsed != null ? List.copyOf(b.algorithmsUsed) : List.of();
        this.dataPointsAnalyzed = b.dataPointsAnalyzed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String entityId;
        private Instant analysisTimestamp;
        private int anomaliesCount;
        private int trendsCount;
        private double detectionAccuracy;
        private long processingTimeMs;
        private List<String> algorithmsUsed;
        private int dataPointsAnalyzed;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder analysisTimestamp(Instant analysisTimestamp) {
            this.analysisTimestamp = analysisTimestamp;
            return this;
        }

        public Builder anomaliesCount(int anomaliesCount) {
            this.anomaliesCount = anomaliesCount;
            return this;
        }

        public Builder trendsCount(int trendsCount) {
            this.trendsCount = trendsCount;
            return this;
        }

        public Builder detectionAccuracy(double detectionAccuracy) {
            this.detectionAccuracy = detectionAccuracy;
            return this;
        }

        public Builder processingTimeMs(long processingTimeMs) {
            this.processingTimeMs = processingTimeMs;
            return this;
        }

        public Builder algorithmsUsed(List<String> algorithmsUsed) {
            this.algorithmsUsed = algorithmsUsed;
            return this;
        }

        public Builder dataPointsAnalyzed(int dataPointsAnalyzed) {
            this.dataPointsAnalyzed = dataPointsAnalyzed;
            return this;
        }

        public DetectionSummary build() {
            return new DetectionSummary(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public Instant getAnalysisTimestamp() {
        return analysisTimestamp;
    }

    public int getAnomaliesCount() {
        return anomaliesCount;
    }

    public int getTrendsCount() {
        return trendsCount;
    }

    public double getDetectionAccuracy() {
        return detectionAccuracy;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public List<String> getAlgorithmsUsed() {
        return algorithmsUsed;
    }

    public int getDataPointsAnalyzed() {
        return dataPointsAnalyzed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionSummary that))
            return false;
        return anomaliesCount == that.anomaliesCount
                && trendsCount == that.trendsCount
                && Double.compare(detectionAccuracy, that.detectionAccuracy) == 0
                && processingTimeMs == that.processingTimeMs
                && dataPointsAnalyzed == that.dataPointsAnalyzed
                && id.equals(that.id)
                && entityId.equals(that.entityId)
                && analysisTimestamp.equals(that.analysisTimestamp)
                && algorithmsUsed.equals(that.algorithmsUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, entityId, analysisTimestamp);
    }

    @Override
    public String toString() {
        return "DetectionSummary{" +
                "entityId='" + entityId + '\'' +
                ", anomalies=" + anomaliesCount +
                ", trends=" + trendsCount +
                ", at=" + analysisTimestamp +
                '}';
    }
}
