package com.qualitysentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate returned by one batch detection run.
 *
 * <p>
 * The result itself is never persisted; its anomalies and trends are, along
 * with a {@link DetectionSummary} derived via {@link #toSummary(String)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<AnomalyRecord> anomalies;
    private final List<TrendAnalysis> trends;
    private final Summary summary;
    private final Metadata metadata;

    public DetectionResult(List<AnomalyRecord> anomalies, List<TrendAnalysis> trends,
            Summary summary, Metadata metadata) {
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(anomalies, "anomalies must not be null")));
        this.trends = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(trends, "trends must not be null")));
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
    }

    /**
     * Derive the persisted summary row for this run.
     *
     * @param entityId the analysed entity
     * @return a new summary with a fresh id
     */
    public DetectionSummary toSummary(String entityId) {
        return DetectionSummary.builder()
                .entityId(entityId)
                .analysisTimestamp(metadata.getAnalysisTimestamp())
                .anomaliesCount(anomalies.size())
                .trendsCount(trends.size())
                .detectionAccuracy(summary.getDetectionAccuracy())
                .processingTimeMs(summary.getProcessingTimeMs())
                .algorithmsUsed(metadata.getAlgorithmsUsed())
                .dataPointsAnalyzed(metadata.getDataPointsAnalyzed())
                .build();
    }

    public List<AnomalyRecord> getAnomalies() {
        return anomalies;
    }

    public List<TrendAnalysis> getTrends() {
        return trends;
    }

    public Summary getSummary() {
        return summary;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    // ---------------------------------------------------------------
    // Nested types
    // ---------------------------------------------------------------

    /**
     * Counts per severity and per type. Every enum constant is present in the
     * maps, zero-filled when nothing was flagged.
     */
    public static final class Summary implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int totalAnomalies;
        private final Map<AnomalySeverity, Integer> anomaliesBySeverity;
        private final Map<AnomalyType, Integer> anomaliesByType;
        private final double detectionAccuracy;
        private final long processingTimeMs;

        private Summary(int totalAnomalies, Map<AnomalySeverity, Integer> bySeverity,
                Map<AnomalyType, Integer> byType, double detectionAccuracy, long processingTimeMs) {
            this.totalAnomalies = totalAnomalies;
            this.anomaliesBySeverity = Collections.unmodifiableMap(bySeverity);
            this.anomaliesByType = Collections.unmodifiableMap(byType);
            this.detectionAccuracy = detectionAccuracy;
            this.processingTimeMs = processingTimeMs;
        }

        /**
         * @param anomalies         the anomalies of the run
         * @param detectionAccuracy self-reported accuracy heuristic
         * @param processingTimeMs  wall-clock duration of the run
         * @return the summary
         */
        public static Summary of(List<AnomalyRecord> anomalies, double detectionAccuracy,
                long processingTimeMs) {
            Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);
            for (AnomalySeverity severity : AnomalySeverity.values()) {
                bySeverity.put(severity, 0);
            }
            Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
            for (AnomalyType type : AnomalyType.values()) {
                byType.put(type, 0);
            }
            for (AnomalyRecord anomaly : anomalies) {
                bySeverity.merge(anomaly.getSeverity(), 1, Integer::sum);
                byType.merge(anomaly.getType(), 1, Integer::sum);
            }
            return new Summary(anomalies.size(), bySeverity, byType, detectionAccuracy, processingTimeMs);
        }

        public int getTotalAnomalies() {
            return totalAnomalies;
        }

        public Map<AnomalySeverity, Integer> getAnomaliesBySeverity() {
            return anomaliesBySeverity;
        }

        public Map<AnomalyType, Integer> getAnomaliesByType() {
            return anomaliesByType;
        }

        public double getDetectionAccuracy() {
            return detectionAccuracy;
        }

        public long getProcessingTimeMs() {
            return processingTimeMs;
        }

        @Override
        public String toString() {
            return "Summary{total=" + totalAnomalies + ", bySeverity=" + anomaliesBySeverity
                    + ", accuracy=" + detectionAccuracy + ", timeMs=" + processingTimeMs + '}';
        }
    }

    public static final class Metadata implements Serializable {

        private static final long serialVersionUID = 1L;

        private final int dataPointsAnalyzed;
        private final List<String> algorithmsUsed;
        private final Instant analysisTimestamp;

        public Metadata(int dataPointsAnalyzed, List<String> algorithmsUsed, Instant analysisTimestamp) {
            this.dataPointsAnalyzed = dataPointsAnalyzed;
            this.algorithmsUsed = List.copyOf(algorithmsUsed);
            this.analysisTimestamp = Objects.requireNonNull(analysisTimestamp,
                    "analysisTimestamp must not be null");
        }

        public int getDataPointsAnalyzed() {
            return dataPointsAnalyzed;
        }

        public List<String> getAlgorithmsUsed() {
            return algorithmsUsed;
        }

        public Instant getAnalysisTimestamp() {
            return analysisTimestamp;
        }

        @Override
        public String toString() {
            return "Metadata{dataPoints=" + dataPointsAnalyzed + ", algorithms=" + algorithmsUsed
                    + ", at=" + analysisTimestamp + '}';
        }
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "anomalies=" + anomalies.size() +
                ", trends=" + trends.size() +
                ", summary=" + summary +
                ", metadata=" + metadata +
                '}';
    }
}
