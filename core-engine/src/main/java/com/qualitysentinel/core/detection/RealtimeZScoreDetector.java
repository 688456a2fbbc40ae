package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.AnomalySeverity;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.QualitySnapshot;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-point Z-score check for the low-latency path.
 *
 * <p>
 * The new value is compared against a trailing history capped at
 * {@code windowSize} points; no batch scan takes place. The overall score is
 * checked first, then every dimension carried by the snapshot whose history
 * holds at least {@value #MIN_DIMENSION_HISTORY} points. One record is
 * emitted per score that trips the threshold.
 * </p>
 *
 * @since 1.0.0
 */
public class RealtimeZScoreDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RealtimeZScoreDetector.class);

    public static final String NAME = "zscore_realtime";

    /** Dimension histories shorter than this are not checked. */
    public static final int MIN_DIMENSION_HISTORY = 10;

    static final String OVERALL = "overall";
    static final String TIME_WINDOW = "realtime";

    private final double threshold;
    private final int windowSize;

    public RealtimeZScoreDetector(double threshold, int windowSize) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be >= 2, got: " + windowSize);
        }
        this.threshold = threshold;
        this.windowSize = windowSize;
    }

    public RealtimeZScoreDetector(DetectionConfig.ZScoreConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").getThreshold(), config.getWindowSize());
    }

    /**
     * Check a snapshot against previously recorded metrics of the same entity.
     *
     * @param snapshot the new observation
     * @param history  earlier metrics of the entity, in any order
     * @return one record per tripped score; empty if nothing trips
     */
    public List<AnomalyRecord> detect(QualitySnapshot snapshot, List<QualityMetric> history) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(history, "history must not be null");

        List<QualityMetric> ordered = new ArrayList<>(history);
        ordered.sort(Comparator.comparing(QualityMetric::getTimestamp));
        List<QualityMetric> current = snapshot.toMetrics();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        double[] overallHistory = trailing(ordered, QualityMetric.OVERALL_QUALITY_SCORE);
        if (overallHistory.length > 0) {
            check(snapshot, OVERALL, snapshot.getOverallScore(), overallHistory, current.get(0))
                    .ifPresent(anomalies::add);
        }

        int position = 1;
        for (Map.Entry<String, Double> dimension : snapshot.getDimensions().entrySet()) {
            QualityMetric point = current.get(position++);
            double[] dimensionHistory = trailing(ordered, QualityMetric.dimensionMetricType(dimension.getKey()));
            if (dimensionHistory.length < MIN_DIMENSION_HISTORY) {
                LOG.trace("Skipping dimension '{}' of {}: only {} historical points",
                        dimension.getKey(), snapshot.getEntityId(), dimensionHistory.length);
                continue;
            }
            check(snapshot, dimension.getKey(), dimension.getValue(), dimensionHistory, point)
                    .ifPresent(anomalies::add);
        }
        return anomalies;
    }

    private Optional<AnomalyRecord> check(QualitySnapshot snapshot, String dimension, double value,
            double[] history, QualityMetric point) {
        double mean = Statistics.mean(history);
        double stdDev = Statistics.standardDeviation(history);
        if (stdDev == 0) {
            return Optional.empty();
        }
        double z = Math.abs(value - mean) / stdDev;
        if (z <= threshold) {
            return Optional.empty();
        }
        double rawScore = z / threshold;
        String description = OVERALL.equals(dimension)
                ? String.format(Locale.ROOT,
                        "Real-time anomaly detected: quality score %.3f deviates %.2f standard deviations from mean %.3f",
                        value, z, mean)
                : String.format(Locale.ROOT,
                        "Real-time dimension anomaly: %s score %.3f deviates %.2f standard deviations from mean %.3f",
                        dimension, value, z, mean);

        LOG.debug("Real-time check fired for {} [{}]: value={} z={}", snapshot.getEntityId(), dimension, value, z);

        return Optional.of(AnomalyRecord.builder()
                .type(AnomalyType.STATISTICAL_OUTLIER)
                .severity(AnomalySeverity.fromNormalizedScore(rawScore))
                .entityId(snapshot.getEntityId())
                .entityType(snapshot.getEntityType())
                .detectedAt(snapshot.getTimestamp())
                .algorithm(NAME)
                .score(rawScore)
                .confidence(WindowedOutlierAlgorithm.confidence(history.length, stdDev))
                .description(description)
                .context(new AnomalyRecord.Context(value, mean, mean, stdDev, history.length))
                .metadata(new AnomalyRecord.Metadata(dimension, TIME_WINDOW, snapshot.getTrendDirection()))
                .relatedMetric(point)
                .build());
    }

    private double[] trailing(List<QualityMetric> ordered, String metricType) {
        double[] values = ordered.stream()
                .filter(m -> m.getMetricType().equals(metricType))
                .mapToDouble(QualityMetric::getValue)
                .toArray();
        if (values.length <= windowSize) {
            return values;
        }
        double[] tail = new double[windowSize];
        System.arraycopy(values, values.length - windowSize, tail, 0, windowSize);
        return tail;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
