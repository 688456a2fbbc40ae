package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.AnomalySeverity;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.stats.StatisticalSummary;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sliding-window skeleton shared by the batch outlier algorithms.
 *
 * <p>
 * For each index {@code i >= windowSize} the point {@code values[i]} is judged
 * against the statistics of the preceding window {@code values[i-W, i)}. The
 * point itself never contributes to its own reference window, and indices
 * below {@code windowSize} are never evaluated.
 * </p>
 *
 * <h3>Confidence</h3>
 * <p>
 * {@code 0.6·min(W/100, 1) + 0.4·max(0, 1 - variability)}, where the
 * variability measure is algorithm specific (stddev, MAD or IQR).
 * </p>
 *
 * @since 1.0.0
 */
public abstract class WindowedOutlierAlgorithm implements OutlierAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(WindowedOutlierAlgorithm.class);

    private final String name;
    protected final int windowSize;

    protected WindowedOutlierAlgorithm(String name, int windowSize) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (windowSize < 2) {
            throw new IllegalArgumentException(
                    "windowSize must be >= 2 for algorithm '" + name + "', got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    @Override
    public final List<AnomalyRecord> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() <= windowSize) {
            return List.of();
        }

        double[] values = series.getValues();
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = windowSize; i < values.length; i++) {
            StatisticalSummary window = Statistics.summarize(Arrays.copyOfRange(values, i - windowSize, i));
            Optional<AnomalyRecord> anomaly = evaluate(series, i, window);
            anomaly.ifPresent(anomalies::add);
        }
        return anomalies;
    }

    /**
     * Judge the point at {@code index} against its reference window.
     *
     * @param series the whole series
     * @param index  position of the point under test, {@code >= windowSize}
     * @param window statistics of {@code values[index-W, index)}
     * @return a record if the point is an outlier
     */
    protected abstract Optional<AnomalyRecord> evaluate(MetricSeries series, int index, StatisticalSummary window);

    @Override
    public String getName() {
        return name;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * Confidence heuristic combining window size and dispersion.
     *
     * @param dataPoints  size of the reference window
     * @param variability stddev, MAD or IQR of the window
     * @return confidence in {@code [0, 1]}
     */
    static double confidence(int dataPoints, double variability) {
        double sizeFactor = Math.min(dataPoints / 100.0, 1.0);
        double variabilityFactor = Math.max(0, 1 - variability);
        return sizeFactor * 0.6 + variabilityFactor * 0.4;
    }

    /**
     * Assemble the record for a flagged point.
     *
     * @param rawScore test statistic divided by its threshold, before clamping
     */
    protected AnomalyRecord flag(MetricSeries series, int index, StatisticalSummary window,
            double rawScore, double variability, double expectedValue, String description) {
        QualityMetric point = series.getRawPoints().get(index);
        AnomalySeverity severity = AnomalySeverity.fromNormalizedScore(rawScore);

        LOG.debug("Algorithm [{}] fired on {}/{} at index {}: value={} raw={} severity={}",
                name, series.getEntityId(), series.getMetricType(), index, point.getValue(), rawScore, severity);

        return AnomalyRecord.builder()
                .type(AnomalyType.STATISTICAL_OUTLIER)
                .severity(severity)
                .entityId(series.getEntityId())
                .entityType(series.getEntityType())
                .detectedAt(point.getTimestamp())
                .algorithm(name)
                .score(rawScore)
                .confidence(confidence(window.getCount(), variability))
                .description(description)
                .context(new AnomalyRecord.Context(point.getValue(), expectedValue, window.getMean(),
                        window.getStandardDeviation(), window.getCount()))
                .metadata(new AnomalyRecord.Metadata(series.getMetricType(), windowSize + "_points"))
                .relatedMetric(point)
                .build();
    }
}
