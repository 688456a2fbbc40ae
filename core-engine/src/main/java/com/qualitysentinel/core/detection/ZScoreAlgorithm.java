package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.stats.StatisticalSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Classic Z-score detector.
 *
 * <p>
 * A point is an outlier when {@code |x - mean| / stddev > threshold}, with
 * mean and stddev taken over the preceding window. Windows with zero
 * variance are skipped, so a flat history never flags anything.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAlgorithm extends WindowedOutlierAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAlgorithm.class);

    public static final String NAME = "zscore";

    private final double threshold;

    public ZScoreAlgorithm(double threshold, int windowSize) {
        super(NAME, windowSize);
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public ZScoreAlgorithm(DetectionConfig.ZScoreConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").getThreshold(), config.getWindowSize());
    }

    @Override
    protected Optional<AnomalyRecord> evaluate(MetricSeries series, int index, StatisticalSummary window) {
        double stdDev = window.getStandardDeviation();
        if (stdDev == 0) {
            LOG.trace("Skipping index {} of {}: zero variance window", index, series.getMetricType());
            return Optional.empty();
        }
        double value = series.valueAt(index);
        double z = Math.abs(value - window.getMean()) / stdDev;
        if (z <= threshold) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT,
                "Z-score anomaly in %s: value %.3f deviates %.2f standard deviations from mean %.3f",
                series.getMetricType(), value, z, window.getMean());
        return Optional.of(flag(series, index, window, z / threshold, stdDev, window.getMean(), description));
    }

    public double getThreshold() {
        return threshold;
    }
}
