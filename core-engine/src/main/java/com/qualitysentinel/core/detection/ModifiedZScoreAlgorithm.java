package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.stats.StatisticalSummary;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Robust Z-score based on the median and the median absolute deviation.
 *
 * <p>
 * {@code mz = 0.6745·(x - median) / MAD}; the point is flagged when
 * {@code |mz| > threshold}. Windows whose MAD is 0 are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ModifiedZScoreAlgorithm extends WindowedOutlierAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(ModifiedZScoreAlgorithm.class);

    public static final String NAME = "modified_zscore";

    private final double threshold;

    public ModifiedZScoreAlgorithm(double threshold, int windowSize) {
        super(NAME, windowSize);
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    public ModifiedZScoreAlgorithm(DetectionConfig.ModifiedZScoreConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").getThreshold(), config.getWindowSize());
    }

    @Override
    protected Optional<AnomalyRecord> evaluate(MetricSeries series, int index, StatisticalSummary window) {
        double mad = window.getMad();
        if (mad == 0) {
            LOG.trace("Skipping index {} of {}: zero MAD window", index, series.getMetricType());
            return Optional.empty();
        }
        double value = series.valueAt(index);
        double mz = Statistics.MAD_CONSISTENCY * (value - window.getMedian()) / mad;
        if (Math.abs(mz) <= threshold) {
            return Optional.empty();
        }
        String description = String.format(Locale.ROOT,
                "Modified Z-score anomaly in %s: value %.3f has modified Z-score %.2f (threshold: %s)",
                series.getMetricType(), value, mz, threshold);
        return Optional.of(flag(series, index, window, Math.abs(mz) / threshold, mad, window.getMedian(),
                description));
    }

    public double getThreshold() {
        return threshold;
    }
}
