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
 * Tukey fence detector.
 *
 * <p>
 * Bounds are {@code [Q1 - k·IQR, Q3 + k·IQR]}. A point outside the bounds is
 * flagged with deviation {@code max(|x - lower|, |x - upper|) / IQR} and raw
 * score {@code deviation / k}. Windows whose IQR is 0 are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrAlgorithm extends WindowedOutlierAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(IqrAlgorithm.class);

    public static final String NAME = "iqr";

    private final double multiplier;

    public IqrAlgorithm(double multiplier, int windowSize) {
        super(NAME, windowSize);
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    public IqrAlgorithm(DetectionConfig.IqrConfig config) {
        this(Objects.requireNonNull(config, "config must not be null").getMultiplier(), config.getWindowSize());
    }

    @Override
    protected Optional<AnomalyRecord> evaluate(MetricSeries series, int index, StatisticalSummary window) {
        double iqr = window.getIqr();
        if (iqr == 0) {
            LOG.trace("Skipping index {} of {}: zero IQR window", index, series.getMetricType());
            return Optional.empty();
        }
        double lower = window.getQ1() - multiplier * iqr;
        double upper = window.getQ3() + multiplier * iqr;
        double value = series.valueAt(index);
        if (value >= lower && value <= upper) {
            return Optional.empty();
        }
        double deviation = Math.max(Math.abs(value - lower), Math.abs(value - upper)) / iqr;
        String description = String.format(Locale.ROOT,
                "IQR anomaly in %s: value %.3f outside bounds [%.3f, %.3f]",
                series.getMetricType(), value, lower, upper);
        return Optional.of(flag(series, index, window, deviation / multiplier, iqr, window.getMedian(),
                description));
    }

    public double getMultiplier() {
        return multiplier;
    }
}
