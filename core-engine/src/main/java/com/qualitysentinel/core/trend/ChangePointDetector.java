package com.qualitysentinel.core.trend;

import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.TrendAnalysis.ChangePoint;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Sliding two-window mean-shift test.
 *
 * <p>
 * With {@code w = min(20, n/5)}, every index {@code i} in {@code [w, n-w)}
 * compares the mean of {@code values[i-w, i)} with the mean of
 * {@code values[i, i+w)}:
 * </p>
 *
 * <pre>
 * pooled = sqrt((var(before) + var(after)) / 2)
 * t      = |meanAfter - meanBefore| / (pooled · sqrt(2 / w))
 * </pre>
 *
 * <p>
 * Index {@code i} is a change point when {@code t > sensitivity}; its
 * confidence is {@code min(t/2, 1)} and its magnitude the absolute mean shift.
 * Two flat windows at different levels have {@code pooled == 0}; that step is
 * reported with confidence 1. Two flat windows at the same level are skipped.
 * </p>
 *
 * <p>
 * Neighbouring indices around a shift typically all pass the test; callers
 * wanting one point per shift should keep the local maximum of magnitude.
 * </p>
 */
public class ChangePointDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetector.class);

    static final int MAX_WINDOW = 20;

    private final double sensitivity;

    public ChangePointDetector(double sensitivity) {
        if (sensitivity <= 0) {
            throw new IllegalArgumentException("sensitivity must be > 0, got: " + sensitivity);
        }
        this.sensitivity = sensitivity;
    }

    /**
     * @param series time-ordered series
     * @return change points in index order; empty for series shorter than 10
     */
    public List<ChangePoint> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.getValues();
        int window = windowFor(values.length);
        if (window < 2) {
            return List.of();
        }

        List<ChangePoint> changePoints = new ArrayList<>();
        for (int i = window; i < values.length - window; i++) {
            double[] before = Arrays.copyOfRange(values, i - window, i);
            double[] after = Arrays.copyOfRange(values, i, i + window);
            double magnitude = Math.abs(Statistics.mean(after) - Statistics.mean(before));
            double pooled = Math.sqrt((Statistics.variance(before) + Statistics.variance(after)) / 2);

            double confidence;
            if (pooled > 0) {
                double t = magnitude / (pooled * Math.sqrt(2.0 / window));
                if (t <= sensitivity) {
                    continue;
                }
                confidence = Math.min(t / 2, 1);
            } else if (magnitude > 0) {
                confidence = 1;
            } else {
                continue;
            }
            changePoints.add(new ChangePoint(series.getRawPoints().get(i).getTimestamp(), i, magnitude, confidence));
        }
        LOG.debug("Found {} change point(s) in {} (window={})", changePoints.size(), series.getMetricType(), window);
        return changePoints;
    }

    static int windowFor(int length) {
        return Math.min(MAX_WINDOW, length / 5);
    }
}
