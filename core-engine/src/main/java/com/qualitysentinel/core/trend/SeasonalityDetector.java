package com.qualitysentinel.core.trend;

import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.stats.Statistics;

/**
 * Autocorrelation search for a dominant period.
 *
 * <p>
 * Lags from 2 up to {@code min(n/4, 2·seasonalPeriod)} are scanned; the lag
 * with the largest absolute autocorrelation wins. Seasonality is reported
 * only when that correlation exceeds {@value #DETECTION_THRESHOLD}. Phase is
 * not estimated and is always 0.
 * </p>
 */
public class SeasonalityDetector {

    static final double DETECTION_THRESHOLD = 0.3;

    private final int seasonalPeriod;

    public SeasonalityDetector(int seasonalPeriod) {
        if (seasonalPeriod < 1) {
            throw new IllegalArgumentException("seasonalPeriod must be >= 1, got: " + seasonalPeriod);
        }
        this.seasonalPeriod = seasonalPeriod;
    }

    public TrendAnalysis.Seasonality detect(double[] values) {
        double maxLag = Math.min(values.length / 4.0, seasonalPeriod * 2.0);
        double best = 0;
        int bestLag = 0;
        for (int lag = 2; lag <= maxLag; lag++) {
            double correlation = Math.abs(Statistics.autocorrelation(values, lag));
            if (correlation > best) {
                best = correlation;
                bestLag = lag;
            }
        }
        if (best > DETECTION_THRESHOLD) {
            return new TrendAnalysis.Seasonality(true, bestLag, best, 0);
        }
        return TrendAnalysis.Seasonality.none();
    }
}
