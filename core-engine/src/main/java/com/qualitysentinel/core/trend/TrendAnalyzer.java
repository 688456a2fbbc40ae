package com.qualitysentinel.core.trend;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.model.TrendDirection;
import com.qualitysentinel.core.stats.LinearRegression;
import com.qualitysentinel.core.stats.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Characterises the series of one (entity, metric type) pair.
 *
 * <h3>Output</h3>
 * <ul>
 * <li>Linear trend via OLS over the index; direction classified by
 * {@link TrendDirection#fromSlope(double)}; confidence is R²</li>
 * <li>Seasonality via {@link SeasonalityDetector}</li>
 * <li>Linear forecast for {@code forecastHorizon} steps, one minute apart,
 * with a ±1.96σ band</li>
 * <li>Change points via {@link ChangePointDetector}</li>
 * <li>Mean, variance, lag-1 autocorrelation and a stationarity verdict</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances hold only immutable configuration and may be shared.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalyzer.class);

    static final double CONFIDENCE_Z = 1.96;
    static final Duration FORECAST_STEP = Duration.ofMinutes(1);

    private final int windowSize;
    private final int forecastHorizon;
    private final SeasonalityDetector seasonalityDetector;
    private final ChangePointDetector changePointDetector;
    private final Clock clock;

    public TrendAnalyzer(DetectionConfig.TrendAnalysisConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windowSize = config.getWindowSize();
        this.forecastHorizon = config.getForecastHorizon();
        this.seasonalityDetector = new SeasonalityDetector(config.getSeasonalPeriod());
        this.changePointDetector = new ChangePointDetector(config.getChangePointSensitivity());
    }

    /**
     * Analyse a series.
     *
     * @param series time-ordered series
     * @return the analysis, or empty if the series is shorter than the
     *         configured window
     */
    public Optional<TrendAnalysis> analyze(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() < windowSize) {
            LOG.trace("Skipping trend for {}/{}: {} < {} points",
                    series.getEntityId(), series.getMetricType(), series.size(), windowSize);
            return Optional.empty();
        }

        double[] values = series.getValues();
        Instant analyzedAt = clock.instant();
        LinearRegression regression = LinearRegression.fit(values);
        List<QualityMetric> points = series.getRawPoints();

        TrendAnalysis analysis = TrendAnalysis.builder()
                .entityId(series.getEntityId())
                .entityType(series.getEntityType())
                .dimension(series.getMetricType())
                .analyzedAt(analyzedAt)
                .timeRange(new TrendAnalysis.TimeRange(points.get(0).getTimestamp(),
                        points.get(points.size() - 1).getTimestamp()))
                .trend(new TrendAnalysis.Trend(TrendDirection.fromSlope(regression.getSlope()),
                        regression.getSlope(), regression.getRSquared(), 0))
                .seasonality(seasonalityDetector.detect(values))
                .forecast(forecast(values, regression, analyzedAt))
                .changePoints(changePointDetector.detect(series))
                .statistics(new TrendAnalysis.Statistics(
                        Statistics.mean(values),
                        Statistics.variance(values),
                        Statistics.autocorrelation(values, 1),
                        isStationary(values)))
                .build();

        LOG.debug("Trend for {}/{}: {}", series.getEntityId(), series.getMetricType(), analysis.getTrend());
        return Optional.of(analysis);
    }

    TrendAnalysis.Forecast forecast(double[] values, LinearRegression regression, Instant base) {
        double margin = CONFIDENCE_Z * Statistics.standardDeviation(values);
        List<TrendAnalysis.Prediction> predictions = new ArrayList<>(forecastHorizon);
        for (int i = 1; i <= forecastHorizon; i++) {
            double predicted = regression.predict(values.length + i - 1);
            predictions.add(new TrendAnalysis.Prediction(
                    base.plus(FORECAST_STEP.multipliedBy(i)),
                    predicted,
                    new TrendAnalysis.ConfidenceInterval(predicted - margin, predicted + margin)));
        }
        return new TrendAnalysis.Forecast(forecastHorizon, predictions, regression.getRSquared());
    }

    /**
     * Rolling-mean stationarity check: the series is stationary when the
     * variance of its rolling means is below a tenth of its own variance.
     * Series shorter than two rolling windows count as stationary; a constant
     * series does not, since {@code 0 < 0} fails.
     */
    static boolean isStationary(double[] values) {
        int window = Math.min(20, values.length / 4);
        if (window < 1 || values.length < window * 2) {
            return true;
        }
        double variance = Statistics.variance(values);
        double[] rollingMeans = new double[values.length - window + 1];
        for (int i = 0; i < rollingMeans.length; i++) {
            rollingMeans[i] = Statistics.mean(Arrays.copyOfRange(values, i, i + window));
        }
        return Statistics.variance(rollingMeans) < variance * 0.1;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
