package com.qualitysentinel.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the anomaly detection YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown):
 * </p>
 *
 * <pre>
 * algorithms:
 *   zscore:          { enabled: true,  threshold: 3.0, windowSize: 50 }
 *   modifiedZscore:  { enabled: true,  threshold: 3.5, windowSize: 50 }
 *   iqr:             { enabled: true,  multiplier: 1.5, windowSize: 50 }
 *   isolationForest: { enabled: false, contamination: 0.1, numEstimators: 100, maxSamples: 256 }
 * trendAnalysis:
 *   enabled: true
 *   windowSize: 100
 *   seasonalPeriod: 24
 *   changePointSensitivity: 0.05
 *   forecastHorizon: 10
 * dataProcessing:
 *   minDataPoints: 20
 *   maxHistorySize: 10000
 *   cleanupInterval: 3600000
 *   batchSize: 100
 * performance:
 *   enableCaching: true
 *   cacheSize: 1000
 *   enableParallelProcessing: true
 *   maxConcurrentAnalysis: 5
 * thresholds:
 *   anomalyScore: 0.7
 *   trendSignificance: 0.05
 *   changePointThreshold: 0.8
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading or merging.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private Algorithms algorithms = new Algorithms();
    private TrendAnalysisConfig trendAnalysis = new TrendAnalysisConfig();
    private DataProcessingConfig dataProcessing = new DataProcessingConfig();
    private PerformanceConfig performance = new PerformanceConfig();
    private ThresholdsConfig thresholds = new ThresholdsConfig();

    /**
     * @return configuration with every default applied
     */
    public static DetectionConfig defaults() {
        return new DetectionConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception listing them.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        algorithms.collectErrors(errors);
        trendAnalysis.collectErrors(errors);
        dataProcessing.collectErrors(errors);
        performance.collectErrors(errors);
        thresholds.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Detection configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Names of the outlier algorithms that are switched on and actually run,
     * in execution order. Isolation Forest is never listed.
     *
     * @return algorithm names, e.g. {@code [zscore, modified_zscore, iqr]}
     */
    @JsonIgnore
    public List<String> getEnabledAlgorithmNames() {
        List<String> names = new ArrayList<>();
        if (algorithms.getZscore().isEnabled()) {
            names.add("zscore");
        }
        if (algorithms.getModifiedZscore().isEnabled()) {
            names.add("modified_zscore");
        }
        if (algorithms.getIqr().isEnabled()) {
            names.add("iqr");
        }
        return names;
    }

    public Algorithms getAlgorithms() {
        return algorithms;
    }

    public void setAlgorithms(Algorithms algorithms) {
        this.algorithms = algorithms != null ? algorithms : new Algorithms();
    }

    public TrendAnalysisConfig getTrendAnalysis() {
        return trendAnalysis;
    }

    public void setTrendAnalysis(TrendAnalysisConfig trendAnalysis) {
        this.trendAnalysis = trendAnalysis != null ? trendAnalysis : new TrendAnalysisConfig();
    }

    public DataProcessingConfig getDataProcessing() {
        return dataProcessing;
    }

    public void setDataProcessing(DataProcessingConfig dataProcessing) {
        this.dataProcessing = dataProcessing != null ? dataProcessing : new DataProcessingConfig();
    }

    public PerformanceConfig getPerformance() {
        return performance;
    }

    public void setPerformance(PerformanceConfig performance) {
        this.performance = performance != null ? performance : new PerformanceConfig();
    }

    public ThresholdsConfig getThresholds() {
        return thresholds;
    }

    public void setThresholds(ThresholdsConfig thresholds) {
        this.thresholds = thresholds != null ? thresholds : new ThresholdsConfig();
    }

    @Override
    public String toString() {
        return "DetectionConfig{algorithms=" + getEnabledAlgorithmNames()
                + ", trendAnalysis=" + trendAnalysis.isEnabled()
                + ", minDataPoints=" + dataProcessing.getMinDataPoints()
                + ", caching=" + performance.isEnableCaching() + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    public static class Algorithms implements Serializable {

        private static final long serialVersionUID = 1L;

        private ZScoreConfig zscore = new ZScoreConfig();
        private ModifiedZScoreConfig modifiedZscore = new ModifiedZScoreConfig();
        private IqrConfig iqr = new IqrConfig();
        private IsolationForestConfig isolationForest = new IsolationForestConfig();

        void collectErrors(List<String> errors) {
            zscore.collectErrors("zscore", errors);
            modifiedZscore.collectErrors("modifiedZscore", errors);
            iqr.collectErrors(errors);
            isolationForest.collectErrors(errors);
        }

        public ZScoreConfig getZscore() {
            return zscore;
        }

        public void setZscore(ZScoreConfig zscore) {
            this.zscore = zscore != null ? zscore : new ZScoreConfig();
        }

        public ModifiedZScoreConfig getModifiedZscore() {
            return modifiedZscore;
        }

        public void setModifiedZscore(ModifiedZScoreConfig modifiedZscore) {
            this.modifiedZscore = modifiedZscore != null ? modifiedZscore : new ModifiedZScoreConfig();
        }

        public IqrConfig getIqr() {
            return iqr;
        }

        public void setIqr(IqrConfig iqr) {
            this.iqr = iqr != null ? iqr : new IqrConfig();
        }

        public IsolationForestConfig getIsolationForest() {
            return isolationForest;
        }

        public void setIsolationForest(IsolationForestConfig isolationForest) {
            this.isolationForest = isolationForest != null ? isolationForest : new IsolationForestConfig();
        }
    }

    /** Z-score: flag when {@code |x - mean| / stddev > threshold}. */
    public static class ZScoreConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private double threshold = 3.0;
        private int windowSize = 50;

        void collectErrors(String section, List<String> errors) {
            if (threshold <= 0) {
                errors.add(section + ".threshold must be > 0, got: " + threshold);
            }
            if (windowSize < 2) {
                errors.add(section + ".windowSize must be >= 2, got: " + windowSize);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    /** Modified Z-score; same knobs as {@link ZScoreConfig}, threshold 3.5. */
    public static class ModifiedZScoreConfig extends ZScoreConfig {

        private static final long serialVersionUID = 1L;

        public ModifiedZScoreConfig() {
            setThreshold(3.5);
        }
    }

    public static class IqrConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private double multiplier = 1.5;
        private int windowSize = 50;

        void collectErrors(List<String> errors) {
            if (multiplier <= 0) {
                errors.add("iqr.multiplier must be > 0, got: " + multiplier);
            }
            if (windowSize < 4) {
                errors.add("iqr.windowSize must be >= 4, got: " + windowSize);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }
    }

    /**
     * Accepted for compatibility only. Turning it on logs a warning; no
     * isolation forest is ever built.
     */
    public static class IsolationForestConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled;
        private double contamination = 0.1;
        private int numEstimators = 100;
        private int maxSamples = 256;

        void collectErrors(List<String> errors) {
            if (contamination <= 0 || contamination > 0.5) {
                errors.add("isolationForest.contamination must be in (0, 0.5], got: " + contamination);
            }
            if (numEstimators < 1) {
                errors.add("isolationForest.numEstimators must be >= 1, got: " + numEstimators);
            }
            if (maxSamples < 2) {
                errors.add("isolationForest.maxSamples must be >= 2, got: " + maxSamples);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getContamination() {
            return contamination;
        }

        public void setContamination(double contamination) {
            this.contamination = contamination;
        }

        public int getNumEstimators() {
            return numEstimators;
        }

        public void setNumEstimators(int numEstimators) {
            this.numEstimators = numEstimators;
        }

        public int getMaxSamples() {
            return maxSamples;
        }

        public void setMaxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
        }
    }

    public static class TrendAnalysisConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private int windowSize = 100;
        private int seasonalPeriod = 24;
        private double changePointSensitivity = 0.05;
        private int forecastHorizon = 10;

        void collectErrors(List<String> errors) {
            if (windowSize < 10) {
                errors.add("trendAnalysis.windowSize must be >= 10, got: " + windowSize);
            }
            if (seasonalPeriod < 1) {
                errors.add("trendAnalysis.seasonalPeriod must be >= 1, got: " + seasonalPeriod);
            }
            if (changePointSensitivity <= 0) {
                errors.add("trendAnalysis.changePointSensitivity must be > 0, got: "
                        + changePointSensitivity);
            }
            if (forecastHorizon < 0) {
                errors.add("trendAnalysis.forecastHorizon must be >= 0, got: " + forecastHorizon);
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getSeasonalPeriod() {
            return seasonalPeriod;
        }

        public void setSeasonalPeriod(int seasonalPeriod) {
            this.seasonalPeriod = seasonalPeriod;
        }

        public double getChangePointSensitivity() {
            return changePointSensitivity;
        }

        public void setChangePointSensitivity(double changePointSensitivity) {
            this.changePointSensitivity = changePointSensitivity;
        }

        public int getForecastHorizon() {
            return forecastHorizon;
        }

        public void setForecastHorizon(int forecastHorizon) {
            this.forecastHorizon = forecastHorizon;
        }
    }

    public static class DataProcessingConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private int minDataPoints = 20;
        private int maxHistorySize = 10_000;
        /** Milliseconds between retention sweeps. */
        private long cleanupInterval = 3_600_000L;
        private int batchSize = 100;

        void collectErrors(List<String> errors) {
            if (minDataPoints < 2) {
                errors.add("dataProcessing.minDataPoints must be >= 2, got: " + minDataPoints);
            }
            if (maxHistorySize < minDataPoints) {
                errors.add("dataProcessing.maxHistorySize must be >= minDataPoints, got: "
                        + maxHistorySize);
            }
            if (cleanupInterval <= 0) {
                errors.add("dataProcessing.cleanupInterval must be > 0, got: " + cleanupInterval);
            }
            if (batchSize < 1) {
                errors.add("dataProcessing.batchSize must be >= 1, got: " + batchSize);
            }
        }

        public int getMinDataPoints() {
            return minDataPoints;
        }

        public void setMinDataPoints(int minDataPoints) {
            this.minDataPoints = minDataPoints;
        }

        public int getMaxHistorySize() {
            return maxHistorySize;
        }

        public void setMaxHistorySize(int maxHistorySize) {
            this.maxHistorySize = maxHistorySize;
        }

        public long getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(long cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class PerformanceConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enableCaching = true;
        private int cacheSize = 1000;
        private boolean enableParallelProcessing = true;
        private int maxConcurrentAnalysis = 5;

        void collectErrors(List<String> errors) {
            if (cacheSize < 1) {
                errors.add("performance.cacheSize must be >= 1, got: " + cacheSize);
            }
            if (maxConcurrentAnalysis < 1) {
                errors.add("performance.maxConcurrentAnalysis must be >= 1, got: " + maxConcurrentAnalysis);
            }
        }

        public boolean isEnableCaching() {
            return enableCaching;
        }

        public void setEnableCaching(boolean enableCaching) {
            this.enableCaching = enableCaching;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }

        public boolean isEnableParallelProcessing() {
            return enableParallelProcessing;
        }

        public void setEnableParallelProcessing(boolean enableParallelProcessing) {
            this.enableParallelProcessing = enableParallelProcessing;
        }

        public int getMaxConcurrentAnalysis() {
            return maxConcurrentAnalysis;
        }

        public void setMaxConcurrentAnalysis(int maxConcurrentAnalysis) {
            this.maxConcurrentAnalysis = maxConcurrentAnalysis;
        }
    }

    /**
     * Reporting thresholds. They are carried for downstream consumers; the
     * detectors themselves use the per-algorithm thresholds.
     */
    public static class ThresholdsConfig implements Serializable {

        private static final long serialVersionUID = 1L;

        private double anomalyScore = 0.7;
        private double trendSignificance = 0.05;
        private double changePointThreshold = 0.8;

        void collectErrors(List<String> errors) {
            if (anomalyScore < 0 || anomalyScore > 1) {
                errors.add("thresholds.anomalyScore must be in [0, 1], got: " + anomalyScore);
            }
            if (trendSignificance < 0 || trendSignificance > 1) {
                errors.add("thresholds.trendSignificance must be in [0, 1], got: " + trendSignificance);
            }
            if (changePointThreshold < 0 || changePointThreshold > 1) {
                errors.add("thresholds.changePointThreshold must be in [0, 1], got: " + changePointThreshold);
            }
        }

        public double getAnomalyScore() {
            return anomalyScore;
        }

        public void setAnomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
        }

        public double getTrendSignificance() {
            return trendSignificance;
        }

        public void setTrendSignificance(double trendSignificance) {
            this.trendSignificance = trendSignificance;
        }

        public double getChangePointThreshold() {
            return changePointThreshold;
        }

        public void setChangePointThreshold(double changePointThreshold) {
            this.changePointThreshold = changePointThreshold;
        }
    }
}
