package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.detection.AlgorithmFactory;
import com.qualitysentinel.core.detection.OutlierAlgorithm;
import com.qualitysentinel.core.detection.RealtimeZScoreDetector;
import com.qualitysentinel.core.trend.TrendAnalyzer;

import java.time.Clock;
import java.util.List;

/**
 * Immutable snapshot of a configuration together with the detectors built
 * from it. A run captures one snapshot up front, so a concurrent
 * configuration update never changes the detectors mid-run.
 */
final class DetectionPipeline {

    private final DetectionConfig config;
    private final List<OutlierAlgorithm> algorithms;
    private final TrendAnalyzer trendAnalyzer;
    private final RealtimeZScoreDetector realtimeDetector;

    private DetectionPipeline(DetectionConfig config, List<OutlierAlgorithm> algorithms,
            TrendAnalyzer trendAnalyzer, RealtimeZScoreDetector realtimeDetector) {
        this.config = config;
        this.algorithms = List.copyOf(algorithms);
        this.trendAnalyzer = trendAnalyzer;
        this.realtimeDetector = realtimeDetector;
    }

    static DetectionPipeline from(DetectionConfig config, Clock clock) {
        config.validate();
        return new DetectionPipeline(config,
                AlgorithmFactory.createEnabled(config),
                new TrendAnalyzer(config.getTrendAnalysis(), clock),
                AlgorithmFactory.createRealtime(config));
    }

    DetectionPipeline withAlgorithms(List<OutlierAlgorithm> replacement) {
        return new DetectionPipeline(config, replacement, trendAnalyzer, realtimeDetector);
    }

    DetectionConfig config() {
        return config;
    }

    List<OutlierAlgorithm> algorithms() {
        return algorithms;
    }

    boolean trendAnalysisEnabled() {
        return config.getTrendAnalysis().isEnabled();
    }

    TrendAnalyzer trendAnalyzer() {
        return trendAnalyzer;
    }

    RealtimeZScoreDetector realtimeDetector() {
        return realtimeDetector;
    }

    int minDataPoints() {
        return config.getDataProcessing().getMinDataPoints();
    }

    boolean cachingEnabled() {
        return config.getPerformance().isEnableCaching();
    }
}
