package com.qualitysentinel.core.model;

import java.util.List;

/**
 * Rolling, self-reported engine statistics.
 *
 * <p>
 * {@code accuracy} is a heuristic that assumes roughly nine in ten analysed
 * points are classified correctly. No ground truth exists upstream, so it
 * must not be read as a measured precision or recall.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionStatistics {

    private final long totalDetections;
    private final double accuracy;
    private final double averageProcessingTimeMs;
    private final List<String> algorithmsEnabled;

    public DetectionStatistics(long totalDetections, double accuracy, double averageProcessingTimeMs,
            List<String> algorithmsEnabled) {
        this.totalDetections = totalDetections;
        this.accuracy = accuracy;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
        this.algorithmsEnabled = List.copyOf(algorithmsEnabled);
    }

    public long getTotalDetections() {
        return totalDetections;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getAverageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    public List<String> getAlgorithmsEnabled() {
        return algorithmsEnabled;
    }

    @Override
    public String toString() {
        return "DetectionStatistics{total=" + totalDetections + ", accuracy=" + accuracy
                + ", avgTimeMs=" + averageProcessingTimeMs + ", algorithms=" + algorithmsEnabled + '}';
    }
}
