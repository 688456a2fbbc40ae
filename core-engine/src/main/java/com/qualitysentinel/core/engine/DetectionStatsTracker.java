package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.DetectionStatistics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Running counters behind {@code getDetectionStatistics()}.
 *
 * <p>
 * The accuracy figure is a self-reported heuristic: each run assumes 90 % of
 * its anomalies are genuine. It is not measured against ground truth.
 * </p>
 */
class DetectionStatsTracker {

    static final double ASSUMED_PRECISION = 0.9;
    static final int PROCESSING_TIME_SAMPLES = 100;

    private final Deque<Long> processingTimes = new ArrayDeque<>();
    private long totalDetections;
    private long accurateDetections;

    /**
     * Accuracy reported for a run that produced {@code anomalyCount} anomalies.
     */
    synchronized double accuracyFor(int anomalyCount) {
        long total = totalDetections + anomalyCount;
        long accurate = accurateDetections + (long) Math.floor(anomalyCount * ASSUMED_PRECISION);
        return total > 0 ? (double) accurate / total : ASSUMED_PRECISION;
    }

    synchronized void record(long processingTimeMs, double accuracy) {
        totalDetections++;
        accurateDetections += (long) Math.floor(accuracy);
        processingTimes.addLast(processingTimeMs);
        if (processingTimes.size() > PROCESSING_TIME_SAMPLES) {
            processingTimes.removeFirst();
        }
    }

    synchronized DetectionStatistics snapshot(List<String> algorithmsEnabled) {
        double accuracy = totalDetections > 0
                ? (double) accurateDetections / totalDetections
                : ASSUMED_PRECISION;
        double averageMs = processingTimes.stream().mapToLong(Long::longValue).average().orElse(0.0);
        return new DetectionStatistics(totalDetections, accuracy, averageMs, algorithmsEnabled);
    }
}
