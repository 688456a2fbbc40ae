package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.MetricSeries;

import java.util.List;

/**
 * Contract for batch outlier algorithms.
 * <p>
 * Implementations are <strong>stateless</strong> with respect to the engine:
 * everything they need arrives in the {@link MetricSeries}, so one instance
 * may serve concurrent runs for different entities.
 * </p>
 */
public interface OutlierAlgorithm {

    /**
     * Scan a series and flag every outlying point.
     *
     * @param series time-ordered series of one metric type
     * @return one record per flagged point, in series order; empty if none
     */
    List<AnomalyRecord> detect(MetricSeries series);

    /**
     * Return the algorithm name recorded on every anomaly it emits.
     *
     * @return e.g. {@code zscore}
     */
    String getName();
}
