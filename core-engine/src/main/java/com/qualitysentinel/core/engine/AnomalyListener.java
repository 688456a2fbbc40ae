package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.AnomalyRecord;

/**
 * Receives one callback per detected anomaly.
 *
 * <p>
 * Callbacks run on a dedicated delivery thread per listener, never on the
 * detection thread. A slow listener only delays its own queue.
 * </p>
 */
@FunctionalInterface
public interface AnomalyListener {

    void onAnomaly(AnomalyRecord anomaly);
}
