/**
 * Detection orchestrator and its runtime collaborators.
 *
 * <p>
 * {@link com.qualitysentinel.core.engine.QualityAnomalyDetector} is the
 * public entry point. The remaining classes support it: a FIFO
 * {@link com.qualitysentinel.core.engine.BoundedCache}, asynchronous listener
 * delivery via {@link com.qualitysentinel.core.engine.AnomalyNotifier} and
 * periodic purging via {@link com.qualitysentinel.core.engine.RetentionCleaner}.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.engine;
