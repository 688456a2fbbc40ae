/**
 * Domain model of the quality anomaly engine.
 *
 * <p>
 * Inputs produced upstream:
 * </p>
 * <ul>
 * <li>{@link com.qualitysentinel.core.model.QualityMetric} (one scalar
 * observation)</li>
 * <li>{@link com.qualitysentinel.core.model.QualitySnapshot} (a real-time
 * observation with per-dimension sub-scores)</li>
 * </ul>
 * <p>
 * Outputs of the engine:
 * </p>
 * <ul>
 * <li>{@link com.qualitysentinel.core.model.AnomalyRecord}</li>
 * <li>{@link com.qualitysentinel.core.model.TrendAnalysis}</li>
 * <li>{@link com.qualitysentinel.core.model.DetectionResult} and its persisted
 * {@link com.qualitysentinel.core.model.DetectionSummary}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.model;
