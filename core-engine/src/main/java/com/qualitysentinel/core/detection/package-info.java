/**
 * Outlier detection algorithms.
 *
 * <p>
 * All batch algorithms implement
 * {@link com.qualitysentinel.core.detection.OutlierAlgorithm} and are
 * instantiated via {@link com.qualitysentinel.core.detection.AlgorithmFactory}.
 * Built-in algorithms:
 * </p>
 * <ul>
 * <li>{@link com.qualitysentinel.core.detection.ZScoreAlgorithm}: mean ± N × σ
 * over a trailing window</li>
 * <li>{@link com.qualitysentinel.core.detection.ModifiedZScoreAlgorithm}:
 * median and MAD based robust score</li>
 * <li>{@link com.qualitysentinel.core.detection.IqrAlgorithm}: Tukey fences</li>
 * </ul>
 * <p>
 * {@link com.qualitysentinel.core.detection.RealtimeZScoreDetector} checks a
 * single new observation without scanning the series.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an algorithm, extend {@code WindowedOutlierAlgorithm} (or implement
 * {@code OutlierAlgorithm} directly) and register its name in
 * {@code AlgorithmFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.detection;
