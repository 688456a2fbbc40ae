package com.qualitysentinel.core.detection;

import com.qualitysentinel.core.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link OutlierAlgorithm} instances from
 * {@link DetectionConfig}.
 *
 * <p>
 * This is the single point of extension when adding new algorithms:
 * register the name here and create the corresponding implementation.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlgorithmFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmFactory.class);

    private AlgorithmFactory() {
        // utility class, not instantiable
    }

    /**
     * Create the algorithm registered under {@code name}, configured from
     * {@code config} regardless of its enabled flag.
     *
     * @param name   algorithm name; must not be {@code null}
     * @param config engine configuration; must not be {@code null}
     * @return the algorithm
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OutlierAlgorithm create(String name, DetectionConfig config) {
        Objects.requireNonNull(name, "Algorithm name must not be null");
        Objects.requireNonNull(config, "DetectionConfig must not be null");

        DetectionConfig.Algorithms algorithms = config.getAlgorithms();
        return switch (name.toLowerCase(Locale.ROOT)) {
            case ZScoreAlgorithm.NAME -> new ZScoreAlgorithm(algorithms.getZscore());
            case ModifiedZScoreAlgorithm.NAME -> new ModifiedZScoreAlgorithm(algorithms.getModifiedZscore());
            case IqrAlgorithm.NAME -> new IqrAlgorithm(algorithms.getIqr());
            default -> throw new IllegalArgumentException(
                    "Unknown algorithm: '" + name
                            + "'. Supported algorithms: zscore, modified_zscore, iqr");
        };
    }

    /**
     * Create every enabled algorithm, in execution order.
     *
     * <p>
     * The returned list is <strong>unmodifiable</strong>. An enabled
     * isolation forest is reported and skipped.
     * </p>
     *
     * @param config engine configuration; must not be {@code null}
     * @return unmodifiable list of algorithms
     */
    public static List<OutlierAlgorithm> createEnabled(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        if (config.getAlgorithms().getIsolationForest().isEnabled()) {
            LOG.warn("Isolation forest is enabled but not supported; skipping it");
        }
        List<String> names = config.getEnabledAlgorithmNames();
        LOG.info("Creating {} outlier algorithm(s): {}", names.size(), names);
        List<OutlierAlgorithm> created = names.stream()
                .map(name -> create(name, config))
                .toList();
        return Collections.unmodifiableList(created);
    }

    /**
     * @param config engine configuration
     * @return the real-time detector, sharing the Z-score threshold and window
     */
    public static RealtimeZScoreDetector createRealtime(DetectionConfig config) {
        Objects.requireNonNull(config, "DetectionConfig must not be null");
        return new RealtimeZScoreDetector(config.getAlgorithms().getZscore());
    }
}
