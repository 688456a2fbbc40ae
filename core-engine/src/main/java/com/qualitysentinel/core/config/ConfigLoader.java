package com.qualitysentinel.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads, validates and merges {@link DetectionConfig}.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults when none of the above exists</li>
 * </ol>
 *
 * <h3>Partial Updates</h3>
 * <p>
 * {@link #merge(DetectionConfig, Map)} deep-merges a partial map (same shape
 * as the YAML) into a <em>copy</em> of a configuration, so the original stays
 * untouched and can keep serving runs already in progress.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANOMALY_CONFIG_PATH";

    /** Classpath resource consulted when no explicit path is given. */
    public static final String DEFAULT_RESOURCE = "anomaly-detection.yml";

    private static final ObjectMapper MERGE_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .setDefaultMergeable(Boolean.TRUE);

    private ConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static DetectionConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading anomaly detection config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (ConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading anomaly detection config from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No anomaly detection config found, using defaults");
        return DetectionConfig.defaults();
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectionConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static DetectionConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Deep-merge {@code partial} into a copy of {@code base} and validate the
     * result. Nested sections merge key by key; absent keys keep the value
     * from {@code base}.
     *
     * @param base    the configuration to start from; not modified
     * @param partial nested map with the same shape as the YAML
     * @return the merged, validated copy
     * @throws IllegalArgumentException if {@code partial} contains unknown keys
     *                                  or values of the wrong type
     * @throws IllegalStateException    if the merged configuration is invalid
     */
    public static DetectionConfig merge(DetectionConfig base, Map<String, Object> partial) {
        Objects.requireNonNull(base, "base config must not be null");
        Objects.requireNonNull(partial, "partial config must not be null");

        DetectionConfig merged = copy(base);
        try {
            MERGE_MAPPER.readerForUpdating(merged).readValue((JsonNode) MERGE_MAPPER.valueToTree(partial));
        } catch (UnrecognizedPropertyException e) {
            throw new IllegalArgumentException("Unknown configuration key: " + e.getPropertyName(), e);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid configuration update: " + e.getMessage(), e);
        }
        merged.validate();
        return merged;
    }

    /**
     * @param config configuration to copy
     * @return an independent deep copy
     */
    public static DetectionConfig copy(DetectionConfig config) {
        return MERGE_MAPPER.convertValue(config, DetectionConfig.class);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static DetectionConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(DetectionConfig.class, options));
        DetectionConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse anomaly detection config: " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Anomaly detection config is empty, using defaults");
            config = DetectionConfig.defaults();
        }
        config.validate();

        if (config.getAlgorithms().getIsolationForest().isEnabled()) {
            LOG.warn("isolationForest is enabled in configuration but is not supported; it will not run");
        }
        LOG.info("Loaded anomaly detection config: {}", config);
        return config;
    }
}
