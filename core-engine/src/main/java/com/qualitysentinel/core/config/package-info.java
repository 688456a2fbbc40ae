/**
 * YAML-backed engine configuration.
 *
 * <p>
 * {@link com.qualitysentinel.core.config.ConfigLoader} resolves and parses
 * {@link com.qualitysentinel.core.config.DetectionConfig}; validation fails
 * fast with every problem listed at once.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.config;
