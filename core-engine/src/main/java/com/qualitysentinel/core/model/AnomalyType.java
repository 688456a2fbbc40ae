package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a detected anomaly. The statistical algorithms only emit
 * {@link #STATISTICAL_OUTLIER}; the remaining values are part of the
 * persisted vocabulary.
 */
public enum AnomalyType {

    STATISTICAL_OUTLIER,
    TREND_ANOMALY,
    SEASONAL_ANOMALY,
    CHANGE_POINT,
    PATTERN_DEVIATION,
    QUALITY_DEGRADATION,
    PERFORMANCE_ANOMALY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalyType fromValue(String value) {
        for (AnomalyType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + value + "'");
    }
}
