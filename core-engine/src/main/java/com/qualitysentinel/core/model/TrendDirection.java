package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of a linear trend, classified from the raw per-index slope.
 */
public enum TrendDirection {

    STABLE,
    INCREASING,
    DECREASING,
    VOLATILE;

    /** Slopes with a smaller magnitude are {@link #STABLE}. */
    public static final double STABLE_SLOPE = 0.001;

    /** Slopes with a larger magnitude are {@link #VOLATILE}. */
    public static final double VOLATILE_SLOPE = 0.1;

    /**
     * @param slope OLS slope over the index sequence
     * @return the direction band for {@code slope}
     */
    public static TrendDirection fromSlope(double slope) {
        double magnitude = Math.abs(slope);
        if (magnitude < STABLE_SLOPE) {
            return STABLE;
        }
        if (magnitude > VOLATILE_SLOPE) {
            return VOLATILE;
        }
        return slope > 0 ? INCREASING : DECREASING;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TrendDirection fromValue(String value) {
        for (TrendDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown trend direction: '" + value + "'");
    }
}
