package com.qualitysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an anomaly, declared from most to least severe.
 *
 * <p>
 * Severity is a pure function of the <em>normalized score</em>: the ratio of
 * the test statistic to its threshold, taken before it is clamped to
 * {@code [0, 1]}.
 * </p>
 *
 * <table>
 * <caption>Severity bands</caption>
 * <tr><th>normalized score</th><th>severity</th></tr>
 * <tr><td>&ge; 2.0</td><td>{@link #CRITICAL}</td></tr>
 * <tr><td>&ge; 1.5</td><td>{@link #HIGH}</td></tr>
 * <tr><td>&ge; 1.0</td><td>{@link #MEDIUM}</td></tr>
 * <tr><td>&ge; 0.5</td><td>{@link #LOW}</td></tr>
 * <tr><td>otherwise</td><td>{@link #INFO}</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Map a normalized (pre-clamp) score to a severity.
     *
     * @param normalizedScore statistic divided by its threshold
     * @return the severity band
     */
    public static AnomalySeverity fromNormalizedScore(double normalizedScore) {
        if (normalizedScore >= 2.0) {
            return CRITICAL;
        }
        if (normalizedScore >= 1.5) {
            return HIGH;
        }
        if (normalizedScore >= 1.0) {
            return MEDIUM;
        }
        if (normalizedScore >= 0.5) {
            return LOW;
        }
        return INFO;
    }

    /**
     * @param other severity to compare with
     * @return {@code true} if this severity is at least as severe as {@code other}
     */
    public boolean isAtLeast(AnomalySeverity other) {
        return ordinal() <= other.ordinal();
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalySeverity fromValue(String value) {
        for (AnomalySeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + value + "'");
    }
}
