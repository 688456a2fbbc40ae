package com.qualitysentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AnomalySeverity} and {@link TrendDirection}
 * classification.
 */
class AnomalySeverityTest {

    @ParameterizedTest(name = "normalized score {0} -> {1}")
    @CsvSource({
            "25.0,   CRITICAL",
            "2.0,    CRITICAL",
            "1.9999, HIGH",
            "1.5,    HIGH",
            "1.4999, MEDIUM",
            "1.0,    MEDIUM",
            "0.9999, LOW",
            "0.5,    LOW",
            "0.4999, INFO",
            "0.0,    INFO"
    })
    @DisplayName("Severity bands should start at 2.0, 1.5, 1.0 and 0.5")
    void shouldMapNormalizedScoreToSeverity(double score, AnomalySeverity expected) {
        assertThat(AnomalySeverity.fromNormalizedScore(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Severity ordering should run from critical down to info")
    void shouldOrderSeverities() {
        assertThat(AnomalySeverity.CRITICAL.isAtLeast(AnomalySeverity.HIGH)).isTrue();
        assertThat(AnomalySeverity.LOW.isAtLeast(AnomalySeverity.LOW)).isTrue();
        assertThat(AnomalySeverity.INFO.isAtLeast(AnomalySeverity.MEDIUM)).isFalse();
    }

    @Test
    @DisplayName("Wire values should be lowercase and parse case-insensitively")
    void shouldRoundTripWireValues() {
        assertThat(AnomalySeverity.HIGH.getValue()).isEqualTo("high");
        assertThat(AnomalySeverity.fromValue("Critical")).isEqualTo(AnomalySeverity.CRITICAL);
        assertThatThrownBy(() -> AnomalySeverity.fromValue("severe"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown severity");
    }

    @ParameterizedTest(name = "slope {0} -> {1}")
    @CsvSource({
            "0.0,     STABLE",
            "0.0009,  STABLE",
            "-0.0009, STABLE",
            "0.05,    INCREASING",
            "-0.05,   DECREASING",
            "0.1,     INCREASING",
            "0.2,     VOLATILE",
            "-2.0,    VOLATILE"
    })
    @DisplayName("Trend direction should follow the slope bands")
    void shouldClassifySlope(double slope, TrendDirection expected) {
        assertThat(TrendDirection.fromSlope(slope)).isEqualTo(expected);
    }
}
