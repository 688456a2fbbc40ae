/**
 * Trend, seasonality, forecast and change-point analysis.
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.trend;
