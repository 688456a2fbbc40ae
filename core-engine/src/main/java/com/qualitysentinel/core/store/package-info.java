/**
 * Persistence boundary of the engine.
 *
 * <p>
 * {@link com.qualitysentinel.core.store.MetricsStore} is the contract;
 * {@link com.qualitysentinel.core.store.InMemoryMetricsStore} is the
 * embedded implementation. A relational adapter lives in the
 * {@code metrics-store} module.
 * </p>
 *
 * @since 1.0.0
 */
package com.qualitysentinel.core.store;
