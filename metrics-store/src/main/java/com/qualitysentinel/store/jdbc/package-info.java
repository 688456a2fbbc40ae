/**
 * Relational {@link com.qualitysentinel.core.store.MetricsStore} on Spring JDBC.
 */
package com.qualitysentinel.store.jdbc;
