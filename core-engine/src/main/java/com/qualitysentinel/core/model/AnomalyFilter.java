package com.qualitysentinel.core.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Query filter for persisted anomalies. Every criterion is optional; results
 * are always returned newest first, capped at {@link #getLimit()}.
 *
 * @since 1.0.0
 */
public final class AnomalyFilter {

    /** Result cap applied when none is given. */
    public static final int DEFAULT_LIMIT = 100;

    private final String entityId;
    private final AnomalySeverity severity;
    private final Instant from;
    private final Instant to;
    private final int limit;

    private AnomalyFilter(Builder b) {
        if (b.limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got: " + b.limit);
        }
        if (b.from != null && b.to != null && b.from.isAfter(b.to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        this.entityId = b.entityId;
        this.severity = b.severity;
        this.from = b.from;
        this.to = b.to;
        this.limit = b.limit;
    }

    /**
     * @return a filter matching everything, capped at {@link #DEFAULT_LIMIT}
     */
    public static AnomalyFilter all() {
        return builder().build();
    }

    public static AnomalyFilter forEntity(String entityId) {
        return builder().entityId(entityId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityId;
        private AnomalySeverity severity;
        private Instant from;
        private Instant to;
        private int limit = DEFAULT_LIMIT;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        /**
         * @param from inclusive lower bound on {@code detectedAt}
         * @return this builder
         */
        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        /**
         * @param to inclusive upper bound on {@code detectedAt}
         * @return this builder
         */
        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public AnomalyFilter build() {
            return new AnomalyFilter(this);
        }
    }

    /**
     * @param anomaly candidate record
     * @return {@code true} if every present criterion matches
     */
    public boolean matches(AnomalyRecord anomaly) {
        if (entityId != null && !entityId.equals(anomaly.getEntityId())) {
            return false;
        }
        if (severity != null && severity != anomaly.getSeverity()) {
            return false;
        }
        if (from != null && anomaly.getDetectedAt().isBefore(from)) {
            return false;
        }
        return to == null || !anomaly.getDetectedAt().isAfter(to);
    }

    public Optional<String> getEntityId() {
        return Optional.ofNullable(entityId);
    }

    public Optional<AnomalySeverity> getSeverity() {
        return Optional.ofNullable(severity);
    }

    public Optional<Instant> getFrom() {
        return Optional.ofNullable(from);
    }

    public Optional<Instant> getTo() {
        return Optional.ofNullable(to);
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "AnomalyFilter{entityId=" + entityId + ", severity=" + severity
                + ", from=" + from + ", to=" + to + ", limit=" + limit + '}';
    }
}
