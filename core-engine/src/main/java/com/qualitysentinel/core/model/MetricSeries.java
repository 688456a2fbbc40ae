package com.qualitysentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A time-ordered series of one metric type for one entity, as handed to the
 * outlier algorithms and the trend analyzer.
 *
 * <p>
 * {@code values[i]} is the value of {@code rawPoints.get(i)}. Both views are
 * read-only, so the same series may be shared by concurrently running
 * analyses.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String entityId;
    private final EntityType entityType;
    private final String metricType;
    private final double[] values;
    private final List<QualityMetric> rawPoints;

    private MetricSeries(String entityId, EntityType entityType, String metricType,
            List<QualityMetric> rawPoints) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.entityType = Objects.requireNonNull(entityType, "entityType must not be null");
        this.metricType = Objects.requireNonNull(metricType, "metricType must not be null");
        this.rawPoints = Collections.unmodifiableList(new ArrayList<>(rawPoints));
        this.values = new double[rawPoints.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = rawPoints.get(i).getValue();
        }
    }

    /**
     * Build a series from points already sorted by timestamp.
     *
     * @param entityId   the entity
     * @param entityType the entity type
     * @param metricType the metric type shared by all points
     * @param points     time-ordered points
     * @return the series
     */
    public static MetricSeries of(String entityId, EntityType entityType, String metricType,
            List<QualityMetric> points) {
        Objects.requireNonNull(points, "points must not be null");
        return new MetricSeries(entityId, entityType, metricType, points);
    }

    /**
     * Build a series from bare values, stamping them one second apart from
     * {@code start}. Convenient for callers holding plain numbers.
     */
    public static MetricSeries ofValues(String entityId, EntityType entityType, String metricType,
            Instant start, double... values) {
        List<QualityMetric> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(QualityMetric.builder()
                    .entityId(entityId)
                    .entityType(entityType)
                    .metricType(metricType)
                    .value(values[i])
                    .timestamp(start.plusSeconds(i))
                    .build());
        }
        return new MetricSeries(entityId, entityType, metricType, points);
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getMetricType() {
        return metricType;
    }

    /**
     * @return a copy of the values
     */
    public double[] getValues() {
        return values.clone();
    }

    /**
     * @param index position in the series
     * @return the value at {@code index}
     */
    public double valueAt(int index) {
        return values[index];
    }

    public List<QualityMetric> getRawPoints() {
        return rawPoints;
    }

    public int size() {
        return values.length;
    }

    @Override
    public String toString() {
        return "MetricSeries{entityId='" + entityId + "', metricType='" + metricType
                + "', size=" + values.length + '}';
    }
}
