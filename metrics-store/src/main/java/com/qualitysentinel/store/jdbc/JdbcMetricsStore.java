package com.qualitysentinel.store.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.AnomalySeverity;
import com.qualitysentinel.core.model.AnomalyType;
import com.qualitysentinel.core.model.DetectionSummary;
import com.qualitysentinel.core.model.EntityType;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.stats.StatisticalSummary;
import com.qualitysentinel.core.store.MetricsStore;
import com.qualitysentinel.core.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link MetricsStore} backed by a relational database through Spring's
 * {@link NamedParameterJdbcTemplate}.
 *
 * <h3>Layout</h3>
 * <p>
 * One table per record kind (see {@code quality-sentinel-schema.sql}). Nested
 * parts such as an anomaly's context or a trend's forecast are stored as JSON
 * text written with Jackson. Every instant is stored twice: as ISO-8601 text
 * for an exact round trip and as epoch nanoseconds for ordering and range
 * filters.
 * </p>
 *
 * <h3>Errors</h3>
 * <p>
 * Every {@link DataAccessException} surfaces as a
 * {@link StoreUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class JdbcMetricsStore implements MetricsStore {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcMetricsStore.class);

    public static final String SCHEMA_RESOURCE = "quality-sentinel-schema.sql";

    private static final TypeReference<List<QualityMetric>> METRIC_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<TrendAnalysis.ChangePoint>> CHANGE_POINT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Set<String>> STRING_SET = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcMetricsStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcMetricsStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Create the tables and indexes if they do not exist yet.
     */
    public void initializeSchema() {
        execute("initialize schema", () -> {
            new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)).execute(dataSource);
            return null;
        });
        LOG.info("Metrics store schema initialized from {}", SCHEMA_RESOURCE);
    }

    // ---------------------------------------------------------------
    // Raw metrics
    // ---------------------------------------------------------------

    @Override
    public List<QualityMetric> query(String entityId, String dimension, int limit) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entityId", entityId)
                .addValue("limit", limit);
        String dimensionClause = "";
        if (dimension != null) {
            dimensionClause = "AND metric_type IN (:dimension, :dimensionMetricType)";
            params.addValue("dimension", dimension)
                    .addValue("dimensionMetricType", QualityMetric.dimensionMetricType(dimension));
        }
        String sql = """
                SELECT id, entity_id, entity_type, metric_type, metric_value, unit,
                       recorded_at, source, tags
                FROM quality_metrics
                WHERE entity_id = :entityId
                  %s
                ORDER BY recorded_at_ns DESC
                LIMIT :limit
                """.formatted(dimensionClause);
        return execute("query metrics", () -> jdbcTemplate.query(sql, params, this::mapMetric));
    }

    @Override
    public void insertMetrics(List<QualityMetric> metrics) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        if (metrics.isEmpty()) {
            return;
        }
        long createdAt = epochNanos(clock.instant());
        SqlParameterSource[] batch = metrics.stream()
                .map(m -> new MapSqlParameterSource()
                        .addValue("id", m.getId())
                        .addValue("entityId", m.getEntityId())
                        .addValue("entityType", m.getEntityType().getValue())
                        .addValue("metricType", m.getMetricType())
                        .addValue("value", m.getValue())
                        .addValue("unit", m.getUnit())
                        .addValue("recordedAt", m.getTimestamp().toString())
                        .addValue("recordedAtNs", epochNanos(m.getTimestamp()))
                        .addValue("source", m.getSource())
                        .addValue("tags", toJson(m.getTags()))
                        .addValue("createdAt", createdAt))
                .toArray(SqlParameterSource[]::new);
        execute("insert metrics", () -> jdbcTemplate.batchUpdate("""
                INSERT INTO quality_metrics (id, entity_id, entity_type, metric_type, metric_value, unit,
                                             recorded_at, recorded_at_ns, source, tags, created_at_ns)
                VALUES (:id, :entityId, :entityType, :metricType, :value, :unit,
                        :recordedAt, :recordedAtNs, :source, :tags, :createdAt)
                """, batch));
        LOG.debug("Inserted {} metric(s)", metrics.size());
    }

    // ---------------------------------------------------------------
    // Anomalies
    // ---------------------------------------------------------------

    @Override
    public void insertAnomaly(AnomalyRecord anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", anomaly.getId())
                .addValue("type", anomaly.getType().getValue())
                .addValue("severity", anomaly.getSeverity().getValue())
                .addValue("entityId", anomaly.getEntityId())
                .addValue("entityType", anomaly.getEntityType().getValue())
                .addValue("detectedAt", anomaly.getDetectedAt().toString())
                .addValue("detectedAtNs", epochNanos(anomaly.getDetectedAt()))
                .addValue("algorithm", anomaly.getAlgorithm())
                .addValue("score", anomaly.getScore())
                .addValue("confidence", anomaly.getConfidence())
                .addValue("description", anomaly.getDescription())
                .addValue("context", toJson(anomaly.getContext()))
                .addValue("metadata", toJson(anomaly.getMetadata()))
                .addValue("relatedMetrics", toJson(anomaly.getRelatedMetrics()))
                .addValue("createdAt", epochNanos(clock.instant()));
        execute("insert anomaly", () -> jdbcTemplate.update("""
                INSERT INTO quality_anomalies (id, type, severity, entity_id, entity_type, detected_at,
                                               detected_at_ns, algorithm, score, confidence, description,
                                               context, metadata, related_metrics, created_at_ns)
                VALUES (:id, :type, :severity, :entityId, :entityType, :detectedAt,
                        :detectedAtNs, :algorithm, :score, :confidence, :description,
                        :context, :metadata, :relatedMetrics, :createdAt)
                """, params));
    }

    @Override
    public List<AnomalyRecord> queryAnomalies(AnomalyFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        StringBuilder where = new StringBuilder("WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", filter.getLimit());
        filter.getEntityId().ifPresent(id -> {
            where.append(" AND entity_id = :entityId");
            params.addValue("entityId", id);
        });
        filter.getSeverity().ifPresent(severity -> {
            where.append(" AND severity = :severity");
            params.addValue("severity", severity.getValue());
        });
        filter.getFrom().ifPresent(from -> {
            where.append(" AND detected_at_ns >= :from");
            params.addValue("from", epochNanos(from));
        });
        filter.getTo().ifPresent(to -> {
            where.append(" AND detected_at_ns <= :to");
            params.addValue("to", epochNanos(to));
        });
        String sql = """
                SELECT id, type, severity, entity_id, entity_type, detected_at, algorithm, score,
                       confidence, description, context, metadata, related_metrics
                FROM quality_anomalies
                %s
                ORDER BY detected_at_ns DESC
                LIMIT :limit
                """.formatted(where);
        return execute("query anomalies", () -> jdbcTemplate.query(sql, params, this::mapAnomaly));
    }

    // ---------------------------------------------------------------
    // Trends
    // ---------------------------------------------------------------

    @Override
    public void insertTrend(TrendAnalysis trend) {
        Objects.requireNonNull(trend, "trend must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", trend.getId())
                .addValue("entityId", trend.getEntityId())
                .addValue("entityType", trend.getEntityType().getValue())
                .addValue("dimension", trend.getDimension())
                .addValue("analyzedAt", trend.getAnalyzedAt().toString())
                .addValue("analyzedAtNs", epochNanos(trend.getAnalyzedAt()))
                .addValue("timeRange", toJson(trend.getTimeRange()))
                .addValue("trend", toJson(trend.getTrend()))
                .addValue("seasonality", toJson(trend.getSeasonality()))
                .addValue("forecast", toJson(trend.getForecast()))
                .addValue("changePoints", toJson(trend.getChangePoints()))
                .addValue("statistics", toJson(trend.getStatistics()))
                .addValue("createdAt", epochNanos(clock.instant()));
        execute("insert trend", () -> jdbcTemplate.update("""
                INSERT INTO trend_analyses (id, entity_id, entity_type, dimension, analyzed_at, analyzed_at_ns,
                                            time_range, trend_data, seasonality_data, forecast_data,
                                            change_points, statistics, created_at_ns)
                VALUES (:id, :entityId, :entityType, :dimension, :analyzedAt, :analyzedAtNs,
                        :timeRange, :trend, :seasonality, :forecast,
                        :changePoints, :statistics, :createdAt)
                """, params));
    }

    @Override
    public Optional<TrendAnalysis> queryTrend(String entityId, String dimension) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("entityId", entityId);
        String dimensionClause = "";
        if (dimension != null) {
            dimensionClause = "AND dimension IN (:dimension, :dimensionMetricType)";
            params.addValue("dimension", dimension)
                    .addValue("dimensionMetricType", QualityMetric.dimensionMetricType(dimension));
        }
        String sql = """
                SELECT id, entity_id, entity_type, dimension, analyzed_at, time_range, trend_data,
                       seasonality_data, forecast_data, change_points, statistics
                FROM trend_analyses
                WHERE entity_id = :entityId
                  %s
                ORDER BY analyzed_at_ns DESC
                LIMIT 1
                """.formatted(dimensionClause);
        List<TrendAnalysis> rows = execute("query trend", () -> jdbcTemplate.query(sql, params, this::mapTrend));
        return rows.stream().findFirst();
    }

    // ---------------------------------------------------------------
    // Summaries & statistics
    // ---------------------------------------------------------------

    @Override
    public void insertDetectionSummary(DetectionSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", summary.getId())
                .addValue("entityId", summary.getEntityId())
                .addValue("analysisTimestamp", summary.getAnalysisTimestamp().toString())
                .addValue("analysisTimestampNs", epochNanos(summary.getAnalysisTimestamp()))
                .addValue("anomaliesCount", summary.getAnomaliesCount())
                .addValue("trendsCount", summary.getTrendsCount())
                .addValue("accuracy", summary.getDetectionAccuracy())
                .addValue("processingTimeMs", summary.getProcessingTimeMs())
                .addValue("algorithmsUsed", toJson(summary.getAlgorithmsUsed()))
                .addValue("dataPoints", summary.getDataPointsAnalyzed())
                .addValue("createdAt", epochNanos(clock.instant()));
        execute("insert detection summary", () -> jdbcTemplate.update("""
                INSERT INTO anomaly_detection_results (id, entity_id, analysis_timestamp, analysis_timestamp_ns,
                                                       anomalies_count, trends_count, detection_accuracy,
                                                       processing_time_ms, algorithms_used, data_points_analyzed,
                                                       created_at_ns)
                VALUES (:id, :entityId, :analysisTimestamp, :analysisTimestampNs,
                        :anomaliesCount, :trendsCount, :accuracy,
                        :processingTimeMs, :algorithmsUsed, :dataPoints, :createdAt)
                """, params));
    }

    @Override
    public List<DetectionSummary> querySummaries(String entityId, int limit) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entityId", entityId)
                .addValue("limit", limit);
        return execute("query detection summaries", () -> jdbcTemplate.query("""
                SELECT id, entity_id, analysis_timestamp, anomalies_count, trends_count, detection_accuracy,
                       processing_time_ms, algorithms_used, data_points_analyzed
                FROM anomaly_detection_results
                WHERE entity_id = :entityId
                ORDER BY analysis_timestamp_ns DESC
                LIMIT :limit
                """, params, (rs, rowNum) -> DetectionSummary.builder()
                .id(rs.getString("id"))
                .entityId(rs.getString("entity_id"))
                .analysisTimestamp(Instant.parse(rs.getString("analysis_timestamp")))
                .anomaliesCount(rs.getInt("anomalies_count"))
                .trendsCount(rs.getInt("trends_count"))
                .detectionAccuracy(rs.getDouble("detection_accuracy"))
                .processingTimeMs(rs.getLong("processing_time_ms"))
                .algorithmsUsed(fromJson(rs.getString("algorithms_used"), STRING_LIST))
                .dataPointsAnalyzed(rs.getInt("data_points_analyzed"))
                .build()));
    }

    @Override
    public void insertStatistics(String entityId, String dimension, String timeWindow,
            StatisticalSummary statistics, Instant computedAt) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(statistics, "statistics must not be null");
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", UUID.randomUUID().toString())
                .addValue("entityId", entityId)
                .addValue("dimension", dimension)
                .addValue("timeWindow", timeWindow)
                .addValue("metrics", toJson(statistics))
                .addValue("computedAt", computedAt.toString())
                .addValue("createdAt", epochNanos(clock.instant()));
        execute("insert statistics", () -> jdbcTemplate.update("""
                INSERT INTO statistical_metrics (id, entity_id, dimension, time_window, metrics, computed_at,
                                                 created_at_ns)
                VALUES (:id, :entityId, :dimension, :timeWindow, :metrics, :computedAt, :createdAt)
                """, params));
    }

    /**
     * @return number of statistics rows recorded for the entity
     */
    public int countStatistics(String entityId) {
        Integer count = execute("count statistics", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM statistical_metrics WHERE entity_id = :entityId",
                new MapSqlParameterSource("entityId", entityId), Integer.class));
        return count != null ? count : 0;
    }

    // ---------------------------------------------------------------
    // Retention
    // ---------------------------------------------------------------

    @Override
    public int deleteAnomaliesOlderThan(Instant cutoff) {
        return deleteOlderThan("quality_anomalies", cutoff);
    }

    @Override
    public int deleteTrendsOlderThan(Instant cutoff) {
        return deleteOlderThan("trend_analyses", cutoff);
    }

    @Override
    public int deleteSummariesOlderThan(Instant cutoff) {
        return deleteOlderThan("anomaly_detection_results", cutoff);
    }

    @Override
    public int deleteStatisticsOlderThan(Instant cutoff) {
        return deleteOlderThan("statistical_metrics", cutoff);
    }

    private int deleteOlderThan(String table, Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int removed = execute("purge " + table, () -> jdbcTemplate.update(
                "DELETE FROM " + table + " WHERE created_at_ns < :cutoff",
                new MapSqlParameterSource("cutoff", epochNanos(cutoff))));
        LOG.debug("Removed {} row(s) from {} created before {}", removed, table, cutoff);
        return removed;
    }

    // ---------------------------------------------------------------
    // Row mappers
    // ---------------------------------------------------------------

    private QualityMetric mapMetric(ResultSet rs, int rowNum) throws SQLException {
        return QualityMetric.builder()
                .id(rs.getString("id"))
                .entityId(rs.getString("entity_id"))
                .entityType(EntityType.fromValue(rs.getString("entity_type")))
                .metricType(rs.getString("metric_type"))
                .value(rs.getDouble("metric_value"))
                .unit(rs.getString("unit"))
                .timestamp(Instant.parse(rs.getString("recorded_at")))
                .source(rs.getString("source"))
                .tags(fromJson(rs.getString("tags"), STRING_SET))
                .build();
    }

    private AnomalyRecord mapAnomaly(ResultSet rs, int rowNum) throws SQLException {
        return AnomalyRecord.builder()
                .id(rs.getString("id"))
                .type(AnomalyType.fromValue(rs.getString("type")))
                .severity(AnomalySeverity.fromValue(rs.getString("severity")))
                .entityId(rs.getString("entity_id"))
                .entityType(EntityType.fromValue(rs.getString("entity_type")))
                .detectedAt(Instant.parse(rs.getString("detected_at")))
                .algorithm(rs.getString("algorithm"))
                .score(rs.getDouble("score"))
                .confidence(rs.getDouble("confidence"))
                .description(rs.getString("description"))
                .context(fromJson(rs.getString("context"), AnomalyRecord.Context.class))
                .metadata(fromJson(rs.getString("metadata"), AnomalyRecord.Metadata.class))
                .relatedMetrics(fromJson(rs.getString("related_metrics"), METRIC_LIST))
                .build();
    }

    private TrendAnalysis mapTrend(ResultSet rs, int rowNum) throws SQLException {
        return TrendAnalysis.builder()
                .id(rs.getString("id"))
                .entityId(rs.getString("entity_id"))
                .entityType(EntityType.fromValue(rs.getString("entity_type")))
                .dimension(rs.getString("dimension"))
                .analyzedAt(Instant.parse(rs.getString("analyzed_at")))
                .timeRange(fromJson(rs.getString("time_range"), TrendAnalysis.TimeRange.class))
                .trend(fromJson(rs.getString("trend_data"), TrendAnalysis.Trend.class))
                .seasonality(fromJson(rs.getString("seasonality_data"), TrendAnalysis.Seasonality.class))
                .forecast(fromJson(rs.getString("forecast_data"), TrendAnalysis.Forecast.class))
                .changePoints(fromJson(rs.getString("change_points"), CHANGE_POINT_LIST))
                .statistics(fromJson(rs.getString("statistics"), TrendAnalysis.Statistics.class))
                .build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Metrics store failed to " + operation, e);
        }
    }

    static long epochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName() + " as JSON", e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupt " + type.getSimpleName() + " JSON in metrics store", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupt JSON in metrics store: " + json, e);
        }
    }
}
