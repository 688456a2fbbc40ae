package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.config.ConfigLoader;
import com.qualitysentinel.core.config.DetectionConfig;
import com.qualitysentinel.core.detection.OutlierAlgorithm;
import com.qualitysentinel.core.model.AnomalyFilter;
import com.qualitysentinel.core.model.AnomalyRecord;
import com.qualitysentinel.core.model.DetectionResult;
import com.qualitysentinel.core.model.DetectionStatistics;
import com.qualitysentinel.core.model.EntityType;
import com.qualitysentinel.core.model.MetricSeries;
import com.qualitysentinel.core.model.QualityMetric;
import com.qualitysentinel.core.model.QualitySnapshot;
import com.qualitysentinel.core.model.TrendAnalysis;
import com.qualitysentinel.core.stats.Statistics;
import com.qualitysentinel.core.store.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: runs the outlier algorithms and the trend
 * analyzer over an entity's metric history, persists the outcome and notifies
 * listeners.
 *
 * <h3>Batch runs</h3>
 * <p>
 * {@link #detectAnomalies(String, EntityType, String)} loads the newest
 * {@code maxHistorySize} metrics of the entity, groups them by metric type
 * and analyses every group holding at least {@code minDataPoints} points.
 * An algorithm that throws is logged and skipped; the run continues with the
 * remaining algorithms. Persistence failures are logged and never fail the
 * run.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * At most one run per entity is in flight; a second concurrent request for the
 * same entity fails with {@link AnalysisInProgressException}. Distinct
 * entities run concurrently. Every run works against the configuration
 * snapshot that was live when it started.
 * </p>
 *
 * <h3>Real-time path</h3>
 * <p>
 * {@link #detectRealtimeAnomaly(QualitySnapshot)} never throws and never
 * persists; detected anomalies are only handed to the listeners.
 * </p>
 *
 * @since 1.0.0
 */
public class QualityAnomalyDetector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(QualityAnomalyDetector.class);

    /** Runs slower than this are logged at WARN. */
    static final long LATENCY_BUDGET_MS = 200;

    static final String ALL_DIMENSIONS = "all";
    static final String OVERALL_TREND = "overall";

    private final MetricsStore store;
    private final Clock clock;
    private final Object configLock = new Object();
    private volatile DetectionPipeline pipeline;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final BoundedCache<String, List<QualityMetric>> qualityDataCache;
    private final BoundedCache<String, TrendAnalysis> trendCache;
    private final DetectionStatsTracker stats = new DetectionStatsTracker();
    private final AnomalyNotifier notifier = new AnomalyNotifier();
    private final ThreadPoolExecutor analysisWorkers;
    private final ThreadPoolExecutor groupWorkers;
    private final RetentionCleaner cleaner;
    private final AtomicBoolean closed = new AtomicBoolean();

    public QualityAnomalyDetector(MetricsStore store, DetectionConfig config) {
        this(store, config, Clock.systemUTC());
    }

    /**
     * @param store  persistence backend; must not be {@code null}
     * @param config initial configuration; validated, then copied
     * @param clock  time source for analysis timestamps and retention
     * @throws IllegalStateException if {@code config} is invalid
     */
    public QualityAnomalyDetector(MetricsStore store, DetectionConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.pipeline = DetectionPipeline.from(ConfigLoader.copy(config), clock);

        DetectionConfig.PerformanceConfig performance = config.getPerformance();
        this.qualityDataCache = new BoundedCache<>(performance.getCacheSize());
        this.trendCache = new BoundedCache<>(performance.getCacheSize());
        this.analysisWorkers = newWorkerPool("quality-analysis", performance.getMaxConcurrentAnalysis());
        this.groupWorkers = newWorkerPool("quality-group", performance.getMaxConcurrentAnalysis());

        this.cleaner = new RetentionCleaner(store, RetentionCleaner.DEFAULT_RETENTION, clock);
        this.cleaner.start(config.getDataProcessing().getCleanupInterval());

        LOG.info("QualityAnomalyDetector started with algorithms {}", config.getEnabledAlgorithmNames());
    }

    // ---------------------------------------------------------------
    // Batch detection
    // ---------------------------------------------------------------

    /**
     * Analyse the stored history of an entity.
     *
     * @param entityId   the entity
     * @param entityType the entity type
     * @param dimension  optional dimension filter; {@code null} analyses every
     *                   metric type
     * @return the run result
     * @throws AnalysisInProgressException if a run for the entity is in flight
     * @throws InsufficientDataException   if fewer than {@code minDataPoints}
     *                                     metrics are available
     */
    public DetectionResult detectAnomalies(String entityId, EntityType entityType, String dimension) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        ensureOpen();
        long startNanos = System.nanoTime();
        acquire(entityId);
        try {
            DetectionPipeline current = pipeline;
            return run(entityId, entityType, loadQualityData(entityId, dimension, current), current, startNanos);
        } finally {
            inFlight.remove(entityId);
        }
    }

    /**
     * Analyse a caller-provided series instead of the stored history. The
     * outcome is persisted exactly as for a stored series.
     */
    public DetectionResult detectAnomalies(String entityId, EntityType entityType, List<QualityMetric> metrics) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        ensureOpen();
        long startNanos = System.nanoTime();
        acquire(entityId);
        try {
            return run(entityId, entityType, metrics, pipeline, startNanos);
        } finally {
            inFlight.remove(entityId);
        }
    }

    /**
     * Asynchronous variant of {@link #detectAnomalies(String, EntityType, String)}
     * executed on the engine's worker pool.
     *
     * <p>
     * The in-flight check happens before this method returns: a second call
     * for the same entity yields a future already failed with
     * {@link AnalysisInProgressException}.
     * </p>
     */
    public CompletableFuture<DetectionResult> detectAnomaliesAsync(String entityId, EntityType entityType,
            String dimension) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        Objects.requireNonNull(entityType, "entityType must not be null");
        ensureOpen();
        long startNanos = System.nanoTime();
        if (!inFlight.add(entityId)) {
            return CompletableFuture.failedFuture(new AnalysisInProgressException(entityId));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    DetectionPipeline current = pipeline;
                    return run(entityId, entityType, loadQualityData(entityId, dimension, current),
                            current, startNanos);
                } finally {
                    inFlight.remove(entityId);
                }
            }, analysisWorkers);
        } catch (RejectedExecutionException e) {
            inFlight.remove(entityId);
            return CompletableFuture.failedFuture(e);
        }
    }

    // ---------------------------------------------------------------
    // Real-time detection
    // ---------------------------------------------------------------

    /**
     * Check a fresh observation against the entity's recent history.
     *
     * @return anomalies for the snapshot; empty when history is insufficient
     *         or anything fails
     */
    public List<AnomalyRecord> detectRealtimeAnomaly(QualitySnapshot snapshot) {
        long startNanos = System.nanoTime();
        try {
            Objects.requireNonNull(snapshot, "snapshot must not be null");
            ensureOpen();
            DetectionPipeline current = pipeline;
            List<QualityMetric> history = loadQualityData(snapshot.getEntityId(), null, current);
            if (history.size() < current.minDataPoints()) {
                LOG.debug("Real-time check skipped for {}: {} < {} historical points",
                        snapshot.getEntityId(), history.size(), current.minDataPoints());
                return List.of();
            }
            List<AnomalyRecord> anomalies = current.realtimeDetector().detect(snapshot, history);
            anomalies.forEach(notifier::publish);

            long elapsedMs = elapsedMs(startNanos);
            if (elapsedMs > LATENCY_BUDGET_MS) {
                LOG.warn("Real-time check for {} took {} ms (budget {} ms)",
                        snapshot.getEntityId(), elapsedMs, LATENCY_BUDGET_MS);
            }
            return anomalies;
        } catch (Exception e) {
            LOG.error("Real-time anomaly check failed for snapshot {}", snapshot, e);
            return List.of();
        }
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    /**
     * @return persisted anomalies matching {@code filter}, newest first; empty
     *         if the store is unavailable
     */
    public List<AnomalyRecord> getAnomalies(AnomalyFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        try {
            return store.queryAnomalies(filter);
        } catch (RuntimeException e) {
            LOG.error("Failed to query anomalies with {}", filter, e);
            return List.of();
        }
    }

    /**
     * Latest trend analysis of an entity, from cache when possible.
     *
     * @param dimension optional dimension name or metric type, so
     *                  {@code clarity} and {@code clarity_score} both match;
     *                  {@code null} returns the latest analysis of any dimension
     */
    public Optional<TrendAnalysis> getTrendAnalysis(String entityId, String dimension) {
        Objects.requireNonNull(entityId, "entityId must not be null");
        if (pipeline.cachingEnabled()) {
            String cacheKey = entityId + "-" + (dimension != null ? dimension : OVERALL_TREND);
            Optional<TrendAnalysis> cached = trendCache.get(cacheKey);
            if (cached.isEmpty() && dimension != null) {
                cached = trendCache.get(entityId + "-" + QualityMetric.dimensionMetricType(dimension));
            }
            if (cached.isPresent()) {
                return cached;
            }
        }
        try {
            return store.queryTrend(entityId, dimension);
        } catch (RuntimeException e) {
            LOG.error("Failed to query trend analysis for {}/{}", entityId, dimension, e);
            return Optional.empty();
        }
    }

    /**
     * Swap the outlier algorithms of the live pipeline, keeping its
     * configuration. Package-private hook for tests.
     */
    void replaceAlgorithms(List<OutlierAlgorithm> algorithms) {
        synchronized (configLock) {
            pipeline = pipeline.withAlgorithms(algorithms);
        }
    }

    public DetectionStatistics getDetectionStatistics() {
        return stats.snapshot(pipeline.config().getEnabledAlgorithmNames());
    }

    /**
     * @return a deep copy of the live configuration
     */
    public DetectionConfig getConfiguration() {
        return ConfigLoader.copy(pipeline.config());
    }

    // ---------------------------------------------------------------
    // Configuration & lifecycle
    // ---------------------------------------------------------------

    /**
     * Merge a partial configuration into the live one.
     *
     * <p>
     * The merge is applied to a copy which is validated before it replaces the
     * live configuration; on failure the live configuration is untouched. Runs
     * already in progress finish with their original snapshot.
     * </p>
     *
     * @param partial nested map mirroring the configuration tree
     * @throws IllegalArgumentException if {@code partial} holds an unknown key
     * @throws IllegalStateException    if the merged configuration is invalid
     */
    public void updateConfiguration(Map<String, Object> partial) {
        Objects.requireNonNull(partial, "partial configuration must not be null");
        synchronized (configLock) {
            DetectionConfig previous = pipeline.config();
            DetectionConfig merged = ConfigLoader.merge(previous, partial);
            pipeline = DetectionPipeline.from(merged, clock);

            DetectionConfig.PerformanceConfig performance = merged.getPerformance();
            qualityDataCache.setCapacity(performance.getCacheSize());
            trendCache.setCapacity(performance.getCacheSize());
            if (!performance.isEnableCaching()) {
                clearCache();
            }
            resize(analysisWorkers, performance.getMaxConcurrentAnalysis());
            resize(groupWorkers, performance.getMaxConcurrentAnalysis());
            long interval = merged.getDataProcessing().getCleanupInterval();
            if (interval != previous.getDataProcessing().getCleanupInterval()) {
                cleaner.start(interval);
            }
            LOG.info("Configuration updated: {}", merged);
        }
    }

    public void clearCache() {
        qualityDataCache.clear();
        trendCache.clear();
        LOG.debug("Caches cleared");
    }

    public void addListener(AnomalyListener listener) {
        notifier.addListener(listener);
    }

    public void removeListener(AnomalyListener listener) {
        notifier.removeListener(listener);
    }

    /**
     * Run one retention pass immediately instead of waiting for the timer.
     *
     * @return number of records removed
     */
    public int purgeExpiredRecords() {
        return cleaner.purgeExpired();
    }

    /**
     * Stop the cleanup timer and the worker pools, drop listeners, clear the
     * caches and the in-flight set. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cleaner.close();
        notifier.close();
        analysisWorkers.shutdown();
        groupWorkers.shutdown();
        clearCache();
        inFlight.clear();
        LOG.info("QualityAnomalyDetector closed");
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    private DetectionResult run(String entityId, EntityType entityType, List<QualityMetric> data,
            DetectionPipeline current, long startNanos) {
        int minDataPoints = current.minDataPoints();
        if (data.size() < minDataPoints) {
            throw new InsufficientDataException(entityId, data.size(), minDataPoints);
        }

        List<MetricSeries> groups = group(entityId, entityType, data).stream()
                .filter(series -> {
                    if (series.size() < minDataPoints) {
                        LOG.trace("Skipping {}/{}: {} < {} points",
                                entityId, series.getMetricType(), series.size(), minDataPoints);
                        return false;
                    }
                    return true;
                })
                .toList();

        List<GroupOutcome> outcomes = analyseGroups(groups, current);
        List<AnomalyRecord> anomalies = new ArrayList<>();
        List<TrendAnalysis> trends = new ArrayList<>();
        for (GroupOutcome outcome : outcomes) {
            anomalies.addAll(outcome.anomalies);
            outcome.trend.ifPresent(trends::add);
        }

        double accuracy = stats.accuracyFor(anomalies.size());
        long processingTimeMs = elapsedMs(startNanos);
        Instant analysisTimestamp = clock.instant();
        List<String> algorithmsUsed = current.algorithms().stream().map(OutlierAlgorithm::getName).toList();
        DetectionResult result = new DetectionResult(anomalies, trends,
                DetectionResult.Summary.of(anomalies, accuracy, processingTimeMs),
                new DetectionResult.Metadata(data.size(), algorithmsUsed, analysisTimestamp));

        persist(entityId, result, outcomes, analysisTimestamp);
        if (current.cachingEnabled()) {
            trendCache.remove(entityId + "-" + OVERALL_TREND);
            for (TrendAnalysis trend : trends) {
                trendCache.put(entityId + "-" + trend.getDimension(), trend);
            }
        }
        stats.record(processingTimeMs, accuracy);
        anomalies.forEach(notifier::publish);

        LOG.info("Detection for {} finished: {} anomalies, {} trends from {} points in {} ms",
                entityId, anomalies.size(), trends.size(), data.size(), processingTimeMs);
        if (processingTimeMs > LATENCY_BUDGET_MS) {
            LOG.warn("Detection for {} took {} ms (budget {} ms)", entityId, processingTimeMs, LATENCY_BUDGET_MS);
        }
        return result;
    }

    private List<GroupOutcome> analyseGroups(List<MetricSeries> groups, DetectionPipeline current) {
        if (!current.config().getPerformance().isEnableParallelProcessing() || groups.size() < 2) {
            return groups.stream().map(series -> analyseGroup(series, current)).toList();
        }
        List<CompletableFuture<GroupOutcome>> futures = groups.stream()
                .map(series -> CompletableFuture.supplyAsync(() -> analyseGroup(series, current), groupWorkers))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private GroupOutcome analyseGroup(MetricSeries series, DetectionPipeline current) {
        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (OutlierAlgorithm algorithm : current.algorithms()) {
            try {
                anomalies.addAll(algorithm.detect(series));
            } catch (Exception e) {
                LOG.error("Algorithm [{}] threw an exception on {}/{} – continuing with next algorithm",
                        algorithm.getName(), series.getEntityId(), series.getMetricType(), e);
            }
        }

        Optional<TrendAnalysis> trend = Optional.empty();
        if (current.trendAnalysisEnabled()) {
            try {
                trend = current.trendAnalyzer().analyze(series);
            } catch (Exception e) {
                LOG.error("Trend analysis threw an exception on {}/{} – continuing without trend",
                        series.getEntityId(), series.getMetricType(), e);
            }
        }
        return new GroupOutcome(series, anomalies, trend);
    }

    /**
     * Summary first, then anomalies, trends and per-series statistics. Stops
     * at the first store failure; the in-memory result is still returned.
     */
    private void persist(String entityId, DetectionResult result, List<GroupOutcome> outcomes,
            Instant analysisTimestamp) {
        try {
            store.insertDetectionSummary(result.toSummary(entityId));
            result.getAnomalies().forEach(store::insertAnomaly);
            result.getTrends().forEach(store::insertTrend);
            for (GroupOutcome outcome : outcomes) {
                MetricSeries series = outcome.series;
                store.insertStatistics(entityId, series.getMetricType(), series.size() + "_points",
                        Statistics.summarize(series.getValues()), analysisTimestamp);
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to persist detection results for {} – returning unpersisted result", entityId, e);
        }
    }

    // ---------------------------------------------------------------
    // Data access
    // ---------------------------------------------------------------

    private List<QualityMetric> loadQualityData(String entityId, String dimension, DetectionPipeline current) {
        String cacheKey = entityId + "-" + (dimension != null ? dimension : ALL_DIMENSIONS);
        if (current.cachingEnabled()) {
            Optional<List<QualityMetric>> cached = qualityDataCache.get(cacheKey);
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        List<QualityMetric> data;
        try {
            data = store.query(entityId, dimension, current.config().getDataProcessing().getMaxHistorySize());
        } catch (RuntimeException e) {
            LOG.error("Failed to load quality data for {}/{}", entityId, dimension, e);
            return List.of();
        }
        if (current.cachingEnabled()) {
            qualityDataCache.put(cacheKey, data);
        }
        return data;
    }

    /**
     * Group by metric type in order of first appearance, each group sorted by
     * timestamp.
     */
    static List<MetricSeries> group(String entityId, EntityType entityType, List<QualityMetric> data) {
        Map<String, List<QualityMetric>> byType = new LinkedHashMap<>();
        for (QualityMetric metric : data) {
            byType.computeIfAbsent(metric.getMetricType(), k -> new ArrayList<>()).add(metric);
        }
        List<MetricSeries> groups = new ArrayList<>(byType.size());
        byType.forEach((metricType, points) -> {
            points.sort(Comparator.comparing(QualityMetric::getTimestamp));
            groups.add(MetricSeries.of(entityId, entityType, metricType, points));
        });
        return groups;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void acquire(String entityId) {
        if (!inFlight.add(entityId)) {
            throw new AnalysisInProgressException(entityId);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("QualityAnomalyDetector is closed");
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static ThreadPoolExecutor newWorkerPool(String prefix, int size) {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    private static void resize(ThreadPoolExecutor pool, int size) {
        if (size > pool.getMaximumPoolSize()) {
            pool.setMaximumPoolSize(size);
            pool.setCorePoolSize(size);
        } else {
            pool.setCorePoolSize(size);
            pool.setMaximumPoolSize(size);
        }
    }

    private static final class GroupOutcome {
        private final MetricSeries series;
        private final List<AnomalyRecord> anomalies;
        private final Optional<TrendAnalysis> trend;

        GroupOutcome(MetricSeries series, List<AnomalyRecord> anomalies, Optional<TrendAnalysis> trend) {
            this.series = series;
            this.anomalies = anomalies;
            this.trend = trend;
        }
    }
}
