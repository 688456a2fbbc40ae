package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.store.MetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.ToIntFunction;

/**
 * Periodically removes persisted anomalies, trend analyses, detection
 * summaries and statistics older than the retention period.
 *
 * <p>
 * The cutoff is evaluated against the injected {@link Clock} on every pass.
 * A failing delete is logged and the remaining record kinds are still purged.
 * </p>
 *
 * @since 1.0.0
 */
public class RetentionCleaner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionCleaner.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofDays(7);

    private final MetricsStore store;
    private final Duration retention;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public RetentionCleaner(MetricsStore store, Duration retention, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "retention-cleaner");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedule a purge every {@code intervalMs}, replacing any previous
     * schedule. The first pass runs one interval from now.
     */
    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0, got: " + intervalMs);
        }
        if (task != null) {
            task.cancel(false);
        }
        task = scheduler.scheduleAtFixedRate(this::purgeExpired, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Retention cleanup scheduled every {} ms (retention {})", intervalMs, retention);
    }

    /**
     * Run one purge pass now.
     *
     * @return total number of records removed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int anomalies = purge("anomalies", store::deleteAnomaliesOlderThan, cutoff);
        int trends = purge("trend analyses", store::deleteTrendsOlderThan, cutoff);
        int summaries = purge("detection summaries", store::deleteSummariesOlderThan, cutoff);
        int statistics = purge("statistics", store::deleteStatisticsOlderThan, cutoff);
        int total = anomalies + trends + summaries + statistics;
        if (total > 0) {
            LOG.info("Retention cleanup removed {} anomalies, {} trends, {} summaries, {} statistics older than {}",
                    anomalies, trends, summaries, statistics, cutoff);
        } else {
            LOG.debug("Retention cleanup found nothing older than {}", cutoff);
        }
        return total;
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        scheduler.shutdownNow();
    }

    private static int purge(String kind, ToIntFunction<Instant> delete, Instant cutoff) {
        try {
            return delete.applyAsInt(cutoff);
        } catch (RuntimeException e) {
            LOG.error("Failed to purge expired {} – continuing with next record kind", kind, e);
            return 0;
        }
    }
}
