package com.qualitysentinel.core.engine;

import com.qualitysentinel.core.model.AnomalyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers anomalies to registered {@link AnomalyListener}s asynchronously.
 *
 * <h3>Delivery model</h3>
 * <p>
 * Each listener owns a single-threaded executor with a bounded queue, so
 * callbacks for one listener arrive in publication order and a slow listener
 * never blocks detection or other listeners. When a queue is full the event is
 * dropped and logged at WARN.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * An exception thrown by a listener is logged at ERROR and delivery continues
 * with the next event.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyNotifier implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyNotifier.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 1_000;

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final Map<AnomalyListener, ThreadPoolExecutor> deliveries = new ConcurrentHashMap<>();
    private final int queueCapacity;

    public AnomalyNotifier() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    public AnomalyNotifier(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    public void addListener(AnomalyListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        deliveries.computeIfAbsent(listener, l -> newDeliveryExecutor());
        LOG.debug("Listener registered ({} total)", deliveries.size());
    }

    public void removeListener(AnomalyListener listener) {
        ThreadPoolExecutor executor = deliveries.remove(listener);
        if (executor != null) {
            executor.shutdown();
            LOG.debug("Listener removed ({} remaining)", deliveries.size());
        }
    }

    public int listenerCount() {
        return deliveries.size();
    }

    /**
     * Queue {@code anomaly} for every registered listener. Never blocks.
     */
    public void publish(AnomalyRecord anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        deliveries.forEach((listener, executor) -> {
            try {
                executor.execute(() -> deliver(listener, anomaly));
            } catch (RejectedExecutionException e) {
                LOG.debug("Listener executor shut down, dropping anomaly {}", anomaly.getId());
            }
        });
    }

    /**
     * Stop every delivery thread and drop all listeners. Events already queued
     * are still delivered.
     */
    @Override
    public void close() {
        deliveries.values().forEach(ThreadPoolExecutor::shutdown);
        deliveries.clear();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void deliver(AnomalyListener listener, AnomalyRecord anomaly) {
        try {
            listener.onAnomaly(anomaly);
        } catch (Exception e) {
            LOG.error("Listener [{}] threw an exception for anomaly {} – continuing with next event",
                    listener.getClass().getName(), anomaly.getId(), e);
        }
    }

    private ThreadPoolExecutor newDeliveryExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "anomaly-listener-" + THREAD_SEQ.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                (runnable, pool) -> {
                    if (pool.isShutdown()) {
                        throw new RejectedExecutionException("listener executor shut down");
                    }
                    LOG.warn("Listener queue full ({} events) – dropping anomaly notification", queueCapacity);
                });
        return executor;
    }
}
