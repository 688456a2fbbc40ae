package com.qualitysentinel.core.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Size-bounded cache with insertion-order eviction.
 *
 * <p>
 * When a put pushes the size over capacity the <em>oldest inserted</em> entry
 * is evicted. Reads do not refresh an entry, so this is FIFO rather than LRU.
 * Re-putting an existing key keeps its original insertion position.
 * </p>
 *
 * <p>
 * Every operation holds the cache monitor, so instances may be shared across
 * concurrent detection runs.
 * </p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class BoundedCache<K, V> {

    private final Map<K, V> entries;
    private int capacity;

    public BoundedCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedCache.this.capacity;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    public synchronized void remove(K key) {
        entries.remove(key);
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int getCapacity() {
        return capacity;
    }

    /**
     * Change the capacity, evicting the oldest entries if the cache is now
     * over it.
     */
    public synchronized void setCapacity(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        var iterator = entries.keySet().iterator();
        while (entries.size() > capacity && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
        }
    }
}
