package com.example.textengine.infrastructure.cache;

import com.example.textengine.domain.model.CacheStats;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Bounded memoization map with least-recently-used eviction.
 * <p>
 * Recency is a logical use counter, not wall-clock time: every {@link #get} hit and every {@link #put}
 * stamps the entry with the next counter value, and eviction removes the entry with the smallest stamp.
 * A capacity of zero or less means unbounded.
 * <p>
 * All operations hold the cache's monitor, so a lookup returns either the whole value present at call time
 * or nothing. Concurrent puts for one key resolve to the last writer.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruCache<K, V> {

    private final String name;
    private final Map<K, CacheEntry<K, V>> entries = new HashMap<>();
    private final TreeMap<Long, K> useOrder = new TreeMap<>();
    private int capacity;
    private long useCounter;
    private long hits;
    private long misses;
    private long evictions;

    /**
     * @param name     label used in diagnostics
     * @param capacity maximum number of entries, {@code <= 0} for unbounded
     */
    public LruCache(String name, int capacity) {
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
    }

    /**
     * Looks up a key and marks it as most recently used.
     *
     * @param key key to look up
     * @return cached value or {@code null}
     */
    public synchronized V get(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        hits++;
        touch(entry);
        return entry.value;
    }

    /**
     * Stores a value. When the key is new and the cache is full, exactly one entry is evicted:
     * the least recently used one.
     *
     * @param key   key
     * @param value value, never {@code null}
     */
    public synchronized void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        CacheEntry<K, V> entry = entries.get(key);
        if (entry != null) {
            entry.value = value;
            touch(entry);
            return;
        }
        entry = new CacheEntry<>(key, value, ++useCounter);
        entries.put(key, entry);
        useOrder.put(entry.lastUse, key);
        if (capacity > 0 && entries.size() > capacity) {
            evictOldest();
        }
    }

    /**
     * Returns the cached value or computes and stores it. The loader runs outside the lock, so two
     * threads missing the same key may both load it; the later put wins.
     *
     * @param key    key
     * @param loader computes the value on a miss; must not return {@code null}
     * @return cached or freshly loaded value
     */
    public V getOrLoad(K key, Function<? super K, ? extends V> loader) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }
        V loaded = Objects.requireNonNull(loader.apply(key), "loader returned null for " + key);
        put(key, loaded);
        return loaded;
    }

    /**
     * Changes the bound and evicts least recently used entries until the cache fits.
     *
     * @param newCapacity new bound, {@code <= 0} for unbounded
     */
    public synchronized void capacity(int newCapacity) {
        this.capacity = newCapacity;
        if (newCapacity > 0) {
            while (entries.size() > newCapacity) {
                evictOldest();
            }
        }
    }

    public synchronized int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized V remove(K key) {
        CacheEntry<K, V> entry = entries.remove(key);
        if (entry == null) {
            return null;
        }
        useOrder.remove(entry.lastUse);
        return entry.value;
    }

    public synchronized void clear() {
        entries.clear();
        useOrder.clear();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hits, misses, evictions, entries.size(), capacity);
    }

    public String name() {
        return name;
    }

    private void touch(CacheEntry<K, V> entry) {
        useOrder.remove(entry.lastUse);
        entry.lastUse = ++useCounter;
        useOrder.put(entry.lastUse, entry.key);
    }

    private void evictOldest() {
        Map.Entry<Long, K> oldest = useOrder.pollFirstEntry();
        if (oldest != null) {
            entries.remove(oldest.getValue());
            evictions++;
        }
    }

    @Override
    public String toString() {
        return "LruCache[" + name + "]";
    }

    /**
     * Entry owned by the cache; {@code lastUse} is the use counter value of its latest access.
     */
    private static final class CacheEntry<K, V> {
        private final K key;
        private V value;
        private long lastUse;

        CacheEntry(K key, V value, long lastUse) {
            this.key = key;
            this.value = value;
            this.lastUse = lastUse;
        }
    }
}
