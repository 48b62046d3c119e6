package com.example.textengine.domain.model;

/**
 * Point-in-time counters of a bounded cache.
 *
 * @param hits      successful lookups
 * @param misses    failed lookups
 * @param evictions entries removed to honor the capacity
 * @param size      entries currently held
 * @param capacity  configured bound, {@code <= 0} when unbounded
 */
public record CacheStats(long hits, long misses, long evictions, int size, int capacity) {

    /**
     * @return hit ratio in {@code [0, 1]}, {@code 0} before the first lookup
     */
    public double hitRatio() {
        long lookups = hits + misses;
        return lookups == 0 ? 0d : (double) hits / lookups;
    }
}
