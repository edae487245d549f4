package com.resource.guard.cache;

import java.time.Duration;

/**
 * Configuration for read-through caching.
 *
 * @param maxSize   maximum number of entries held by a local {@link CaffeineKeyValueStore}
 * @param ttl       time-to-live of entries written back after a miss
 * @param writeBack whether a value fetched on a miss is written to the store
 */
public record CacheConfig(int maxSize, Duration ttl, boolean writeBack) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    /**
     * Default configuration: 10,000 entries, 300s TTL, write-back enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofSeconds(300), true);
    }

    public CacheConfig withWriteBack(boolean writeBack) {
        return new CacheConfig(maxSize, ttl, writeBack);
    }
}
