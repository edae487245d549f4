package com.resource.guard.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process {@link KeyValueStore} on Caffeine, honouring a TTL per entry.
 * Suitable for single-JVM deployments and tests.
 */
public class CaffeineKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(CaffeineKeyValueStore.class);

    private final Cache<String, Entry> cache;

    public CaffeineKeyValueStore(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    CaffeineKeyValueStore(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
        log.info("CaffeineKeyValueStore initialized: maxSize={}", config.maxSize());
    }

    @Override
    public Optional<String> read(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void write(String key, String value, Duration ttl) {
        long ttlNanos = ttl == null || ttl.isZero() || ttl.isNegative() ? Long.MAX_VALUE : ttl.toNanos();
        cache.put(key, new Entry(value, ttlNanos));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    private record Entry(String value, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
