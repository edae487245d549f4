package com.resource.guard.cache;

import com.resource.guard.coalesce.RequestCoalescer;
import com.resource.guard.metrics.MetricsService;
import com.resource.guard.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-through cache that fetches each cold key from upstream at most once at a time.
 *
 * <p>A hit is served from the {@link KeyValueStore} without touching the coalescer. A miss,
 * or a store that cannot be read, goes through {@link RequestCoalescer} so that concurrent
 * callers for the same key share one upstream fetch. When write-back is enabled a fetched
 * value is stored for {@link CacheConfig#ttl()}; records the upstream does not have are
 * returned as {@link Optional#empty()} and never stored.</p>
 *
 * <p>A cached value that cannot be decoded is reported as a {@link FetchException} instead
 * of being treated as a miss, so a corrupt entry is noticed rather than refetched forever.</p>
 *
 * @param <V> value type
 */
public class ReadThroughCache<V> {
    private static final Logger log = LoggerFactory.getLogger(ReadThroughCache.class);

    private final KeyValueStore store;
    private final UpstreamFetcher<V> fetcher;
    private final ValueCodec<V> codec;
    private final RequestCoalescer<Optional<V>> coalescer;
    private final CacheConfig config;
    private final MetricsService metricsService;

    public ReadThroughCache(KeyValueStore store, UpstreamFetcher<V> fetcher, ValueCodec<V> codec,
                            RequestCoalescer<Optional<V>> coalescer) {
        this(store, fetcher, codec, coalescer, CacheConfig.defaults(), new NoOpMetricsService());
    }

    public ReadThroughCache(KeyValueStore store, UpstreamFetcher<V> fetcher, ValueCodec<V> codec,
                            RequestCoalescer<Optional<V>> coalescer, CacheConfig config,
                            MetricsService metricsService) {
        this.store = Objects.requireNonNull(store, "store");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.coalescer = Objects.requireNonNull(coalescer, "coalescer");
        this.config = Objects.requireNonNull(config, "config");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
    }

    /**
     * Returns the value for {@code key}, fetching it from upstream on a miss.
     *
     * @return the value, or empty if neither the cache nor the upstream has a record
     * @throws FetchException if the upstream fetch fails or the cached value is corrupt
     */
    public Optional<V> get(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be null or empty");
        }

        Optional<String> cached = readCached(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return Optional.ofNullable(decode(key, cached.get()));
        }

        metricsService.recordCacheMiss();
        return coalescer.execute(key, () -> load(key));
    }

    /**
     * Removes the cached entry for {@code key}; the next {@link #get(String)} fetches again.
     */
    public void invalidate(String key) {
        store.delete(key);
        log.debug("Invalidated cache entry {}", key);
    }

    private Optional<String> readCached(String key) {
        try {
            return store.read(key);
        } catch (StoreException e) {
            metricsService.recordCacheError();
            log.warn("Cache read failed for {}, fetching from upstream: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private V decode(String key, String raw) {
        try {
            return codec.decode(raw);
        } catch (IllegalArgumentException e) {
            throw new FetchException(key, "Cached value for key '" + key + "' cannot be decoded", e);
        }
    }

    private Optional<V> load(String key) {
        Optional<V> fetched;
        try {
            fetched = fetcher.fetch(key);
        } catch (Exception e) {
            throw new FetchException(key, "Upstream fetch failed for key '" + key + "'", e);
        }

        if (fetched.isPresent()) {
            if (config.writeBack()) {
                writeBack(key, fetched.get());
            }
        } else {
            log.debug("Upstream has no record for {}", key);
        }
        return fetched;
    }

    private void writeBack(String key, V value) {
        try {
            store.write(key, codec.encode(value), config.ttl());
        } catch (StoreException | IllegalArgumentException e) {
            log.warn("Write-back failed for {}: {}", key, e.getMessage());
        }
    }
}
