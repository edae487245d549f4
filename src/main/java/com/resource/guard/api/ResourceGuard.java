package com.resource.guard.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.resource.guard.cache.CacheConfig;
import com.resource.guard.cache.CaffeineKeyValueStore;
import com.resource.guard.cache.JacksonValueCodec;
import com.resource.guard.cache.KeyValueStore;
import com.resource.guard.cache.ReadThroughCache;
import com.resource.guard.cache.RedisKeyValueStore;
import com.resource.guard.cache.UpstreamFetcher;
import com.resource.guard.cache.ValueCodec;
import com.resource.guard.coalesce.RequestCoalescer;
import com.resource.guard.graph.FalkorDBConnection;
import com.resource.guard.graph.GraphConnection;
import com.resource.guard.lock.DistributedLockManager;
import com.resource.guard.lock.DistributedMutex;
import com.resource.guard.lock.GraphLeaseStore;
import com.resource.guard.lock.InMemoryLeaseStore;
import com.resource.guard.lock.LeaseStore;
import com.resource.guard.lock.LockConfig;
import com.resource.guard.lock.RedisLeaseStore;
import com.resource.guard.metrics.MetricsService;
import com.resource.guard.metrics.NoOpMetricsService;
import com.resource.guard.tracing.NoOpTracingService;
import com.resource.guard.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point that wires coalescers, read-through caches and distributed mutexes to shared
 * stores, metrics and tracing.
 *
 * <pre>
 * try (ResourceGuard guard = ResourceGuard.builder()
 *         .redis("localhost", 6379)
 *         .cacheBackend(StoreBackend.REDIS)
 *         .leaseBackend(StoreBackend.REDIS)
 *         .build()) {
 *     ReadThroughCache&lt;Product&gt; products = guard.readThrough(Product.class, repository::findByKey);
 *     Optional&lt;Product&gt; product = products.get("product:1");
 *
 *     guard.getLockManager().withLock("acct:42", () -&gt; accounts.add("42", 100));
 * }
 * </pre>
 *
 * <p>Nothing here is global: every coalescer and cache is created by, and owned through,
 * an explicitly built instance. Connections opened by the builder are closed with it.</p>
 */
public class ResourceGuard implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResourceGuard.class);

    private final KeyValueStore keyValueStore;
    private final LeaseStore leaseStore;
    private final DistributedLockManager lockManager;
    private final CacheConfig cacheConfig;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final List<AutoCloseable> ownedResources;

    private ResourceGuard(Builder builder, KeyValueStore keyValueStore, LeaseStore leaseStore,
                          List<AutoCloseable> ownedResources) {
        this.keyValueStore = keyValueStore;
        this.leaseStore = leaseStore;
        this.cacheConfig = builder.cacheConfig;
        this.objectMapper = builder.objectMapper;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.ownedResources = ownedResources;
        this.lockManager = new DistributedLockManager(leaseStore, builder.lockConfig, builder.clock,
                metricsService, tracingService);
    }

    /**
     * Creates a new, independent coalescer reporting to this guard's metrics and tracing.
     */
    public <V> RequestCoalescer<V> newCoalescer() {
        return new RequestCoalescer<>(metricsService, tracingService);
    }

    /**
     * Creates a read-through cache storing values of {@code type} as JSON.
     */
    public <V> ReadThroughCache<V> readThrough(Class<V> type, UpstreamFetcher<V> fetcher) {
        return readThrough(new JacksonValueCodec<>(objectMapper, type), fetcher);
    }

    /**
     * Creates a read-through cache with its own coalescer and the given codec.
     */
    public <V> ReadThroughCache<V> readThrough(ValueCodec<V> codec, UpstreamFetcher<V> fetcher) {
        RequestCoalescer<Optional<V>> coalescer = newCoalescer();
        return new ReadThroughCache<>(keyValueStore, fetcher, codec, coalescer, cacheConfig, metricsService);
    }

    public DistributedMutex newMutex(String name) {
        return lockManager.newMutex(name);
    }

    public DistributedLockManager getLockManager() {
        return lockManager;
    }

    public KeyValueStore getKeyValueStore() {
        return keyValueStore;
    }

    public LeaseStore getLeaseStore() {
        return leaseStore;
    }

    @Override
    public void close() {
        closeAll(ownedResources);
    }

    private static void closeAll(List<AutoCloseable> resources) {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Error closing {}", resource.getClass().getSimpleName(), e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private KeyValueStore keyValueStore;
        private LeaseStore leaseStore;
        private StoreBackend cacheBackend = StoreBackend.MEMORY;
        private StoreBackend leaseBackend = StoreBackend.MEMORY;
        private String redisHost;
        private int redisPort;
        private String falkorDBHost;
        private int falkorDBPort;
        private String falkorDBGraph;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private LockConfig lockConfig = LockConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper = new ObjectMapper();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private ConnectionFactory connections = ConnectionFactory.DEFAULT;

        /**
         * Redis connection used by the {@link StoreBackend#REDIS} backends.
         */
        public Builder redis(String host, int port) {
            this.redisHost = host;
            this.redisPort = port;
            return this;
        }

        /**
         * FalkorDB connection used by the {@link StoreBackend#FALKORDB} lease backend.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.falkorDBHost = host;
            this.falkorDBPort = port;
            this.falkorDBGraph = graphName;
            return this;
        }

        public Builder cacheBackend(StoreBackend backend) {
            this.cacheBackend = backend;
            return this;
        }

        public Builder leaseBackend(StoreBackend backend) {
            this.leaseBackend = backend;
            return this;
        }

        /**
         * Uses the given store for cached values, ignoring {@link #cacheBackend(StoreBackend)}.
         */
        public Builder keyValueStore(KeyValueStore store) {
            this.keyValueStore = store;
            return this;
        }

        /**
         * Uses the given store for lock leases, ignoring {@link #leaseBackend(StoreBackend)}.
         */
        public Builder leaseStore(LeaseStore store) {
            this.leaseStore = store;
            return this;
        }

        public Builder cacheConfig(CacheConfig config) {
            this.cacheConfig = config;
            return this;
        }

        public Builder lockConfig(LockConfig config) {
            this.lockConfig = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        Builder connectionFactory(ConnectionFactory connections) {
            this.connections = connections;
            return this;
        }

        /**
         * Validates the configuration, opens the required connections and builds the guard.
         *
         * @throws IllegalStateException if a selected backend is unsupported or not configured
         */
        public ResourceGuard build() {
            if (cacheConfig == null || lockConfig == null || clock == null || objectMapper == null
                    || metricsService == null || tracingService == null) {
                throw new IllegalStateException("cacheConfig, lockConfig, clock, objectMapper, metricsService "
                        + "and tracingService must not be null");
            }
            boolean needsRedis = (keyValueStore == null && cacheBackend == StoreBackend.REDIS)
                    || (leaseStore == null && leaseBackend == StoreBackend.REDIS);
            boolean needsFalkorDB = leaseStore == null && leaseBackend == StoreBackend.FALKORDB;
            if (keyValueStore == null && cacheBackend == StoreBackend.FALKORDB) {
                throw new IllegalStateException("FalkorDB cannot back the key-value cache, use memory or redis");
            }
            if (needsRedis && redisHost == null) {
                throw new IllegalStateException("Redis backend selected but no Redis connection configured");
            }
            if (needsFalkorDB && falkorDBHost == null) {
                throw new IllegalStateException("FalkorDB lease backend selected but no FalkorDB connection configured");
            }

            List<AutoCloseable> owned = new ArrayList<>();
            KeyValueStore kv;
            LeaseStore leases;
            try {
                JedisPooled jedis = null;
                if (needsRedis) {
                    jedis = connections.redis(redisHost, redisPort);
                    owned.add(jedis);
                }

                kv = keyValueStore;
                if (kv == null) {
                    kv = cacheBackend == StoreBackend.REDIS
                            ? new RedisKeyValueStore(jedis)
                            : new CaffeineKeyValueStore(cacheConfig);
                }

                leases = leaseStore;
                if (leases == null) {
                    if (leaseBackend == StoreBackend.REDIS) {
                        leases = new RedisLeaseStore(jedis);
                    } else if (leaseBackend == StoreBackend.FALKORDB) {
                        GraphConnection connection = connections.falkorDB(falkorDBHost, falkorDBPort, falkorDBGraph);
                        owned.add(connection);
                        leases = new GraphLeaseStore(connection, clock);
                    } else {
                        leases = new InMemoryLeaseStore(clock);
                    }
                }
            } catch (RuntimeException e) {
                closeAll(owned);
                throw e;
            }

            log.info("ResourceGuard built: keyValueStore={} leaseStore={}",
                    kv.getClass().getSimpleName(), leases.getClass().getSimpleName());
            return new ResourceGuard(this, kv, leases, owned);
        }
    }

    /**
     * Opens the connections selected by a {@link Builder}.
     */
    interface ConnectionFactory {
        ConnectionFactory DEFAULT = new ConnectionFactory() {
            @Override
            public JedisPooled redis(String host, int port) {
                return new JedisPooled(host, port);
            }

            @Override
            public GraphConnection falkorDB(String host, int port, String graphName) {
                return new FalkorDBConnection(host, port, graphName);
            }
        };

        JedisPooled redis(String host, int port);

        GraphConnection falkorDB(String host, int port, String graphName);
    }
}
