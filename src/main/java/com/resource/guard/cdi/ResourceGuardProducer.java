package com.resource.guard.cdi;

import com.resource.guard.api.ResourceGuard;
import com.resource.guard.api.StoreBackend;
import com.resource.guard.cache.CacheConfig;
import com.resource.guard.lock.DistributedLockManager;
import com.resource.guard.lock.LockConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires a {@link ResourceGuard} from MicroProfile Config properties.
 *
 * <pre>
 * resource-guard:
 *   cache:
 *     backend: redis
 *     ttl-seconds: 300
 *   lock:
 *     backend: redis
 *     lease-ttl-millis: 30000
 *   redis:
 *     host: localhost
 *     port: 6379
 * </pre>
 *
 * <p>An unknown backend name or a backend without connection settings fails bean creation
 * with an exception rather than stopping the process.</p>
 */
@ApplicationScoped
public class ResourceGuardProducer {

    private static final Logger log = LoggerFactory.getLogger(ResourceGuardProducer.class);

    // ── Backends ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "resource-guard.cache.backend", defaultValue = "memory")
    String cacheBackend;

    @Inject
    @ConfigProperty(name = "resource-guard.lock.backend", defaultValue = "memory")
    String lockBackend;

    // ── Redis ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "resource-guard.redis.host", defaultValue = "localhost")
    String redisHost;

    @Inject
    @ConfigProperty(name = "resource-guard.redis.port", defaultValue = "6379")
    int redisPort;

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "resource-guard.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "resource-guard.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "resource-guard.falkordb.graph-name", defaultValue = "resource-guard")
    String falkordbGraphName;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "resource-guard.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "resource-guard.cache.ttl-seconds", defaultValue = "300")
    long cacheTtlSeconds;

    @Inject
    @ConfigProperty(name = "resource-guard.cache.write-back", defaultValue = "true")
    boolean cacheWriteBack;

    // ── Lock ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "resource-guard.lock.lease-ttl-millis", defaultValue = "30000")
    long leaseTtlMillis;

    @Inject
    @ConfigProperty(name = "resource-guard.lock.retry-delay-millis", defaultValue = "100")
    long retryDelayMillis;

    @Inject
    @ConfigProperty(name = "resource-guard.lock.max-wait-millis", defaultValue = "5000")
    long maxWaitMillis;

    @Produces
    @ApplicationScoped
    public ResourceGuard resourceGuard() {
        StoreBackend cache = StoreBackend.parse(cacheBackend);
        StoreBackend leases = StoreBackend.parse(lockBackend);
        log.info("Producing ResourceGuard: cache={} lock={}", cache, leases);

        return ResourceGuard.builder()
                .cacheBackend(cache)
                .leaseBackend(leases)
                .redis(redisHost, redisPort)
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .cacheConfig(cacheConfig())
                .lockConfig(lockConfig())
                .build();
    }

    @Produces
    @ApplicationScoped
    public DistributedLockManager distributedLockManager(ResourceGuard guard) {
        return guard.getLockManager();
    }

    public void closeResourceGuard(@Disposes ResourceGuard guard) {
        log.info("Closing ResourceGuard");
        guard.close();
    }

    CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, Duration.ofSeconds(cacheTtlSeconds), cacheWriteBack);
    }

    LockConfig lockConfig() {
        return new LockConfig(Duration.ofMillis(leaseTtlMillis), Duration.ofMillis(retryDelayMillis),
                Duration.ofMillis(maxWaitMillis));
    }
}
