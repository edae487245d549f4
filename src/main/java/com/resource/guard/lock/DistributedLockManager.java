package com.resource.guard.lock;

import com.resource.guard.metrics.MetricsService;
import com.resource.guard.metrics.NoOpMetricsService;
import com.resource.guard.tracing.NoOpTracingService;
import com.resource.guard.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates {@link DistributedMutex} instances that share one {@link LeaseStore} and configuration.
 */
public class DistributedLockManager {
    private static final Logger log = LoggerFactory.getLogger(DistributedLockManager.class);

    private final LeaseStore store;
    private final LockConfig config;
    private final Clock clock;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public DistributedLockManager(LeaseStore store) {
        this(store, LockConfig.defaults());
    }

    public DistributedLockManager(LeaseStore store, LockConfig config) {
        this(store, config, Clock.systemUTC(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public DistributedLockManager(LeaseStore store, LockConfig config, Clock clock,
                                  MetricsService metricsService, TracingService tracingService) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService");
        log.info("DistributedLockManager initialized: store={} leaseTtl={}",
                store.getClass().getSimpleName(), config.leaseTtl());
    }

    /**
     * Returns a mutex for {@code name}. Mutexes are cheap; create one per critical section use.
     */
    public DistributedMutex newMutex(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name must not be blank");
        }
        return new DistributedMutex(name, store, config, clock, metricsService, tracingService);
    }

    /**
     * Acquires {@code name}, waiting up to {@link LockConfig#maxWait()}, runs {@code body} and
     * releases the lock.
     *
     * @throws LockContentionException if the lock stays held by another owner past the wait
     * @throws LockOwnershipException  if the lease was lost before {@code body} finished
     */
    public <T> T withLock(String name, Supplier<T> body) {
        return newMutex(name).withLock(config.maxWait(), body);
    }

    public LockConfig getConfig() {
        return config;
    }
}
