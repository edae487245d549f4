package com.resource.guard.lock;

import com.resource.guard.logging.LogContext;
import com.resource.guard.metrics.MetricsService;
import com.resource.guard.tracing.Span;
import com.resource.guard.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * A named lock shared by every process that uses the same {@link LeaseStore}.
 *
 * <p>Each acquisition writes a lease with a fresh owner token and a limited lifetime. A holder
 * that crashes therefore blocks the name only until its lease expires. Expiry does not
 * interrupt the holder: work that outlives the lease keeps running while another process may
 * acquire the lock, so protected work must finish well inside {@link LockConfig#leaseTtl()}
 * or call {@link #extend()}.</p>
 *
 * <p>Release checks the owner token, never just the name, so a holder whose lease already
 * expired cannot delete the lease of the next owner. Always release on every exit path, or
 * use {@link #withLock(Supplier)}.</p>
 *
 * <p>Obtain instances from {@link DistributedLockManager#newMutex(String)}.</p>
 */
public class DistributedMutex {
    private static final Logger log = LoggerFactory.getLogger(DistributedMutex.class);

    private final String name;
    private final LeaseStore store;
    private final LockConfig config;
    private final Clock clock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final AtomicReference<LockLease> current = new AtomicReference<>();

    DistributedMutex(String name, LeaseStore store, LockConfig config, Clock clock,
                     MetricsService metricsService, TracingService tracingService) {
        this.name = name;
        this.store = store;
        this.config = config;
        this.clock = clock;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    public String getName() {
        return name;
    }

    /**
     * Makes one attempt to acquire the lock. Does not retry.
     *
     * @return the lease now held
     * @throws LockContentionException if another owner holds an unexpired lease
     * @throws LeaseStoreException     if the store cannot be reached
     */
    public LockLease lock() {
        String ownerToken = newOwnerToken();
        Instant attemptedAt = clock.instant();

        try (LogContext ignored = LogContext.forLock(name, ownerToken);
             Span span = tracingService.startSpan("lock.acquire", Map.of("name", name))) {
            boolean acquired;
            try {
                acquired = store.tryCreate(name, ownerToken, config.leaseTtl());
            } catch (LeaseStoreException e) {
                span.fail(e);
                throw e;
            }
            span.setAttribute("acquired", acquired);
            span.succeed();

            if (!acquired) {
                metricsService.recordLockContended();
                log.debug("Lock {} is held by another owner", name);
                throw new LockContentionException(name);
            }

            LockLease lease = new LockLease(name, ownerToken, attemptedAt, attemptedAt.plus(config.leaseTtl()));
            current.set(lease);
            metricsService.recordLockAcquired();
            log.debug("Lock acquired: {} (expires {})", name, lease.expiresAt());
            return lease;
        }
    }

    /**
     * Retries {@link #lock()} every {@link LockConfig#retryDelay()} until it succeeds or
     * {@code maxWait} has passed.
     *
     * @throws LockContentionException  if the lock is still held by another owner after {@code maxWait}
     * @throws LockAcquisitionException if the thread is interrupted while waiting
     */
    public LockLease lock(Duration maxWait) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        long delayNanos = config.retryDelay().toNanos();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return lock();
            } catch (LockContentionException e) {
                if (System.nanoTime() + delayNanos > deadline) {
                    throw new LockContentionException(name,
                            "Failed to acquire lock '" + name + "' within " + maxWait.toMillis()
                                    + "ms (" + attempts + " attempts)");
                }
            }
            try {
                TimeUnit.NANOSECONDS.sleep(delayNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while acquiring lock '" + name + "'", e);
            }
        }
    }

    /**
     * Releases the lease held through this mutex, if this mutex is still its owner.
     *
     * @return {@code true} if the lease was released; {@code false} if nothing was held or the
     * lease had expired or been taken over by another owner
     * @throws LeaseStoreException if the store cannot be reached; the lease is kept locally so
     *                             the release can be retried
     */
    public boolean unlock() {
        LockLease lease = current.getAndSet(null);
        if (lease == null) {
            log.debug("Unlock of {} with no lease held", name);
            return false;
        }

        try (LogContext ignored = LogContext.forLock(name, lease.ownerToken());
             Span span = tracingService.startSpan("lock.release", Map.of("name", name))) {
            boolean released;
            try {
                released = store.deleteIfOwner(name, lease.ownerToken());
            } catch (LeaseStoreException e) {
                current.compareAndSet(null, lease);
                span.fail(e);
                throw e;
            }
            span.setAttribute("released", released);
            span.succeed();

            if (released) {
                metricsService.recordLockReleased(Duration.between(lease.acquiredAt(), clock.instant()));
                log.debug("Lock released: {}", name);
            } else {
                metricsService.recordLockOwnershipLost();
                log.warn("Lease on {} expired before release (ttl {}); the protected work may have overlapped another owner",
                        name, config.leaseTtl());
            }
            return released;
        }
    }

    /**
     * Pushes the expiry of the held lease to {@link LockConfig#leaseTtl()} from now.
     *
     * @return {@code false} if nothing is held or the lease is no longer owned by this mutex
     */
    public boolean extend() {
        LockLease lease = current.get();
        if (lease == null) {
            return false;
        }

        Instant now = clock.instant();
        if (store.extendIfOwner(name, lease.ownerToken(), config.leaseTtl())) {
            current.compareAndSet(lease, lease.withExpiresAt(now.plus(config.leaseTtl())));
            log.debug("Lease on {} extended by {}", name, config.leaseTtl());
            return true;
        }

        current.compareAndSet(lease, null);
        metricsService.recordLockOwnershipLost();
        log.warn("Lease on {} could not be extended, ownership lost", name);
        return false;
    }

    /**
     * Runs {@code body} while holding the lock and releases it on every exit path.
     *
     * @throws LockContentionException if the lock cannot be acquired with one attempt
     * @throws LockOwnershipException  if the lease was lost before {@code body} finished; when
     *                                 {@code body} itself failed this is attached as suppressed
     */
    public <T> T withLock(Supplier<T> body) {
        return runHolding(lock(), body);
    }

    /**
     * Like {@link #withLock(Supplier)} but waits up to {@code maxWait} for the lock.
     */
    public <T> T withLock(Duration maxWait, Supplier<T> body) {
        return runHolding(lock(maxWait), body);
    }

    private <T> T runHolding(LockLease lease, Supplier<T> body) {
        T result;
        try {
            result = body.get();
        } catch (RuntimeException | Error e) {
            try {
                if (!unlock()) {
                    e.addSuppressed(new LockOwnershipException(name, lease.ownerToken()));
                }
            } catch (LeaseStoreException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        if (!unlock()) {
            throw new LockOwnershipException(name, lease.ownerToken());
        }
        return result;
    }

    /**
     * Returns the lease acquired through this mutex and not yet released, if any.
     * The store remains authoritative; the lease may have been lost meanwhile.
     */
    public Optional<LockLease> currentLease() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Whether this mutex holds a lease that has not expired by the local clock.
     */
    public boolean isHeld() {
        LockLease lease = current.get();
        return lease != null && !lease.isExpiredAt(clock.instant());
    }

    private static String newOwnerToken() {
        return ProcessHandle.current().pid() + "-" + UUID.randomUUID();
    }
}
