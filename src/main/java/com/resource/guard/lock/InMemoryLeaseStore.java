package com.resource.guard.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process {@link LeaseStore}. Conditional writes run inside {@link ConcurrentHashMap#compute},
 * which is atomic per name. Suitable for single-JVM deployments and tests.
 */
public class InMemoryLeaseStore implements LeaseStore {

    private final ConcurrentHashMap<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLeaseStore() {
        this(Clock.systemUTC());
    }

    public InMemoryLeaseStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryCreate(String name, String ownerToken, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean created = new AtomicBoolean(false);
        leases.compute(name, (key, existing) -> {
            if (existing != null && !existing.isExpiredAt(now)) {
                return existing;
            }
            created.set(true);
            return new Lease(ownerToken, now.plus(ttl));
        });
        return created.get();
    }

    @Override
    public boolean deleteIfOwner(String name, String ownerToken) {
        Instant now = clock.instant();
        AtomicBoolean deleted = new AtomicBoolean(false);
        leases.computeIfPresent(name, (key, existing) -> {
            if (!existing.owner().equals(ownerToken)) {
                return existing;
            }
            deleted.set(!existing.isExpiredAt(now));
            return null;
        });
        return deleted.get();
    }

    @Override
    public boolean extendIfOwner(String name, String ownerToken, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean extended = new AtomicBoolean(false);
        leases.computeIfPresent(name, (key, existing) -> {
            if (!existing.owner().equals(ownerToken) || existing.isExpiredAt(now)) {
                return existing;
            }
            extended.set(true);
            return new Lease(ownerToken, now.plus(ttl));
        });
        return extended.get();
    }

    @Override
    public Optional<String> currentOwner(String name) {
        Lease lease = leases.get(name);
        if (lease == null || lease.isExpiredAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(lease.owner());
    }

    private record Lease(String owner, Instant expiresAt) {
        boolean isExpiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
