package com.resource.guard.lock;

import java.time.Duration;
import java.time.Instant;

/**
 * Local record of a lease obtained from a {@link LeaseStore}. The expiry is measured from
 * the moment the acquisition was attempted, so it never outlasts the store's own record.
 *
 * @param name       lock name
 * @param ownerToken token identifying this acquisition
 * @param acquiredAt when the acquisition was attempted
 * @param expiresAt  when the lease lapses unless extended
 */
public record LockLease(String name, String ownerToken, Instant acquiredAt, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Duration remainingAt(Instant now) {
        return isExpiredAt(now) ? Duration.ZERO : Duration.between(now, expiresAt);
    }

    LockLease withExpiresAt(Instant newExpiry) {
        return new LockLease(name, ownerToken, acquiredAt, newExpiry);
    }
}
