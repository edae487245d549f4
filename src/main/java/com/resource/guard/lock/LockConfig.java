package com.resource.guard.lock;

import java.time.Duration;

/**
 * Configuration for distributed mutexes.
 *
 * @param leaseTtl   lifetime of a lease; protected work must finish well inside it or call
 *                   {@link DistributedMutex#extend()}
 * @param retryDelay pause between attempts of {@link DistributedMutex#lock(Duration)}
 * @param maxWait    default wait used by {@link DistributedLockManager#withLock}
 */
public record LockConfig(Duration leaseTtl, Duration retryDelay, Duration maxWait) {

    public LockConfig {
        requirePositive(leaseTtl, "leaseTtl");
        requirePositive(retryDelay, "retryDelay");
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0");
        }
    }

    /**
     * Default configuration: 30s lease, 100ms retry delay, 5s maximum wait.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(30), Duration.ofMillis(100), Duration.ofSeconds(5));
    }

    public LockConfig withLeaseTtl(Duration leaseTtl) {
        return new LockConfig(leaseTtl, retryDelay, maxWait);
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }
}
