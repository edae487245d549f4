package com.resource.guard.metrics;

import java.time.Duration;

/**
 * Interface for recording coalescer, cache and lock metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCoalescedExecution(Duration duration, boolean succeeded);

    void recordCoalescedJoin();

    void recordCacheHit();

    void recordCacheMiss();

    void recordCacheError();

    void recordLockAcquired();

    void recordLockContended();

    void recordLockReleased(Duration heldFor);

    void recordLockOwnershipLost();
}
