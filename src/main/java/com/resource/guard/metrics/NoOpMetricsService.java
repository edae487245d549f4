package com.resource.guard.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCoalescedExecution(Duration duration, boolean succeeded) {
    }

    @Override
    public void recordCoalescedJoin() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordCacheError() {
    }

    @Override
    public void recordLockAcquired() {
    }

    @Override
    public void recordLockContended() {
    }

    @Override
    public void recordLockReleased(Duration heldFor) {
    }

    @Override
    public void recordLockOwnershipLost() {
    }
}
