package com.resource.guard.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code guard.coalescer.execution} - Timer (tag: outcome=success|failure)</li>
 *   <li>{@code guard.coalescer.joined} - Counter, callers served by another caller's execution</li>
 *   <li>{@code guard.cache.hit}, {@code guard.cache.miss}, {@code guard.cache.error} - Counters</li>
 *   <li>{@code guard.lock.acquired}, {@code guard.lock.contended} - Counters</li>
 *   <li>{@code guard.lock.held} - Timer, time between acquisition and successful release</li>
 *   <li>{@code guard.lock.ownership.lost} - Counter, unlocks that found another owner or no lease</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer executionSuccessTimer;
    private final Timer executionFailureTimer;
    private final Counter joinedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter cacheErrorCounter;
    private final Counter lockAcquiredCounter;
    private final Counter lockContendedCounter;
    private final Timer lockHeldTimer;
    private final Counter ownershipLostCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.executionSuccessTimer = executionTimer(registry, "success");
        this.executionFailureTimer = executionTimer(registry, "failure");
        this.joinedCounter = Counter.builder("guard.coalescer.joined")
                .description("Callers that received the result of an execution started by another caller")
                .register(registry);
        this.cacheHitCounter = Counter.builder("guard.cache.hit")
                .description("Number of read-through cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("guard.cache.miss")
                .description("Number of read-through cache misses")
                .register(registry);
        this.cacheErrorCounter = Counter.builder("guard.cache.error")
                .description("Cache store failures treated as misses")
                .register(registry);
        this.lockAcquiredCounter = Counter.builder("guard.lock.acquired")
                .description("Successful lease acquisitions")
                .register(registry);
        this.lockContendedCounter = Counter.builder("guard.lock.contended")
                .description("Acquisition attempts rejected because another lease was live")
                .register(registry);
        this.lockHeldTimer = Timer.builder("guard.lock.held")
                .description("Time a lease was held before release")
                .register(registry);
        this.ownershipLostCounter = Counter.builder("guard.lock.ownership.lost")
                .description("Unlock attempts that no longer owned the lease")
                .register(registry);
    }

    private static Timer executionTimer(MeterRegistry registry, String outcome) {
        return Timer.builder("guard.coalescer.execution")
                .description("Duration of coalesced work executions")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordCoalescedExecution(Duration duration, boolean succeeded) {
        (succeeded ? executionSuccessTimer : executionFailureTimer).record(duration);
    }

    @Override
    public void recordCoalescedJoin() {
        joinedCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordCacheError() {
        cacheErrorCounter.increment();
    }

    @Override
    public void recordLockAcquired() {
        lockAcquiredCounter.increment();
    }

    @Override
    public void recordLockContended() {
        lockContendedCounter.increment();
    }

    @Override
    public void recordLockReleased(Duration heldFor) {
        lockHeldTimer.record(heldFor);
    }

    @Override
    public void recordLockOwnershipLost() {
        ownershipLostCounter.increment();
    }
}
