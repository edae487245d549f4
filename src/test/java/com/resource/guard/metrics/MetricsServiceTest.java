package com.resource.guard.metrics;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCoalescedExecution(Duration.ofMillis(10), true);
                noOp.recordCoalescedJoin();
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordCacheError();
                noOp.recordLockAcquired();
                noOp.recordLockContended();
                noOp.recordLockReleased(Duration.ofMillis(5));
                noOp.recordLockOwnershipLost();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should time executions by outcome")
        void executionTimers() {
            metrics.recordCoalescedExecution(Duration.ofMillis(100), true);
            metrics.recordCoalescedExecution(Duration.ofMillis(300), false);
            metrics.recordCoalescedExecution(Duration.ofMillis(200), true);

            Timer success = registry.find("guard.coalescer.execution").tag("outcome", "success").timer();
            Timer failure = registry.find("guard.coalescer.execution").tag("outcome", "failure").timer();
            assertNotNull(success);
            assertEquals(2, success.count());
            assertEquals(1, failure.count());
        }

        @Test
        @DisplayName("Should count joins and cache outcomes")
        void counters() {
            metrics.recordCoalescedJoin();
            metrics.recordCoalescedJoin();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheError();

            assertEquals(2.0, registry.counter("guard.coalescer.joined").count());
            assertEquals(1.0, registry.counter("guard.cache.hit").count());
            assertEquals(1.0, registry.counter("guard.cache.miss").count());
            assertEquals(1.0, registry.counter("guard.cache.error").count());
        }

        @Test
        @DisplayName("Should record lock lifecycle")
        void lockMetrics() {
            metrics.recordLockAcquired();
            metrics.recordLockContended();
            metrics.recordLockReleased(Duration.ofMillis(40));
            metrics.recordLockOwnershipLost();

            assertEquals(1.0, registry.counter("guard.lock.acquired").count());
            assertEquals(1.0, registry.counter("guard.lock.contended").count());
            assertEquals(1.0, registry.counter("guard.lock.ownership.lost").count());
            assertEquals(1, registry.find("guard.lock.held").timer().count());
        }
    }
}
