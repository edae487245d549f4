package com.resource.guard.coalesce;

import com.resource.guard.support.RecordingMetricsService;
import com.resource.guard.tracing.NoOpTracingService;
import com.resource.guard.tracing.Span;
import com.resource.guard.tracing.TracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.resource.guard.support.RecordingMetricsService.awaitCount;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("RequestCoalescer Tests")
class RequestCoalescerTest {

    private RecordingMetricsService metrics;
    private RequestCoalescer<String> coalescer;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        metrics = new RecordingMetricsService();
        coalescer = new RequestCoalescer<>(metrics, new NoOpTracingService());
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Nested
    @DisplayName("Single caller")
    class SingleCallerTests {

        @Test
        @DisplayName("Should return the work's value and not mark it shared")
        void returnsValue() {
            CallResult<String> result = coalescer.executeForResult("product:1", () -> "laptop");

            assertEquals("laptop", result.value());
            assertTrue(result.isSuccess());
            assertFalse(result.shared());
            assertEquals(0, coalescer.inFlight());
        }

        @Test
        @DisplayName("Should allow null results")
        void nullResult() {
            assertNull(coalescer.execute("product:1", () -> null));
        }

        @Test
        @DisplayName("Should run the work again on each sequential call")
        void noCachingBetweenCalls() {
            AtomicInteger runs = new AtomicInteger();

            coalescer.execute("product:1", () -> "v" + runs.incrementAndGet());
            String second = coalescer.execute("product:1", () -> "v" + runs.incrementAndGet());

            assertEquals("v2", second);
            assertEquals(2, runs.get());
        }

        @Test
        @DisplayName("Should not cache failures either")
        void noCachingOfErrors() {
            assertThrows(IllegalStateException.class,
                    () -> coalescer.execute("product:1", () -> {
                        throw new IllegalStateException("db down");
                    }));

            assertEquals("recovered", coalescer.execute("product:1", () -> "recovered"));
        }

        @Test
        @DisplayName("Should rethrow unchecked exceptions unchanged")
        void uncheckedUnchanged() {
            IllegalStateException failure = new IllegalStateException("boom");

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> coalescer.execute("k", () -> {
                        throw failure;
                    }));
            assertSame(failure, thrown);
            assertEquals(1, metrics.failedExecutions.get());
        }

        @Test
        @DisplayName("Should wrap checked exceptions with the key")
        void checkedWrapped() {
            CoalescedExecutionException thrown = assertThrows(CoalescedExecutionException.class,
                    () -> coalescer.execute("product:9", () -> {
                        throw new IOException("socket closed");
                    }));

            assertEquals("product:9", thrown.getKey());
            assertInstanceOf(IOException.class, thrown.getCause());
        }

        @Test
        @DisplayName("Should reject empty keys and missing work")
        void rejectsInvalidArguments() {
            assertThrows(IllegalArgumentException.class, () -> coalescer.execute("", () -> "x"));
            assertThrows(IllegalArgumentException.class, () -> coalescer.execute(null, () -> "x"));
            assertThrows(IllegalArgumentException.class, () -> coalescer.execute("k", null));
        }
    }

    @Nested
    @DisplayName("Concurrent callers")
    class ConcurrentTests {

        @Test
        @DisplayName("Should execute the work once for callers of the same key")
        void coalescesSameKey() throws Exception {
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<CallResult<String>> leader = pool.submit(() -> coalescer.executeForResult("product:1", () -> {
                runs.incrementAndGet();
                started.countDown();
                release.await();
                return "laptop";
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            List<Future<CallResult<String>>> waiters = new ArrayList<>();
            for (int i = 0; i < 9; i++) {
                waiters.add(pool.submit(() -> coalescer.executeForResult("product:1", () -> {
                    runs.incrementAndGet();
                    return "duplicate";
                })));
            }
            awaitCount(metrics.joins::get, 9);
            release.countDown();

            CallResult<String> leaderResult = leader.get(5, TimeUnit.SECONDS);
            assertEquals("laptop", leaderResult.value());
            assertTrue(leaderResult.shared());
            for (Future<CallResult<String>> waiter : waiters) {
                CallResult<String> result = waiter.get(5, TimeUnit.SECONDS);
                assertEquals("laptop", result.value());
                assertTrue(result.shared());
            }
            assertEquals(1, runs.get());
            assertEquals(1, metrics.executions.get());
            assertEquals(0, coalescer.inFlight());
        }

        @Test
        @DisplayName("Should deliver the same exception instance to every waiter")
        void sharesErrors() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            IllegalStateException failure = new IllegalStateException("upstream unavailable");

            Future<CallResult<String>> leader = pool.submit(() -> coalescer.executeForResult("product:1", () -> {
                started.countDown();
                release.await();
                throw failure;
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<CallResult<String>> waiter = pool.submit(() -> coalescer.executeForResult("product:1", () -> "unused"));
            awaitCount(metrics.joins::get, 1);
            release.countDown();

            assertSame(failure, leader.get(5, TimeUnit.SECONDS).error());
            assertSame(failure, waiter.get(5, TimeUnit.SECONDS).error());
        }

        @Test
        @DisplayName("Should run different keys independently")
        void independentKeys() throws Exception {
            CountDownLatch bothStarted = new CountDownLatch(2);

            Future<String> first = pool.submit(() -> coalescer.execute("product:1", () -> {
                bothStarted.countDown();
                assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
                return "one";
            }));
            Future<String> second = pool.submit(() -> coalescer.execute("product:2", () -> {
                bothStarted.countDown();
                assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
                return "two";
            }));

            assertEquals("one", first.get(5, TimeUnit.SECONDS));
            assertEquals("two", second.get(5, TimeUnit.SECONDS));
            assertEquals(0, metrics.joins.get());
        }
    }

    @Nested
    @DisplayName("forget")
    class ForgetTests {

        @Test
        @DisplayName("Should start a new execution after forget while the old one still runs")
        void newGenerationAfterForget() throws Exception {
            CountDownLatch firstStarted = new CountDownLatch(1);
            CountDownLatch releaseFirst = new CountDownLatch(1);
            CountDownLatch secondStarted = new CountDownLatch(1);
            CountDownLatch releaseSecond = new CountDownLatch(1);

            Future<String> first = pool.submit(() -> coalescer.execute("product:1", () -> {
                firstStarted.countDown();
                releaseFirst.await();
                return "old";
            }));
            assertTrue(firstStarted.await(5, TimeUnit.SECONDS));

            coalescer.forget("product:1");
            assertEquals(0, coalescer.inFlight());

            Future<String> second = pool.submit(() -> coalescer.execute("product:1", () -> {
                secondStarted.countDown();
                releaseSecond.await();
                return "new";
            }));
            assertTrue(secondStarted.await(5, TimeUnit.SECONDS));

            releaseFirst.countDown();
            assertEquals("old", first.get(5, TimeUnit.SECONDS));
            // the finished first execution must not deregister its successor
            assertEquals(1, coalescer.inFlight());

            Future<String> joiner = pool.submit(() -> coalescer.execute("product:1", () -> "third"));
            awaitCount(metrics.joins::get, 1);
            releaseSecond.countDown();

            assertEquals("new", second.get(5, TimeUnit.SECONDS));
            assertEquals("new", joiner.get(5, TimeUnit.SECONDS));
            assertEquals(0, coalescer.inFlight());
        }

        @Test
        @DisplayName("Should ignore keys with nothing in flight")
        void forgetUnknownKey() {
            assertDoesNotThrow(() -> coalescer.forget("missing", "also-missing"));
        }
    }

    @Nested
    @DisplayName("Typed execute")
    class TypedTests {

        @Test
        @DisplayName("Should report a joined execution of a different type")
        void reportsTypeMismatch() throws Exception {
            RequestCoalescer<Object> shared = new RequestCoalescer<>(metrics, new NoOpTracingService());
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<Integer> leader = pool.submit(() -> shared.execute("config:ttl", Integer.class, () -> {
                started.countDown();
                release.await();
                return 300;
            }));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<String> waiter = pool.submit(() -> shared.execute("config:ttl", String.class, () -> "300s"));
            awaitCount(metrics.joins::get, 1);
            release.countDown();

            assertEquals(300, leader.get(5, TimeUnit.SECONDS));
            Exception thrown = assertThrows(Exception.class, () -> waiter.get(5, TimeUnit.SECONDS));
            CoalescerTypeException mismatch = assertInstanceOf(CoalescerTypeException.class, thrown.getCause());
            assertEquals("config:ttl", mismatch.getKey());
            assertEquals(String.class, mismatch.getExpectedType());
            assertEquals(Integer.class, mismatch.getActualType());
        }

        @Test
        @DisplayName("Should return the value when the type matches")
        void matchingType() {
            RequestCoalescer<Object> shared = new RequestCoalescer<>();

            assertEquals("abc", shared.execute("k", String.class, () -> "abc"));
        }
    }

    @Nested
    @DisplayName("executeAsync")
    class AsyncTests {

        @Test
        @DisplayName("Should share one execution between async and blocking callers")
        void asyncAndBlockingShare() throws Exception {
            RequestCoalescer<String> async = new RequestCoalescer<>(metrics, new NoOpTracingService(), pool);
            AtomicInteger runs = new AtomicInteger();
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<CallResult<String>> leader = async.executeAsync("product:1", () -> {
                runs.incrementAndGet();
                started.countDown();
                release.await();
                return "laptop";
            });
            assertTrue(started.await(5, TimeUnit.SECONDS));
            CompletableFuture<CallResult<String>> waiter = async.executeAsync("product:1", () -> "unused");
            assertFalse(waiter.isDone());
            release.countDown();

            assertEquals("laptop", leader.get(5, TimeUnit.SECONDS).value());
            CallResult<String> joined = waiter.get(5, TimeUnit.SECONDS);
            assertEquals("laptop", joined.value());
            assertTrue(joined.shared());
            assertEquals(1, runs.get());
        }

        @Test
        @DisplayName("Cancelling a caller's future should not affect the execution")
        void cancelIsLocal() throws Exception {
            RequestCoalescer<String> async = new RequestCoalescer<>(metrics, new NoOpTracingService(), pool);
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<CallResult<String>> leader = async.executeAsync("k", () -> {
                release.await();
                return "done";
            });
            CompletableFuture<CallResult<String>> waiter = async.executeAsync("k", () -> "unused");
            leader.cancel(true);
            release.countDown();

            assertEquals("done", waiter.get(5, TimeUnit.SECONDS).value());
        }

        @Test
        @DisplayName("Should fail the call when the executor rejects the work")
        void rejectedExecution() throws Exception {
            RequestCoalescer<String> rejecting = new RequestCoalescer<>(metrics, new NoOpTracingService(),
                    command -> {
                        throw new RejectedExecutionException("saturated");
                    });

            CallResult<String> result = rejecting.executeAsync("k", () -> "never").get(5, TimeUnit.SECONDS);

            assertInstanceOf(RejectedExecutionException.class, result.error());
            assertEquals(0, rejecting.inFlight());
        }
    }

    @Nested
    @DisplayName("Publication")
    class PublicationTests {

        @Test
        @DisplayName("A stage chained on one key may wait for another key without blocking the coalescer")
        void chainedStageWaitsOnOtherKey() throws Exception {
            RequestCoalescer<String> async = new RequestCoalescer<>(metrics, new NoOpTracingService(), pool);
            CountDownLatch bStarted = new CountDownLatch(1);
            CountDownLatch releaseA = new CountDownLatch(1);
            CountDownLatch releaseB = new CountDownLatch(1);

            Future<String> leaderB = pool.submit(() -> async.execute("B", () -> {
                bStarted.countDown();
                releaseB.await();
                return "b";
            }));
            assertTrue(bStarted.await(5, TimeUnit.SECONDS));

            CompletableFuture<String> chained = async.executeAsync("A", () -> {
                releaseA.await();
                return "a";
            }).thenApply(result -> async.execute("B", () -> "unused"));

            releaseA.countDown();
            awaitCount(metrics.joins::get, 1);

            Future<String> other = pool.submit(() -> async.execute("C", () -> "c"));
            assertEquals("c", other.get(5, TimeUnit.SECONDS));

            releaseB.countDown();
            assertEquals("b", leaderB.get(5, TimeUnit.SECONDS));
            assertEquals("b", chained.get(5, TimeUnit.SECONDS));
            assertEquals(0, async.inFlight());
        }

        @Test
        @DisplayName("A failing tracer should fail the execution and release the key")
        void failingTracerReleasesKey() throws Exception {
            AtomicInteger spans = new AtomicInteger();
            TracingService failingOnce = (name, attributes) -> {
                if (spans.incrementAndGet() == 1) {
                    throw new IllegalStateException("exporter unavailable");
                }
                return new NoOpTracingService().startSpan(name, attributes);
            };
            RequestCoalescer<String> traced = new RequestCoalescer<>(metrics, failingOnce);

            CallResult<String> failed = traced.executeForResult("product:1", () -> "laptop");

            assertInstanceOf(IllegalStateException.class, failed.error());
            assertEquals(0, traced.inFlight());
            Future<String> next = pool.submit(() -> traced.execute("product:1", () -> "laptop"));
            assertEquals("laptop", next.get(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("A span failing after the work succeeded should still deliver the value")
        void failingSpanKeepsValue() {
            Span span = mock(Span.class);
            doThrow(new IllegalStateException("span ended")).when(span).succeed();
            RequestCoalescer<String> traced = new RequestCoalescer<>(metrics, (name, attributes) -> span);

            assertEquals("laptop", traced.execute("product:1", () -> "laptop"));
            assertEquals(0, traced.inFlight());
        }
    }
}
