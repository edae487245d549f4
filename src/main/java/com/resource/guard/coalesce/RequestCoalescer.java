package com.resource.guard.coalesce;

import com.resource.guard.logging.LogContext;
import com.resource.guard.metrics.MetricsService;
import com.resource.guard.metrics.NoOpMetricsService;
import com.resource.guard.tracing.NoOpTracingService;
import com.resource.guard.tracing.Span;
import com.resource.guard.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collapses concurrent executions of the same work into one.
 *
 * <p>The first caller of {@link #execute(String, Callable)} for a key runs the work function
 * on its own thread. Callers that arrive for the same key while it runs block until it
 * finishes and receive the same value, or the same exception, instead of running the work
 * again. Once the execution completes the key is released and the next caller starts a
 * new execution; results and errors are never cached here.</p>
 *
 * <p>Instances are explicitly constructed and owned; keep one per logical result type.
 * When a coalescer must be shared by call sites with different result types, use
 * {@link #execute(String, Class, Callable)} so a mismatch is reported instead of coerced.</p>
 *
 * @param <V> result type of the coalesced work
 */
public class RequestCoalescer<V> {
    private static final Logger log = LoggerFactory.getLogger(RequestCoalescer.class);

    // guards calls and every Call's join counter
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, Call<V>> calls = new HashMap<>();

    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Executor asyncExecutor;

    public RequestCoalescer() {
        this(new NoOpMetricsService(), new NoOpTracingService());
    }

    public RequestCoalescer(MetricsService metricsService, TracingService tracingService) {
        this(metricsService, tracingService, ForkJoinPool.commonPool());
    }

    /**
     * @param asyncExecutor runs the work started through {@link #executeAsync(String, Callable)}
     */
    public RequestCoalescer(MetricsService metricsService, TracingService tracingService, Executor asyncExecutor) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.tracingService = Objects.requireNonNull(tracingService, "tracingService");
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
    }

    /**
     * Runs {@code work} for {@code key}, or waits for the execution already in flight for it.
     *
     * @return the value produced by the single execution
     * @throws RuntimeException             the unchecked exception thrown by the work, unchanged
     * @throws CoalescedExecutionException  if the work threw a checked exception
     */
    public V execute(String key, Callable<? extends V> work) {
        return executeForResult(key, work).getOrThrow();
    }

    /**
     * Typed variant of {@link #execute(String, Callable)} for coalescers shared across
     * result types.
     *
     * @throws CoalescerTypeException if the execution joined for {@code key} produced a
     *                                value that is not an {@code expectedType}
     */
    public <T extends V> T execute(String key, Class<T> expectedType, Callable<T> work) {
        Objects.requireNonNull(expectedType, "expectedType");
        V value = execute(key, work);
        if (value != null && !expectedType.isInstance(value)) {
            throw new CoalescerTypeException(key, expectedType, value.getClass());
        }
        return expectedType.cast(value);
    }

    /**
     * Like {@link #execute(String, Callable)} but returns the outcome instead of throwing it.
     */
    public CallResult<V> executeForResult(String key, Callable<? extends V> work) {
        validate(key, work);

        Registration<V> registration = register(key);
        if (registration.leader()) {
            return lead(registration.call(), work);
        }
        log.debug("Joined in-flight execution for key {}", key);
        metricsService.recordCoalescedJoin();
        return registration.call().await().asShared(true);
    }

    /**
     * Non-blocking variant. The returned future is independent of the shared execution:
     * cancelling it or timing it out does not affect other callers or stop the work.
     */
    public CompletableFuture<CallResult<V>> executeAsync(String key, Callable<? extends V> work) {
        validate(key, work);

        Registration<V> registration = register(key);
        if (!registration.leader()) {
            metricsService.recordCoalescedJoin();
            return registration.call().future().thenApply(result -> result.asShared(true));
        }

        Call<V> started = registration.call();
        try {
            asyncExecutor.execute(() -> lead(started, work));
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected coalesced work for key {}", key);
            complete(started, CallResult.failure(e));
        }
        return started.future().copy();
    }

    /**
     * Deregisters the in-flight executions for the given keys without waiting for them.
     * Callers already waiting still receive the running execution's result; the next
     * caller for a forgotten key starts a new execution.
     */
    public void forget(String... keys) {
        registryLock.lock();
        try {
            for (String key : keys) {
                if (calls.remove(key) != null) {
                    log.debug("Forgot in-flight execution for key {}", key);
                }
            }
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Returns the number of keys with an execution in flight.
     */
    public int inFlight() {
        registryLock.lock();
        try {
            return calls.size();
        } finally {
            registryLock.unlock();
        }
    }

    private Registration<V> register(String key) {
        registryLock.lock();
        try {
            Call<V> existing = calls.get(key);
            if (existing != null) {
                existing.join();
                return new Registration<>(existing, false);
            }
            Call<V> call = new Call<>(key);
            calls.put(key, call);
            return new Registration<>(call, true);
        } finally {
            registryLock.unlock();
        }
    }

    private CallResult<V> lead(Call<V> call, Callable<? extends V> work) {
        long startNanos = System.nanoTime();
        CallResult<V> outcome = null;
        CallResult<V> published = null;
        try (LogContext ignored = LogContext.forCall(call.key());
             Span span = tracingService.startSpan("coalescer.execute", Map.of("key", call.key()))) {
            outcome = invoke(call.key(), work);
            if (outcome.isSuccess()) {
                span.succeed();
            } else {
                span.fail(outcome.error());
                log.debug("Coalesced execution for key {} failed: {}", call.key(), outcome.error().toString());
            }
            published = complete(call, outcome);
            span.setAttribute("shared", published.shared());
        } catch (RuntimeException | Error e) {
            // the call is published on every path
            log.warn("Instrumentation of coalesced execution for key {} failed", call.key(), e);
            if (published == null) {
                published = complete(call, outcome != null ? outcome : CallResult.failure(e));
            }
        }
        metricsService.recordCoalescedExecution(Duration.ofNanos(System.nanoTime() - startNanos), published.isSuccess());
        return published;
    }

    private CallResult<V> invoke(String key, Callable<? extends V> work) {
        try {
            return CallResult.success(work.call());
        } catch (RuntimeException | Error e) {
            return CallResult.failure(e);
        } catch (Exception e) {
            return CallResult.failure(new CoalescedExecutionException(key, e));
        }
    }

    /**
     * Deregisters the call, then publishes the outcome. A caller arriving after deregistration
     * starts a new execution; callers that already joined hold the future. The future is
     * completed outside the registry lock because dependent stages run on this thread.
     */
    private CallResult<V> complete(Call<V> call, CallResult<V> outcome) {
        CallResult<V> published;
        registryLock.lock();
        try {
            published = outcome.asShared(call.joined() > 0);
            // a forgotten call may already have a successor registered under the same key
            if (calls.get(call.key()) == call) {
                calls.remove(call.key());
            }
        } finally {
            registryLock.unlock();
        }
        call.complete(published);
        return published;
    }

    private static void validate(String key, Callable<?> work) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be null or empty");
        }
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
    }

    private record Registration<V>(Call<V> call, boolean leader) {}
}
