package com.resource.guard.tracing;

/**
 * A traced unit of work. Ends when closed, so it fits try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan("lock.acquire", Map.of("name", name))) {
 *     ...
 *     span.succeed();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Marks the span as completed successfully.
     */
    void succeed();

    /**
     * Records the failure on the span and marks it as errored.
     */
    void fail(Throwable t);

    @Override
    void close();
}
