package com.resource.guard.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AutoCloseable SLF4J MDC scope. On close, every entry set through this context is restored
 * to the value it had before, so contexts nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLock("acct:42", ownerToken)) {
 *     log.info("lease acquired");
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    // previous value per key, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for a coalesced execution of {@code key}.
     */
    public static LogContext forCall(String key) {
        return new LogContext()
                .with("operation", "coalesce")
                .with("coalesceKey", key);
    }

    /**
     * Context for lease operations on the lock {@code name}.
     */
    public static LogContext forLock(String name, String ownerToken) {
        return new LogContext()
                .with("operation", "lock")
                .with("lockName", name)
                .with("lockOwner", ownerToken);
    }

    /**
     * Adds another entry to this context. A {@code null} value is skipped.
     */
    public LogContext with(String key, String value) {
        if (value != null) {
            if (!previous.containsKey(key)) {
                previous.put(key, MDC.get(key));
            }
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        List<Map.Entry<String, String>> entries = new ArrayList<>(previous.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<String, String> entry = entries.get(i);
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}
