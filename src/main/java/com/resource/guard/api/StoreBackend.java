package com.resource.guard.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Backends that can hold cached values or lock leases.
 */
public enum StoreBackend {
    MEMORY,
    REDIS,
    FALKORDB;

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @throws IllegalArgumentException if {@code value} names no backend
     */
    public static StoreBackend parse(String value) {
        if (value != null) {
            for (StoreBackend backend : values()) {
                if (backend.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return backend;
                }
            }
        }
        throw new IllegalArgumentException("Unknown store backend '" + value + "', expected one of "
                + Arrays.stream(values()).map(b -> b.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", ")));
    }
}
