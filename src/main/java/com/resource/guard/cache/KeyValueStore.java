package com.resource.guard.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store backing a {@link ReadThroughCache}.
 * Any store with get/set/TTL semantics satisfies it.
 */
public interface KeyValueStore {

    /**
     * Reads the raw value stored under {@code key}.
     *
     * @return the value, or empty if no entry exists
     * @throws StoreException if the store cannot be read
     */
    Optional<String> read(String key);

    /**
     * Stores {@code value} under {@code key}.
     *
     * @param ttl time-to-live of the entry; {@code null} or zero keeps it until evicted
     * @throws StoreException if the store cannot be written
     */
    void write(String key, String value, Duration ttl);

    /**
     * Removes the entry for {@code key}, if any.
     *
     * @throws StoreException if the store cannot be written
     */
    void delete(String key);
}
