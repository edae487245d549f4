package com.resource.guard.cache;

import java.util.Optional;

/**
 * Reads a value from the authoritative source on a cache miss.
 *
 * @param <V> value type
 */
@FunctionalInterface
public interface UpstreamFetcher<V> {

    /**
     * @return the value, or empty when the source has no record for {@code key}
     * @throws Exception on any read or transport failure
     */
    Optional<V> fetch(String key) throws Exception;
}
