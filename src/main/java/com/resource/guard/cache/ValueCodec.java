package com.resource.guard.cache;

/**
 * Converts cached values to and from their stored string form.
 *
 * @param <V> value type
 */
public interface ValueCodec<V> {

    String encode(V value);

    /**
     * @throws IllegalArgumentException if {@code raw} is not a valid encoding
     */
    V decode(String raw);
}
