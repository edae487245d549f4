package com.resource.guard.cache;

/**
 * Thrown when a value could not be produced for a key: the upstream fetch failed or a cached
 * value could not be decoded. Shared with every caller that joined the same fetch; never cached.
 */
public class FetchException extends RuntimeException {

    private final String key;

    public FetchException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
