package com.resource.guard.cache;

/**
 * Runtime exception thrown when a {@link KeyValueStore} cannot be reached or fails a command.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
