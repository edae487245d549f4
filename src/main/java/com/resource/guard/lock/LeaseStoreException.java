package com.resource.guard.lock;

/**
 * Runtime exception thrown when a {@link LeaseStore} cannot complete an operation.
 * Unlike {@link LockContentionException} this says nothing about who holds the lock.
 */
public class LeaseStoreException extends RuntimeException {

    public LeaseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
