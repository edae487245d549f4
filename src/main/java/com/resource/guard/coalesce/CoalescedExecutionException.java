package com.resource.guard.coalesce;

/**
 * Wraps a checked exception thrown by a coalesced work function.
 * One instance is created per execution and delivered to every joined caller.
 */
public class CoalescedExecutionException extends RuntimeException {

    private final String key;

    public CoalescedExecutionException(String key, Throwable cause) {
        super("Coalesced execution failed for key '" + key + "': " + cause.getMessage(), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
