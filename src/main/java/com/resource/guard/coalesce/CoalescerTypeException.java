package com.resource.guard.coalesce;

/**
 * Thrown when a coalesced result does not have the type the caller asked for.
 *
 * <p>This happens only when one coalescer is shared by call sites that use the same key
 * for different result types. It is a programming error and is never retried.</p>
 */
public class CoalescerTypeException extends RuntimeException {

    private final String key;
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public CoalescerTypeException(String key, Class<?> expectedType, Class<?> actualType) {
        super("Coalesced result for key '" + key + "' is a " + actualType.getName()
                + ", expected " + expectedType.getName());
        this.key = key;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
