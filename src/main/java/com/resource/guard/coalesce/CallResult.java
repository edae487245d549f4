package com.resource.guard.coalesce;

/**
 * Outcome of one coalesced execution as seen by a single caller.
 *
 * <p>{@code value} and {@code error} are the same objects for every caller that joined
 * the execution. {@code shared} is per-caller metadata: {@code true} when the outcome was
 * delivered to more than one caller.</p>
 *
 * @param value  the value produced by the work function, may be {@code null}
 * @param error  the failure raised by the work function, or {@code null} on success.
 *               Checked exceptions are stored wrapped in {@link CoalescedExecutionException}.
 * @param shared whether this outcome was handed to more than one caller
 * @param <V>    value type
 */
public record CallResult<V>(V value, Throwable error, boolean shared) {

    public CallResult {
        if (error != null && !(error instanceof RuntimeException) && !(error instanceof Error)) {
            throw new IllegalArgumentException("error must be unchecked, got " + error.getClass().getName());
        }
    }

    public static <V> CallResult<V> success(V value) {
        return new CallResult<>(value, null, false);
    }

    public static <V> CallResult<V> failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new CallResult<>(null, error, false);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the same outcome with a different {@code shared} flag.
     */
    public CallResult<V> asShared(boolean shared) {
        return shared == this.shared ? this : new CallResult<>(value, error, shared);
    }

    /**
     * Returns the value, or rethrows the stored error unchanged.
     */
    public V getOrThrow() {
        if (error == null) {
            return value;
        }
        if (error instanceof RuntimeException) {
            throw (RuntimeException) error;
        }
        throw (Error) error;
    }
}
