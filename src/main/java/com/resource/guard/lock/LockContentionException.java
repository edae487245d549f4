package com.resource.guard.lock;

/**
 * The lock is held by another owner whose lease has not expired. Recoverable: the caller
 * decides whether and when to try again.
 */
public class LockContentionException extends LockAcquisitionException {

    private final String lockName;

    public LockContentionException(String lockName) {
        super("Lock '" + lockName + "' is held by another owner");
        this.lockName = lockName;
    }

    public LockContentionException(String lockName, String message) {
        super(message);
        this.lockName = lockName;
    }

    public String getLockName() {
        return lockName;
    }
}
