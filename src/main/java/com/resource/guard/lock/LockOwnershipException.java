package com.resource.guard.lock;

/**
 * A lease was no longer owned by the caller when it tried to release it: the lease expired
 * and may have been taken over. The work it protected may have overlapped with another owner.
 */
public class LockOwnershipException extends RuntimeException {

    private final String lockName;
    private final String ownerToken;

    public LockOwnershipException(String lockName, String ownerToken) {
        super("Lease on '" + lockName + "' is no longer owned by " + ownerToken);
        this.lockName = lockName;
        this.ownerToken = ownerToken;
    }

    public String getLockName() {
        return lockName;
    }

    public String getOwnerToken() {
        return ownerToken;
    }
}
