package com.resource.guard.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared store holding lock leases. Every mutating operation is a single conditional write
 * in the store, so implementations stay correct when several processes race on one name.
 * The store is the only source of truth for who holds a lock.
 */
public interface LeaseStore {

    /**
     * Creates a lease for {@code name} owned by {@code ownerToken} if no unexpired lease exists.
     *
     * @return {@code true} if the lease was created
     * @throws LeaseStoreException if the store cannot be reached
     */
    boolean tryCreate(String name, String ownerToken, Duration ttl);

    /**
     * Deletes the lease for {@code name} only if it is unexpired and owned by {@code ownerToken}.
     *
     * @return {@code true} if a live lease owned by {@code ownerToken} was deleted
     * @throws LeaseStoreException if the store cannot be reached
     */
    boolean deleteIfOwner(String name, String ownerToken);

    /**
     * Resets the expiry of the lease for {@code name} to {@code ttl} from now, only if it is
     * unexpired and owned by {@code ownerToken}.
     *
     * @return {@code true} if the lease was extended
     * @throws LeaseStoreException if the store cannot be reached
     */
    boolean extendIfOwner(String name, String ownerToken, Duration ttl);

    /**
     * Returns the owner token of the unexpired lease for {@code name}, if any.
     *
     * @throws LeaseStoreException if the store cannot be reached
     */
    Optional<String> currentOwner(String name);
}
