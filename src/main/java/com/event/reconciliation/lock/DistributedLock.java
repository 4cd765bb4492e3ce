package com.event.reconciliation.lock;

/**
 * Exclusive lock used to keep sync passes single-flight: two passes reading the same snapshot
 * could both decide "no match" for one real-world event and create duplicates.
 * Implementations may be in-process or backed by shared infrastructure for multi-instance deployments.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on the given key.
     *
     * @param key the lock key (typically the sync lock key from {@code SyncOptions})
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock is still held elsewhere after all attempts
     */
    boolean tryLock(String key);

    /**
     * Releases the lock on the given key. Releasing a lock that is not held is a no-op.
     */
    void unlock(String key);

    /**
     * Returns true if some holder currently owns the lock on the given key.
     */
    boolean isLocked(String key);
}
