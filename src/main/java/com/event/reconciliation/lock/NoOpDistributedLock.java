package com.event.reconciliation.lock;

/**
 * Lock that always succeeds immediately.
 * Only for callers that already serialize sync passes themselves (for example a single-threaded scheduler).
 */
public class NoOpDistributedLock implements DistributedLock {

    @Override
    public boolean tryLock(String key) {
        return true;
    }

    @Override
    public void unlock(String key) {
    }

    @Override
    public boolean isLocked(String key) {
        return false;
    }
}
