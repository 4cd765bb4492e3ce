package com.event.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock using one {@link ReentrantLock} per key.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 *
 * <p>The lock is not re-entrant: a thread asking again for a key it already holds is refused,
 * so a progress callback cannot start a nested sync pass.</p>
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            throw new LockAcquisitionException("Lock for key '" + key + "' is already held by this thread");
        }
        try {
            for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
                if (attempt > 0) {
                    TimeUnit.MILLISECONDS.sleep(config.retryDelayMs());
                }
                if (lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                    log.debug("lock.acquired key={} attempt={}", key, attempt + 1);
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
        throw new LockAcquisitionException("Failed to acquire lock for key '" + key + "' after "
                + (config.maxRetries() + 1) + " attempt(s) of " + config.timeoutMs() + "ms");
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released key={}", key);
        }
    }

    @Override
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
