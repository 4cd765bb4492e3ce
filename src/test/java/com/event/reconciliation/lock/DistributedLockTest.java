package com.event.reconciliation.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DistributedLockTest {

    @Nested
    @DisplayName("NoOpDistributedLock")
    class NoOpTests {

        @Test
        @DisplayName("Should always acquire lock")
        void testAlwaysAcquires() {
            NoOpDistributedLock lock = new NoOpDistributedLock();
            assertTrue(lock.tryLock("any-key"));
            assertTrue(lock.tryLock("any-key"));
            assertFalse(lock.isLocked("any-key"));
        }

        @Test
        @DisplayName("Should unlock without error")
        void testUnlockNoOp() {
            NoOpDistributedLock lock = new NoOpDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("any-key"));
        }
    }

    @Nested
    @DisplayName("LocalDistributedLock")
    class LocalLockTests {

        @Test
        @DisplayName("Should acquire and release lock")
        void testAcquireRelease() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("event-request-sync"));
            assertTrue(lock.isLocked("event-request-sync"));
            lock.unlock("event-request-sync");
            assertFalse(lock.isLocked("event-request-sync"));
        }

        @Test
        @DisplayName("Should refuse a second acquisition from the holding thread")
        void testNotReentrant() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("test-key"));
            assertThrows(LockAcquisitionException.class, () -> lock.tryLock("test-key"));
            assertTrue(lock.isLocked("test-key"));
            lock.unlock("test-key");
            assertFalse(lock.isLocked("test-key"));
        }

        @Test
        @DisplayName("Should allow different keys concurrently")
        void testDifferentKeys() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertTrue(lock.tryLock("key-1"));
            assertTrue(lock.tryLock("key-2"));
            lock.unlock("key-1");
            lock.unlock("key-2");
        }

        @Test
        @DisplayName("Should fail fast while another thread holds the key")
        void testFailFast() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(LockConfig.failFast());
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                lock.tryLock("event-request-sync");
                try {
                    held.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock("event-request-sync");
                }
            });
            holder.start();
            assertTrue(held.await(5, TimeUnit.SECONDS));

            assertThrows(LockAcquisitionException.class, () -> lock.tryLock("event-request-sync"));
            assertTrue(lock.isLocked("event-request-sync"));

            release.countDown();
            holder.join(5000);
            assertTrue(lock.tryLock("event-request-sync"));
            lock.unlock("event-request-sync");
        }

        @Test
        @DisplayName("Should block concurrent access to same key")
        void testConcurrentBlocking() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock(new LockConfig(2000, 0, 100));
            AtomicInteger concurrentCount = new AtomicInteger(0);
            AtomicInteger maxConcurrent = new AtomicInteger(0);
            AtomicReference<Throwable> failure = new AtomicReference<>();

            int threadCount = 5;
            CountDownLatch startLatch = new CountDownLatch(1);
            CountDownLatch doneLatch = new CountDownLatch(threadCount);
            List<Thread> threads = new ArrayList<>();

            for (int i = 0; i < threadCount; i++) {
                Thread thread = new Thread(() -> {
                    try {
                        startLatch.await();
                        lock.tryLock("shared-key");
                        try {
                            int current = concurrentCount.incrementAndGet();
                            maxConcurrent.updateAndGet(max -> Math.max(max, current));
                            Thread.sleep(20);
                            concurrentCount.decrementAndGet();
                        } finally {
                            lock.unlock("shared-key");
                        }
                    } catch (Throwable e) {
                        failure.compareAndSet(null, e);
                    } finally {
                        doneLatch.countDown();
                    }
                });
                threads.add(thread);
                thread.start();
            }

            startLatch.countDown();
            assertTrue(doneLatch.await(10, TimeUnit.SECONDS));

            assertNull(failure.get());
            assertEquals(1, maxConcurrent.get());
        }

        @Test
        @DisplayName("Should handle unlock for non-existent key gracefully")
        void testUnlockNonExistentKey() {
            LocalDistributedLock lock = new LocalDistributedLock();
            assertDoesNotThrow(() -> lock.unlock("non-existent"));
            assertFalse(lock.isLocked("non-existent"));
        }

        @Test
        @DisplayName("Unlock from a thread that does not hold the lock is ignored")
        void testUnlockFromOtherThread() throws Exception {
            LocalDistributedLock lock = new LocalDistributedLock();
            lock.tryLock("test-key");

            Thread other = new Thread(() -> lock.unlock("test-key"));
            other.start();
            other.join(5000);

            assertTrue(lock.isLocked("test-key"));
            lock.unlock("test-key");
        }
    }

    @Nested
    @DisplayName("LockConfig")
    class LockConfigTests {

        @Test
        @DisplayName("Should create default config")
        void testDefaults() {
            LockConfig config = LockConfig.defaults();
            assertEquals(5000, config.timeoutMs());
            assertEquals(0, config.maxRetries());
            assertEquals(100, config.retryDelayMs());
        }

        @Test
        @DisplayName("Fail-fast config does not wait")
        void testFailFast() {
            LockConfig config = LockConfig.failFast();
            assertEquals(0, config.timeoutMs());
            assertEquals(0, config.maxRetries());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void testInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(-1, 0, 100));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, -1, 100));
            assertThrows(IllegalArgumentException.class, () -> new LockConfig(5000, 0, 0));
        }
    }

    @Nested
    @DisplayName("LockAcquisitionException")
    class ExceptionTests {

        @Test
        @DisplayName("Should carry message and cause")
        void testMessageAndCause() {
            RuntimeException cause = new RuntimeException("root cause");
            LockAcquisitionException ex = new LockAcquisitionException("lock failed", cause);
            assertEquals("lock failed", ex.getMessage());
            assertEquals(cause, ex.getCause());
        }
    }
}
