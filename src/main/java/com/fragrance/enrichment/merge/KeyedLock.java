package com.fragrance.enrichment.merge;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per key, used to serialise upserts of the
 * same (name, owner). Suitable for single-JVM deployments; across JVMs the
 * store's unique constraint is the backstop.
 *
 * <p>An entry lives only while some thread holds or waits for its key.</p>
 */
@Slf4j
public class KeyedLock {

    /** Lock plus the number of threads holding or waiting for it. Guarded by the map's per-key compute. */
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    private final ConcurrentHashMap<String, Entry> locks = new ConcurrentHashMap<>();

    private final Duration timeout;

    public KeyedLock(final Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     *
     * @throws LockAcquisitionException if the lock is not obtained in time
     */
    public <T> T withLock(final String key, final Supplier<T> action) {
        Entry entry = locks.compute(key, (k, e) -> {
            Entry held = e == null ? new Entry() : e;
            held.users++;
            return held;
        });
        try {
            acquire(key, entry.lock);
            log.debug("Lock acquired: {}", key);
            try {
                return action.get();
            } finally {
                entry.lock.unlock();
                log.debug("Lock released: {}", key);
            }
        } finally {
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    private void acquire(final String key, final ReentrantLock lock) {
        try {
            if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + timeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    boolean isLocked(final String key) {
        Entry entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    /** Number of keys currently held or waited for. */
    int activeKeys() {
        return locks.size();
    }
}
