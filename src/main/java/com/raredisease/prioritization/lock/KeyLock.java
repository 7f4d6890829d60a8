package com.raredisease.prioritization.lock;

import java.util.function.Supplier;

/**
 * Serializes work on a single key, so that two workers never assign the same run
 * number to the same (disease, criterion) pair. Different keys never contend.
 */
public interface KeyLock {

    /**
     * Acquires the lock for the key, waiting up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock for the key if held by the current thread.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the key's lock.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
