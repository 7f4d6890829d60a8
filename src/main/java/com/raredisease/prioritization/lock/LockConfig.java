package com.raredisease.prioritization.lock;

/**
 * Configuration of per-key run locks.
 *
 * @param timeoutMs maximum time a worker waits for another worker holding the same key
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 60s, long enough to outlast a slow fetch held by another worker.
     */
    public static LockConfig defaults() {
        return new LockConfig(60_000);
    }
}
