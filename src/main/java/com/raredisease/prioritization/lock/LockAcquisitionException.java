package com.raredisease.prioritization.lock;

/**
 * Thrown when the lock of a (disease, criterion) key cannot be acquired within
 * the configured timeout. Affects only that key.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
