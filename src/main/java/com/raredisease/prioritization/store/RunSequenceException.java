package com.raredisease.prioritization.store;

/**
 * Thrown when a run record would break the contiguous 1..k numbering of its key.
 */
public class RunSequenceException extends IllegalStateException {

    public RunSequenceException(String message) {
        super(message);
    }
}
