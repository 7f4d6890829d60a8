package com.raredisease.prioritization.core.model;

/**
 * Outcome of a single fetch attempt.
 */
public enum RunStatus {
    /** The adapter returned at least one valid evidence record. */
    SUCCESS_NONEMPTY,
    /** The adapter succeeded but found no evidence. */
    SUCCESS_EMPTY,
    /** The adapter failed (network, parsing, timeout) or returned only malformed records. */
    FAILED
}
