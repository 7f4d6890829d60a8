package com.raredisease.prioritization.core.model;

/**
 * State of one (disease, criterion) key, derived from its run history.
 *
 * <pre>
 * NOT_STARTED -> PENDING -> SUCCEEDED
 *                PENDING -> (empty | failed) -> PENDING ... -> EXHAUSTED_EMPTY | EXHAUSTED_FAILED
 * </pre>
 */
public enum RunState {
    NOT_STARTED,
    PENDING,
    SUCCEEDED,
    EXHAUSTED_EMPTY,
    EXHAUSTED_FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED_EMPTY || this == EXHAUSTED_FAILED;
    }

    public boolean isExhausted() {
        return this == EXHAUSTED_EMPTY || this == EXHAUSTED_FAILED;
    }
}
