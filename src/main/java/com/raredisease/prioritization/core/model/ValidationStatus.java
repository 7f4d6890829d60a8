package com.raredisease.prioritization.core.model;

/**
 * Curation status of an evidence record at its source registry.
 */
public enum ValidationStatus {
    VALIDATED,
    NOT_VALIDATED,
    UNKNOWN
}
