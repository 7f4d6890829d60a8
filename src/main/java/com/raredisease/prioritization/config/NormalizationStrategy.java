package com.raredisease.prioritization.config;

/**
 * How a criterion's curated value is mapped onto the 0-10 scale.
 */
public enum NormalizationStrategy {
    /** Fixed lookup from a class or evidence-level label to a representative score. */
    CLASS_MIDPOINT,
    /** Counts capped at Q3 + k*IQR of the corpus, then min-max scaled. */
    WINSORIZED_MIN_MAX,
    /** Presence maps to 10, absence to 0 (or the inverse). */
    BINARY
}
