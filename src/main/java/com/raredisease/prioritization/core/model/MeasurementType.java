package com.raredisease.prioritization.core.model;

/**
 * How an epidemiological figure was measured, ordered from most to least reliable.
 */
public enum MeasurementType {
    /** Point-in-time prevalence. */
    POINT_PREVALENCE,
    /** Measured at a fixed life event, typically birth. */
    PREVALENCE_AT_BIRTH,
    /** Rate based, e.g. annual incidence. */
    ANNUAL_INCIDENCE,
    /** Aggregation of case reports or affected families. */
    CASES_FAMILIES,
    UNSPECIFIED
}
