package com.raredisease.prioritization.core.model;

/**
 * Which resolution rule produced a curated value.
 */
public enum SelectionMethod {
    /** Tier 1: a point-prevalence record. */
    POINT_PREVALENCE,
    /** Tier 2: most reliable global record above the reliability threshold. */
    GLOBAL_RELIABLE,
    /** Tier 3: most reliable region-specific record above the reliability threshold. */
    REGIONAL_RELIABLE,
    /** Tier 4: birth prevalence shifted one class rarer. */
    BIRTH_PREVALENCE_ADJUSTED,
    /** Tier 5: case reports only, rarest class assigned. */
    CASE_REPORT_DEFAULT,
    /** Best-reliability record among those carrying a known label. */
    BEST_RELIABILITY,
    /** Count of records passing the inclusion rules. */
    QUALIFYING_COUNT,
    /** Count taken from the fallback region set because the preferred one was empty. */
    REGIONAL_FALLBACK,
    /** Presence of at least one qualifying record. */
    QUALIFYING_PRESENCE,
    /** The fetch succeeded but found nothing; counts are zero, presence is false. */
    EMPTY_EVIDENCE,
    NO_USABLE_DATA
}
