package com.raredisease.prioritization.core.model;

/**
 * Whether a record carries a quantitative value in addition to its class.
 */
public enum DataQualification {
    VALUE_AND_CLASS,
    CLASS_ONLY,
    NONE
}
