package com.raredisease.prioritization.config;

/**
 * Whether a larger raw value should raise or lower research priority.
 */
public enum ScoreDirection {
    MORE_IS_BETTER,
    FEWER_IS_BETTER;

    /**
     * Orients a score computed as "more is better".
     */
    public double orient(double moreIsBetterScore, double scaleMax) {
        return this == MORE_IS_BETTER ? moreIsBetterScore : scaleMax - moreIsBetterScore;
    }
}
