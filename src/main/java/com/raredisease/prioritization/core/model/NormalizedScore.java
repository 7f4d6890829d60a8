package com.raredisease.prioritization.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A criterion value placed on the common 0-10 scale.
 *
 * @param entityId        the disease id
 * @param criterion       the criterion
 * @param score           normalized score in [0, 10]
 * @param lowConfidence   true when the score stands in for missing or weak evidence
 * @param componentScores sub-scores before weighting, for multi-component criteria
 */
public record NormalizedScore(
        String entityId,
        Criterion criterion,
        double score,
        boolean lowConfidence,
        Map<String, Double> componentScores
) {
    public NormalizedScore {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(criterion, "criterion is required");
        if (Double.isNaN(score) || score < 0.0 || score > 10.0) {
            throw new IllegalArgumentException("score must be within [0, 10], got " + score);
        }
        componentScores = componentScores != null ? Map.copyOf(componentScores) : Map.of();
    }

    public static NormalizedScore of(String entityId, Criterion criterion, double score) {
        return new NormalizedScore(entityId, criterion, score, false, Map.of());
    }
}
