package com.raredisease.prioritization.export;

import java.util.List;

/**
 * Why one criterion scored what it did for one disease.
 *
 * @param criterion         criterion key
 * @param value             curated value rendered as text
 * @param selectionMethod   resolution rule that produced the value
 * @param confidence        reliability behind the value
 * @param supportingSources sources the value was taken from
 * @param excludedSources   sources seen but not used
 * @param normalizedScore   0-10 score, or null without usable data
 * @param lowConfidence     whether the score stands in for weak evidence
 * @param weight            weight of the criterion
 * @param contribution      score times weight, zero without a score
 * @param explanation       one-sentence rationale
 */
public record CriterionJustification(
        String criterion,
        String value,
        String selectionMethod,
        double confidence,
        List<String> supportingSources,
        List<String> excludedSources,
        Double normalizedScore,
        boolean lowConfidence,
        double weight,
        double contribution,
        String explanation
) {
    public CriterionJustification {
        supportingSources = supportingSources != null ? List.copyOf(supportingSources) : List.of();
        excludedSources = excludedSources != null ? List.copyOf(excludedSources) : List.of();
    }

    public boolean hasScore() {
        return normalizedScore != null;
    }
}
