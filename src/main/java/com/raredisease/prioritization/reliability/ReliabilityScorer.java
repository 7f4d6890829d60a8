package com.raredisease.prioritization.reliability;

import com.raredisease.prioritization.core.model.EvidenceQualifiers;
import com.raredisease.prioritization.core.model.EvidenceRecord;

/**
 * Assigns a 0-10 confidence score to a single evidence record from its qualifiers
 * alone, independent of the value it carries.
 *
 * <p>Formula:</p>
 * <pre>
 * score = validation (validated: 3.0)
 *       + source     (peer reviewed: 2.0, expert opinion: 1.0)
 *       + qualification (value and class: 2.0, class only: 1.0)
 *       + measurement (point: 2.0, at birth: 1.8, annual incidence: 1.5, cases/families: 1.0)
 *       + geography  (region or country specific: 1.0)
 * </pre>
 * <p>capped at 10.0.</p>
 */
public class ReliabilityScorer {

    public static final double MAX_SCORE = 10.0;

    private final double reliabilityThreshold;

    public ReliabilityScorer(double reliabilityThreshold) {
        if (reliabilityThreshold < 0.0 || reliabilityThreshold > MAX_SCORE) {
            throw new IllegalArgumentException("reliabilityThreshold must be between 0.0 and 10.0");
        }
        this.reliabilityThreshold = reliabilityThreshold;
    }

    public double score(EvidenceRecord record) {
        EvidenceQualifiers q = record.getQualifiers();
        double score = 0.0;

        score += switch (q.validationStatus()) {
            case VALIDATED -> 3.0;
            case NOT_VALIDATED, UNKNOWN -> 0.0;
        };
        score += switch (q.sourceType()) {
            case PEER_REVIEWED -> 2.0;
            case EXPERT_OPINION -> 1.0;
            case NONE -> 0.0;
        };
        score += switch (q.qualification()) {
            case VALUE_AND_CLASS -> 2.0;
            case CLASS_ONLY -> 1.0;
            case NONE -> 0.0;
        };
        score += switch (q.measurementType()) {
            case POINT_PREVALENCE -> 2.0;
            case PREVALENCE_AT_BIRTH -> 1.8;
            case ANNUAL_INCIDENCE -> 1.5;
            case CASES_FAMILIES -> 1.0;
            case UNSPECIFIED -> 0.0;
        };
        if (!q.isGlobal()) {
            score += 1.0;
        }
        return Math.min(score, MAX_SCORE);
    }

    /**
     * Returns the record with its computed reliability score attached. A score the
     * record already carries is replaced.
     */
    public EvidenceRecord scored(EvidenceRecord record) {
        return record.withReliability(score(record));
    }

    public boolean isReliable(EvidenceRecord record) {
        double score = record.isScored() ? record.getReliabilityScore() : score(record);
        return score >= reliabilityThreshold;
    }

    public double getReliabilityThreshold() {
        return reliabilityThreshold;
    }
}
