package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;

import java.util.List;

/**
 * Collapses the scored evidence of one key into a single curated value.
 * Implementations are pure: the same evidence always yields the same value.
 */
public interface CriterionResolver {

    /**
     * Resolves a non-empty batch of scored evidence.
     */
    CuratedValue resolve(String entityId, Criterion criterion, List<EvidenceRecord> evidence);

    /**
     * Value used when the fetch succeeded but found nothing.
     */
    default CuratedValue emptyEvidence(String entityId, Criterion criterion) {
        return CuratedValue.noUsableData(entityId, criterion, List.of());
    }
}
