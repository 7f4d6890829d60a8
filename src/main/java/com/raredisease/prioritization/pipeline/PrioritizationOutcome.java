package com.raredisease.prioritization.pipeline;

import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.NormalizedScore;
import com.raredisease.prioritization.core.model.PriorityResult;
import com.raredisease.prioritization.export.EntityJustification;
import com.raredisease.prioritization.normalize.CorpusStatistics;
import com.raredisease.prioritization.run.CollectionReport;

import java.util.List;
import java.util.Optional;

/**
 * Everything one prioritization batch produced.
 *
 * @param collection     collection pass report, null when evidence was already stored
 * @param curatedValues  one curated value per (disease, criterion)
 * @param statistics     corpus statistics the scores were normalized against
 * @param scores         normalized scores; keys without usable data are absent
 * @param ranking        results in rank order
 * @param justifications per-disease justifications in rank order
 */
public record PrioritizationOutcome(
        CollectionReport collection,
        List<CuratedValue> curatedValues,
        CorpusStatistics statistics,
        List<NormalizedScore> scores,
        List<PriorityResult> ranking,
        List<EntityJustification> justifications
) {
    public PrioritizationOutcome {
        curatedValues = List.copyOf(curatedValues);
        scores = List.copyOf(scores);
        ranking = List.copyOf(ranking);
        justifications = List.copyOf(justifications);
    }

    public Optional<PriorityResult> result(String entityId) {
        return ranking.stream().filter(r -> r.getEntityId().equals(entityId)).findFirst();
    }
}
