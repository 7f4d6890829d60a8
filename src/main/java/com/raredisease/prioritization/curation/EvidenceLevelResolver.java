package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.SelectionMethod;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves an ordinal evidence level (e.g. "High evidence") by taking the most
 * reliable record whose value is a known label.
 */
public class EvidenceLevelResolver implements CriterionResolver {

    private final Set<String> labels;

    public EvidenceLevelResolver(Map<String, Double> labelScores) {
        this.labels = Set.copyOf(labelScores.keySet());
    }

    @Override
    public CuratedValue resolve(String entityId, Criterion criterion, List<EvidenceRecord> evidence) {
        List<EvidenceRecord> known = evidence.stream().filter(r -> canonical(r.getValue()).isPresent()).toList();
        List<String> excluded = evidence.stream()
                .filter(r -> canonical(r.getValue()).isEmpty())
                .map(EvidenceRecord::getSource)
                .distinct()
                .toList();

        return EvidenceOrdering.best(known)
                .map(best -> CuratedValue.ofLabel(entityId, criterion, canonical(best.getValue()).orElseThrow(),
                        SelectionMethod.BEST_RELIABILITY, best.getReliabilityScore(),
                        List.of(best.getSource()), excluded))
                .orElseGet(() -> CuratedValue.noUsableData(entityId, criterion, excluded));
    }

    private Optional<String> canonical(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return labels.stream().filter(l -> l.trim().toLowerCase(Locale.ROOT).equals(normalized)).findFirst();
    }
}
