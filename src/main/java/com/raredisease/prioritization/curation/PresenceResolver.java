package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.SelectionMethod;

import java.util.List;
import java.util.Set;

/**
 * Resolves a yes/no criterion such as gene traceability: present when at least one
 * record's subtype is on the allow-list. With {@code singleValueOnly} the qualifying
 * records must also name exactly one distinct value (a monogenic disease).
 */
public class PresenceResolver implements CriterionResolver {

    private final Set<String> qualifyingSubtypes;
    private final boolean singleValueOnly;

    public PresenceResolver(Set<String> qualifyingSubtypes, boolean singleValueOnly) {
        this.qualifyingSubtypes = Set.copyOf(qualifyingSubtypes);
        this.singleValueOnly = singleValueOnly;
    }

    @Override
    public CuratedValue resolve(String entityId, Criterion criterion, List<EvidenceRecord> evidence) {
        List<EvidenceRecord> qualifying = evidence.stream().filter(this::qualifies).toList();
        long distinctValues = qualifying.stream().map(r -> r.getValue().trim()).distinct().count();
        boolean present = singleValueOnly ? distinctValues == 1 : distinctValues > 0;

        double confidence = qualifying.stream()
                .mapToDouble(EvidenceRecord::getReliabilityScore)
                .average()
                .orElse(0.0);
        List<String> supporting = qualifying.stream().map(EvidenceRecord::getSource).distinct().toList();
        List<String> excluded = evidence.stream()
                .filter(r -> !qualifies(r))
                .map(EvidenceRecord::getSource)
                .distinct()
                .toList();
        return CuratedValue.ofPresence(entityId, criterion, present, SelectionMethod.QUALIFYING_PRESENCE,
                confidence, supporting, excluded);
    }

    @Override
    public CuratedValue emptyEvidence(String entityId, Criterion criterion) {
        return CuratedValue.ofPresence(entityId, criterion, false, SelectionMethod.EMPTY_EVIDENCE,
                0.0, List.of(), List.of());
    }

    private boolean qualifies(EvidenceRecord record) {
        String subtype = record.getSubtype();
        return subtype != null && qualifyingSubtypes.stream().anyMatch(s -> s.equalsIgnoreCase(subtype.trim()));
    }
}
