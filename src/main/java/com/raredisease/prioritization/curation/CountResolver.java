package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.config.CountComponent;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.SelectionMethod;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Counts distinct qualifying values per configured component (drugs, trials,
 * research groups).
 *
 * <p>A record qualifies for a component when its subtype is on the component's
 * allow-list and its area is in the preferred region set. When the preferred set
 * yields nothing and the component has fallback regions, those are counted instead.
 * Records that qualify for no component are listed as excluded sources.</p>
 */
public class CountResolver implements CriterionResolver {

    private final List<CountComponent> components;

    public CountResolver(List<CountComponent> components) {
        this.components = List.copyOf(components);
    }

    @Override
    public CuratedValue resolve(String entityId, Criterion criterion, List<EvidenceRecord> evidence) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Set<EvidenceRecord> qualifying = new LinkedHashSet<>();
        boolean usedFallback = false;

        for (CountComponent component : components) {
            List<EvidenceRecord> matched = matching(evidence,
                    r -> component.admitsSubtype(r.getSubtype())
                            && component.inPreferredRegion(r.getQualifiers().geographicArea()));
            if (matched.isEmpty() && component.hasFallback()) {
                matched = matching(evidence,
                        r -> component.admitsSubtype(r.getSubtype())
                                && component.inFallbackRegion(r.getQualifiers().geographicArea()));
                usedFallback |= !matched.isEmpty();
            }
            counts.put(component.name(), distinctValues(matched));
            qualifying.addAll(matched);
        }

        double confidence = qualifying.stream()
                .mapToDouble(EvidenceRecord::getReliabilityScore)
                .average()
                .orElse(0.0);
        List<String> supporting = qualifying.stream().map(EvidenceRecord::getSource).distinct().toList();
        List<String> excluded = evidence.stream()
                .filter(r -> !qualifying.contains(r))
                .map(EvidenceRecord::getSource)
                .distinct()
                .toList();

        return CuratedValue.ofCounts(entityId, criterion, counts,
                usedFallback ? SelectionMethod.REGIONAL_FALLBACK : SelectionMethod.QUALIFYING_COUNT,
                confidence, supporting, excluded);
    }

    @Override
    public CuratedValue emptyEvidence(String entityId, Criterion criterion) {
        Map<String, Integer> zeros = new LinkedHashMap<>();
        components.forEach(c -> zeros.put(c.name(), 0));
        return CuratedValue.ofCounts(entityId, criterion, zeros, SelectionMethod.EMPTY_EVIDENCE,
                0.0, List.of(), List.of());
    }

    private static List<EvidenceRecord> matching(List<EvidenceRecord> evidence, Predicate<EvidenceRecord> filter) {
        return evidence.stream().filter(filter).toList();
    }

    private static int distinctValues(List<EvidenceRecord> records) {
        return (int) records.stream().map(r -> r.getValue().trim()).distinct().count();
    }
}
