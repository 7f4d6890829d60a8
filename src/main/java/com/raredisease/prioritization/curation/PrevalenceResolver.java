package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.config.RarityClass;
import com.raredisease.prioritization.config.RarityScale;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.MeasurementType;
import com.raredisease.prioritization.core.model.SelectionMethod;
import com.raredisease.prioritization.reliability.ReliabilityScorer;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks one prevalence class from possibly conflicting records. Tiers are tried
 * in order and the first that matches wins:
 *
 * <ol>
 *   <li>point-prevalence records;</li>
 *   <li>reliable records with global scope;</li>
 *   <li>reliable region-specific records;</li>
 *   <li>prevalence-at-birth records, moved one class rarer;</li>
 *   <li>case or family reports, mapped to the rarest class.</li>
 * </ol>
 *
 * Within a tier the best record by {@link EvidenceOrdering} is chosen. Records
 * whose label is a placeholder or not on the rarity scale never count.
 */
public class PrevalenceResolver implements CriterionResolver {

    private final RarityScale scale;
    private final ReliabilityScorer scorer;

    public PrevalenceResolver(RarityScale scale, ReliabilityScorer scorer) {
        this.scale = scale;
        this.scorer = scorer;
    }

    @Override
    public CuratedValue resolve(String entityId, Criterion criterion, List<EvidenceRecord> evidence) {
        List<EvidenceRecord> usable = evidence.stream().filter(r -> scale.find(r.getValue()).isPresent()).toList();
        List<String> excluded = evidence.stream()
                .filter(r -> scale.find(r.getValue()).isEmpty())
                .map(EvidenceRecord::getSource)
                .distinct()
                .toList();

        Optional<CuratedValue> value =
                tier(entityId, criterion, usable, excluded, SelectionMethod.POINT_PREVALENCE,
                        r -> r.getQualifiers().measurementType() == MeasurementType.POINT_PREVALENCE)
                .or(() -> tier(entityId, criterion, usable, excluded, SelectionMethod.GLOBAL_RELIABLE,
                        r -> scorer.isReliable(r) && r.getQualifiers().isGlobal()))
                .or(() -> tier(entityId, criterion, usable, excluded, SelectionMethod.REGIONAL_RELIABLE,
                        r -> scorer.isReliable(r) && !r.getQualifiers().isGlobal()))
                .or(() -> birthPrevalence(entityId, criterion, usable, excluded))
                .or(() -> caseReports(entityId, criterion, evidence, excluded));

        return value.orElseGet(() -> CuratedValue.noUsableData(entityId, criterion,
                evidence.stream().map(EvidenceRecord::getSource).distinct().toList()));
    }

    private Optional<CuratedValue> tier(String entityId, Criterion criterion, List<EvidenceRecord> usable,
                                        List<String> excluded, SelectionMethod method,
                                        Predicate<EvidenceRecord> filter) {
        return EvidenceOrdering.best(usable.stream().filter(filter).toList())
                .map(best -> CuratedValue.ofLabel(entityId, criterion, classOf(best).label(), method,
                        best.getReliabilityScore(), List.of(best.getSource()), excluded));
    }

    private Optional<CuratedValue> birthPrevalence(String entityId, Criterion criterion,
                                                   List<EvidenceRecord> usable, List<String> excluded) {
        return EvidenceOrdering.best(usable.stream()
                        .filter(r -> r.getQualifiers().measurementType() == MeasurementType.PREVALENCE_AT_BIRTH)
                        .toList())
                .map(best -> CuratedValue.ofLabel(entityId, criterion,
                        scale.oneStepRarer(classOf(best)).label(),
                        SelectionMethod.BIRTH_PREVALENCE_ADJUSTED,
                        best.getReliabilityScore(), List.of(best.getSource()), excluded));
    }

    private Optional<CuratedValue> caseReports(String entityId, Criterion criterion,
                                               List<EvidenceRecord> evidence, List<String> excluded) {
        // case reports count even when their class label is a placeholder
        return EvidenceOrdering.best(evidence.stream()
                        .filter(r -> r.getQualifiers().measurementType() == MeasurementType.CASES_FAMILIES)
                        .toList())
                .map(best -> CuratedValue.ofLabel(entityId, criterion, scale.rarest().label(),
                        SelectionMethod.CASE_REPORT_DEFAULT, best.getReliabilityScore(),
                        List.of(best.getSource()),
                        excluded.stream().filter(s -> !s.equals(best.getSource())).toList()));
    }

    private RarityClass classOf(EvidenceRecord record) {
        return scale.find(record.getValue()).orElseThrow();
    }
}
