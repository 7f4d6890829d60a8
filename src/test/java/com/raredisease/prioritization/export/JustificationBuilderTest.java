package com.raredisease.prioritization.export;

import com.raredisease.prioritization.aggregate.PriorityRanking;
import com.raredisease.prioritization.aggregate.WeightedAggregator;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.NormalizedScore;
import com.raredisease.prioritization.core.model.PriorityResult;
import com.raredisease.prioritization.core.model.SelectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JustificationBuilderTest {

    private static final Map<Criterion, Double> WEIGHTS = Map.of(
            Criterion.PREVALENCE, 0.5, Criterion.THERAPIES, 0.3, Criterion.GENE_TRACEABILITY, 0.2);

    @Test
    @DisplayName("Each weighted criterion is explained with its value, sources and contribution")
    void buildsJustifications() {
        CuratedValue prevalence = CuratedValue.ofLabel("ORPHA:558", Criterion.PREVALENCE, "<1 / 1 000 000",
                SelectionMethod.CASE_REPORT_DEFAULT, 3.0, List.of("case-series"), List.of("orphadata"));
        CuratedValue therapies = CuratedValue.noUsableData("ORPHA:558", Criterion.THERAPIES, List.of("ema"));
        NormalizedScore prevalenceScore = new NormalizedScore("ORPHA:558", Criterion.PREVALENCE, 2.0, true, Map.of());

        List<PriorityResult> ranked = PriorityRanking.rank(List.of(new WeightedAggregator()
                .aggregate("ORPHA:558", "Marfan syndrome", Map.of(Criterion.PREVALENCE, 2.0), WEIGHTS)));

        List<EntityJustification> justifications = new JustificationBuilder()
                .build(ranked, List.of(prevalence, therapies), List.of(prevalenceScore));

        EntityJustification entity = justifications.get(0);
        assertEquals(1, entity.rank());
        assertEquals(1.0, entity.finalScore(), 1e-9);
        assertEquals(List.of("prevalence", "therapies", "gene"),
                entity.criteria().stream().map(CriterionJustification::criterion).toList());

        CriterionJustification prev = entity.criterion("prevalence").orElseThrow();
        assertEquals("CASE_REPORT_DEFAULT", prev.selectionMethod());
        assertEquals(List.of("case-series"), prev.supportingSources());
        assertEquals(1.0, prev.contribution(), 1e-9);
        assertTrue(prev.lowConfidence());
        assertTrue(prev.explanation().contains("rarest class"));

        CriterionJustification drugs = entity.criterion("therapies").orElseThrow();
        assertFalse(drugs.hasScore());
        assertEquals(List.of("ema"), drugs.excludedSources());
        assertEquals(0.0, drugs.contribution(), 1e-9);

        CriterionJustification gene = entity.criterion("gene").orElseThrow();
        assertEquals("not curated", gene.value());
    }

    @Test
    @DisplayName("Explanations name the rule that chose the value")
    void explanations() {
        CuratedValue fallback = CuratedValue.ofCounts("ORPHA:1", Criterion.CLINICAL_TRIALS, Map.of("active_trials", 2),
                SelectionMethod.REGIONAL_FALLBACK, 0.0, List.of("ctgov"), List.of());
        CuratedValue absent = CuratedValue.ofPresence("ORPHA:1", Criterion.GENE_TRACEABILITY, false,
                SelectionMethod.QUALIFYING_PRESENCE, 0.0, List.of(), List.of("orphadata"));

        assertTrue(JustificationBuilder.explain(Criterion.CLINICAL_TRIALS, fallback, 5.0).contains("fallback region"));
        assertTrue(JustificationBuilder.explain(Criterion.CLINICAL_TRIALS, fallback, 5.0).contains("5.00"));
        assertTrue(JustificationBuilder.explain(Criterion.GENE_TRACEABILITY, absent, 0.0)
                .startsWith("No qualifying association"));
    }
}
