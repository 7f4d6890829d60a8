package com.raredisease.prioritization.pipeline;

import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.Disease;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.MeasurementType;
import com.raredisease.prioritization.core.model.PriorityResult;
import com.raredisease.prioritization.export.EntityJustification;
import com.raredisease.prioritization.fetch.EvidenceFetchException;
import com.raredisease.prioritization.metrics.MicrometerPipelineMetrics;
import com.raredisease.prioritization.run.CollectionReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.raredisease.prioritization.EvidenceFixtures.item;
import static com.raredisease.prioritization.EvidenceFixtures.prevalence;
import static org.junit.jupiter.api.Assertions.*;

class PrioritizationPipelineTest {

    private static final String GERMLINE = "Disease-causing germline mutation(s) in";

    private static final List<Disease> DISEASES = List.of(
            Disease.of("ORPHA:558", "Marfan syndrome"),
            Disease.of("ORPHA:79", "Phenylketonuria"),
            Disease.of("ORPHA:3", "Undocumented disorder"));

    private final AtomicInteger fetches = new AtomicInteger();
    private SimpleMeterRegistry registry;
    private PrioritizationPipeline pipeline;

    @BeforeEach
    void setUp() {
        PrioritizationConfig config = PrioritizationConfig.builder()
                .withoutCriterion(Criterion.SOCIOECONOMIC)
                .withoutCriterion(Criterion.CLINICAL_TRIALS)
                .withoutCriterion(Criterion.RESEARCH_CAPACITY)
                .weight(Criterion.PREVALENCE, 0.4)
                .weight(Criterion.THERAPIES, 0.4)
                .weight(Criterion.GENE_TRACEABILITY, 0.2)
                .maxAttempts(2)
                .maxConcurrency(2)
                .fetchTimeout(null)
                .build();
        registry = new SimpleMeterRegistry();

        pipeline = PrioritizationPipeline.builder()
                .config(config)
                .metrics(new MicrometerPipelineMetrics(registry))
                .adapter(Criterion.PREVALENCE, (id, c) -> {
                    fetches.incrementAndGet();
                    return switch (id) {
                        case "ORPHA:558" -> List.of(prevalence("orphadata", "1-9 / 1 000 000",
                                MeasurementType.POINT_PREVALENCE, "Worldwide"));
                        case "ORPHA:79" -> List.of(prevalence("orphadata", "1-5 / 10 000",
                                MeasurementType.POINT_PREVALENCE, "Worldwide"));
                        default -> throw new EvidenceFetchException("registry down");
                    };
                })
                .adapter(Criterion.THERAPIES, (id, c) -> {
                    fetches.incrementAndGet();
                    return id.equals("ORPHA:79")
                            ? List.of(item("orphadata", "Kuvan", "TRADENAME", "EU"),
                                      item("orphadata", "Palynziq", "TRADENAME", "EU"))
                            : List.<EvidenceRecord>of();
                })
                .adapter(Criterion.GENE_TRACEABILITY, (id, c) -> {
                    fetches.incrementAndGet();
                    return switch (id) {
                        case "ORPHA:558" -> List.of(item("orphadata", "FBN1", GERMLINE, ""));
                        case "ORPHA:79" -> List.of(item("orphadata", "PAH", GERMLINE, ""));
                        default -> List.<EvidenceRecord>of();
                    };
                })
                .build();
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    @DisplayName("Batch is collected, scored and ranked")
    void endToEnd() {
        PrioritizationOutcome outcome = pipeline.run(DISEASES);

        assertEquals(List.of("ORPHA:558", "ORPHA:79", "ORPHA:3"),
                outcome.ranking().stream().map(PriorityResult::getEntityId).toList());
        // prevalence 5, no drugs 10, gene 10
        assertEquals(8.0, outcome.result("ORPHA:558").orElseThrow().getFinalScore(), 1e-9);
        // prevalence 8, two tradenames against a cap of 2.5, gene 10
        assertEquals(6.64, outcome.result("ORPHA:79").orElseThrow().getFinalScore(), 1e-9);
        // no prevalence, no drugs, no gene
        assertEquals(4.0, outcome.result("ORPHA:3").orElseThrow().getFinalScore(), 1e-9);

        assertEquals(9, outcome.curatedValues().size());
        assertEquals(8, outcome.scores().size());
        assertEquals(2.5, outcome.statistics().cap(Criterion.THERAPIES, "eu_tradename"), 1e-9);
    }

    @Test
    @DisplayName("Keys without evidence are reported with their reason")
    void collectionReport() {
        CollectionReport report = pipeline.run(DISEASES).collection();

        assertEquals(9, report.totalKeys());
        assertEquals(5, report.succeeded());
        assertEquals(1, report.exhaustedFailed().size());
        assertEquals("registry down", report.exhaustedFailed().get(0).reason());
        assertEquals(3, report.exhaustedEmpty().size());
        assertEquals(1.0, registry.get("prioritization.batch.size").summary().count());
    }

    @Test
    @DisplayName("Justifications explain every criterion in rank order")
    void justifications() {
        List<EntityJustification> justifications = pipeline.run(DISEASES).justifications();

        EntityJustification last = justifications.get(2);
        assertEquals("ORPHA:3", last.entityId());
        assertFalse(last.criterion("prevalence").orElseThrow().hasScore());
        assertEquals("EMPTY_EVIDENCE", last.criterion("therapies").orElseThrow().selectionMethod());
    }

    @Nested
    @DisplayName("Re-running")
    class RerunTests {

        @Test
        @DisplayName("A second run fetches nothing new and scores the same")
        void idempotent() {
            PrioritizationOutcome first = pipeline.run(DISEASES);
            int fetchesAfterFirst = fetches.get();
            int runsAfterFirst = pipeline.getStore().countRuns();

            PrioritizationOutcome second = pipeline.run(DISEASES);

            assertEquals(fetchesAfterFirst, fetches.get());
            assertEquals(runsAfterFirst, pipeline.getStore().countRuns());
            assertEquals(first.ranking().stream().map(PriorityResult::getFinalScore).toList(),
                    second.ranking().stream().map(PriorityResult::getFinalScore).toList());
        }

        @Test
        @DisplayName("Scoring from the store alone does not fetch")
        void scoreOnly() {
            pipeline.run(DISEASES);
            int fetchesAfterRun = fetches.get();

            PrioritizationOutcome scored = pipeline.score(DISEASES);

            assertEquals(fetchesAfterRun, fetches.get());
            assertNull(scored.collection());
            assertEquals("ORPHA:558", scored.ranking().get(0).getEntityId());
        }

        @Test
        @DisplayName("Reweighting re-ranks without new curation")
        void reweight() {
            PrioritizationOutcome outcome = pipeline.run(DISEASES);
            Map<Criterion, Double> therapiesOnly = new EnumMap<>(Criterion.class);
            therapiesOnly.put(Criterion.PREVALENCE, 0.0);
            therapiesOnly.put(Criterion.THERAPIES, 1.0);
            therapiesOnly.put(Criterion.GENE_TRACEABILITY, 0.0);

            PrioritizationOutcome reweighted = pipeline.reweight(outcome, therapiesOnly);

            assertEquals(List.of("ORPHA:3", "ORPHA:558", "ORPHA:79"),
                    reweighted.ranking().stream().map(PriorityResult::getEntityId).toList());
            assertEquals(outcome.curatedValues(), reweighted.curatedValues());
            assertEquals(10.0, reweighted.justifications().get(0).finalScore(), 1e-9);
        }
    }

    @Test
    @DisplayName("Duplicate disease ids are rejected")
    void duplicateIds() {
        List<Disease> duplicated = List.of(Disease.of("ORPHA:1", "a"), Disease.of("ORPHA:1", "b"));
        assertThrows(IllegalArgumentException.class, () -> pipeline.run(duplicated));
        assertEquals(0, fetches.get());
    }
}
