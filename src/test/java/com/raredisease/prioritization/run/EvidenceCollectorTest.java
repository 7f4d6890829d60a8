package com.raredisease.prioritization.run;

import com.raredisease.prioritization.EvidenceFixtures;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.Disease;
import com.raredisease.prioritization.core.model.MeasurementType;
import com.raredisease.prioritization.core.model.RunState;
import com.raredisease.prioritization.fetch.EvidenceFetchAdapter;
import com.raredisease.prioritization.fetch.EvidenceFetchException;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import com.raredisease.prioritization.store.InMemoryEvidenceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceCollectorTest {

    private InMemoryEvidenceStore store;
    private RunManager runManager;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        runManager = RunManager.builder().store(store).scorer(new ReliabilityScorer(6.0)).build();
    }

    @AfterEach
    void tearDown() {
        runManager.close();
    }

    @Test
    @DisplayName("Every key is processed and failures are reported without aborting others")
    void collectsEveryKey() {
        EvidenceFetchAdapter prevalence = (id, c) -> id.equals("ORPHA:2")
                ? List.of()
                : List.of(EvidenceFixtures.prevalence("orphadata", "1-9 / 100 000",
                        MeasurementType.POINT_PREVALENCE, "Worldwide"));
        EvidenceFetchAdapter genes = (id, c) -> {
            if (id.equals("ORPHA:3")) {
                throw new EvidenceFetchException("registry down");
            }
            return List.of(EvidenceFixtures.item("orphadata", "FBN1", "Disease-causing germline mutation(s) in", ""));
        };
        List<Disease> diseases = List.of(
                Disease.of("ORPHA:1", "Disease one"),
                Disease.of("ORPHA:2", "Disease two"),
                Disease.of("ORPHA:3", "Disease three"));

        CollectionReport report;
        try (EvidenceCollector collector = new EvidenceCollector(runManager,
                Map.of(Criterion.PREVALENCE, prevalence, Criterion.GENE_TRACEABILITY, genes), 2, 2)) {
            report = collector.collect(diseases, EnumSet.of(Criterion.PREVALENCE, Criterion.GENE_TRACEABILITY));
        }

        assertEquals(6, report.totalKeys());
        assertEquals(4, report.succeeded());
        assertEquals(1, report.exhaustedEmpty().size());
        assertEquals("ORPHA:2", report.exhaustedEmpty().get(0).entityId());
        assertEquals(1, report.exhaustedFailed().size());
        assertEquals("registry down", report.exhaustedFailed().get(0).reason());
        assertEquals(RunState.EXHAUSTED_FAILED, report.exhaustedFailed().get(0).state());
        assertEquals(2 + 2 + 4, store.countRuns());
    }

    @Test
    @DisplayName("Criteria without an adapter are skipped")
    void missingAdapterSkipped() {
        EvidenceFetchAdapter prevalence = (id, c) -> List.of(EvidenceFixtures.prevalence("orphadata",
                "1-9 / 100 000", MeasurementType.POINT_PREVALENCE, "Worldwide"));

        CollectionReport report;
        try (EvidenceCollector collector = new EvidenceCollector(runManager,
                Map.of(Criterion.PREVALENCE, prevalence), 3, 4)) {
            report = collector.collect(List.of(Disease.of("ORPHA:1", "One")),
                    EnumSet.of(Criterion.PREVALENCE, Criterion.THERAPIES));
        }

        assertEquals(1, report.totalKeys());
        assertFalse(report.hasFailures());
        assertTrue(store.findRuns("ORPHA:1", Criterion.THERAPIES).isEmpty());
    }

    @Test
    @DisplayName("Non-positive concurrency is rejected")
    void invalidConcurrency() {
        assertThrows(IllegalArgumentException.class,
                () -> new EvidenceCollector(runManager, Map.of(), 3, 0));
    }
}
