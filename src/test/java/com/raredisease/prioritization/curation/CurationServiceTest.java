package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.cache.CacheConfig;
import com.raredisease.prioritization.cache.CaffeineCuratedValueCache;
import com.raredisease.prioritization.cache.CuratedValueCache;
import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.MeasurementType;
import com.raredisease.prioritization.core.model.RunRecord;
import com.raredisease.prioritization.core.model.SelectionMethod;
import com.raredisease.prioritization.metrics.MicrometerPipelineMetrics;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import com.raredisease.prioritization.store.InMemoryEvidenceStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.raredisease.prioritization.EvidenceFixtures.prevalence;
import static com.raredisease.prioritization.EvidenceFixtures.scored;
import static org.junit.jupiter.api.Assertions.*;

class CurationServiceTest {

    private static final String ID = "ORPHA:558";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryEvidenceStore store;
    private CuratedValueCache cache;
    private SimpleMeterRegistry registry;
    private CurationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryEvidenceStore();
        cache = new CaffeineCuratedValueCache(CacheConfig.defaults());
        registry = new SimpleMeterRegistry();
        PrioritizationConfig config = PrioritizationConfig.defaults();
        service = new CurationService(store, config, new ReliabilityScorer(config.getReliabilityThreshold()),
                cache, new MicrometerPipelineMetrics(registry));
    }

    private void appendPrevalenceRun(int runNumber) {
        store.appendRun(RunRecord.nonEmpty(ID, Criterion.PREVALENCE, runNumber, List.of(
                scored(prevalence("orphadata", "1-9 / 100 000", MeasurementType.POINT_PREVALENCE, "Worldwide"), 9.0)),
                0, NOW));
    }

    @Nested
    @DisplayName("Active run policy")
    class ActiveRunTests {

        @Test
        @DisplayName("Non-empty run is resolved and stored")
        void resolvesNonEmptyRun() {
            appendPrevalenceRun(1);

            CuratedValue value = service.resolve(ID, Criterion.PREVALENCE);

            assertEquals("1-9 / 100 000", value.getLabel().orElseThrow());
            assertEquals(value, store.findCuratedValue(ID, Criterion.PREVALENCE).orElseThrow());
            assertEquals(1.0, registry.get("prioritization.curations")
                    .tag("criterion", "prevalence")
                    .tag("method", SelectionMethod.POINT_PREVALENCE.name())
                    .counter().count());
        }

        @Test
        @DisplayName("A later failure does not hide an earlier success")
        void successSurvivesLaterFailure() {
            appendPrevalenceRun(1);
            store.appendRun(RunRecord.failed(ID, Criterion.PREVALENCE, 2, "timeout", 0, NOW));

            assertTrue(service.resolve(ID, Criterion.PREVALENCE).hasUsableData());
        }

        @Test
        @DisplayName("Failed and never-run keys have no usable data")
        void failedOrMissing() {
            store.appendRun(RunRecord.failed(ID, Criterion.THERAPIES, 1, "registry down", 0, NOW));

            assertEquals(SelectionMethod.NO_USABLE_DATA, service.resolve(ID, Criterion.THERAPIES).getSelectionMethod());
            assertEquals(SelectionMethod.NO_USABLE_DATA, service.resolve(ID, Criterion.GENE_TRACEABILITY).getSelectionMethod());
        }

        @Test
        @DisplayName("Empty fetch means zero drugs but unknown prevalence")
        void emptyEvidencePolicy() {
            store.appendRun(RunRecord.empty(ID, Criterion.THERAPIES, 1, NOW));
            store.appendRun(RunRecord.empty(ID, Criterion.PREVALENCE, 1, NOW));
            store.appendRun(RunRecord.empty(ID, Criterion.GENE_TRACEABILITY, 1, NOW));

            CuratedValue therapies = service.resolve(ID, Criterion.THERAPIES);
            assertEquals(SelectionMethod.EMPTY_EVIDENCE, therapies.getSelectionMethod());
            assertEquals(0, therapies.getCount("eu_tradename"));

            assertFalse(service.resolve(ID, Criterion.PREVALENCE).hasUsableData());
            assertFalse(service.resolve(ID, Criterion.GENE_TRACEABILITY).getPresent().orElseThrow());
        }

        @Test
        @DisplayName("Re-resolving supersedes the stored value")
        void supersedes() {
            store.appendRun(RunRecord.failed(ID, Criterion.PREVALENCE, 1, "timeout", 0, NOW));
            service.resolve(ID, Criterion.PREVALENCE);
            appendPrevalenceRun(2);

            service.resolve(ID, Criterion.PREVALENCE);

            assertTrue(store.findCuratedValue(ID, Criterion.PREVALENCE).orElseThrow().hasUsableData());
        }
    }

    @Test
    @DisplayName("Unconfigured criterion is rejected")
    void unconfiguredCriterion() {
        PrioritizationConfig config = PrioritizationConfig.builder().withoutCriterion(Criterion.SOCIOECONOMIC).build();
        CurationService narrow = new CurationService(store, config, new ReliabilityScorer(6.0));

        assertThrows(IllegalArgumentException.class, () -> narrow.resolve(ID, Criterion.SOCIOECONOMIC));
    }

    @Test
    @DisplayName("resolveAll covers every pair")
    void resolveAll() {
        List<CuratedValue> values = service.resolveAll(List.of("ORPHA:1", "ORPHA:2"),
                List.of(Criterion.PREVALENCE, Criterion.THERAPIES));

        assertEquals(4, values.size());
        assertEquals(4, store.findAllCuratedValues().size());
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Resolved values are served from the cache")
        void cacheHit() {
            appendPrevalenceRun(1);
            service.resolve(ID, Criterion.PREVALENCE);

            assertTrue(service.find(ID, Criterion.PREVALENCE).isPresent());
            assertEquals(1.0, registry.get("prioritization.cache.hit").counter().count());
        }

        @Test
        @DisplayName("Cache misses fall back to the store")
        void cacheMiss() {
            appendPrevalenceRun(1);
            service.resolve(ID, Criterion.PREVALENCE);
            cache.invalidateAll();

            assertTrue(service.find(ID, Criterion.PREVALENCE).isPresent());
            assertEquals(1.0, registry.get("prioritization.cache.miss").counter().count());
            assertTrue(cache.get(ID, Criterion.PREVALENCE).isPresent());
        }
    }
}
