package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.config.RarityScale;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import com.raredisease.prioritization.core.model.MeasurementType;
import com.raredisease.prioritization.core.model.SelectionMethod;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static com.raredisease.prioritization.EvidenceFixtures.prevalence;
import static com.raredisease.prioritization.EvidenceFixtures.weakPrevalence;
import static org.junit.jupiter.api.Assertions.*;

class PrevalenceResolverTest {

    private static final String ID = "ORPHA:558";

    private final ReliabilityScorer scorer = new ReliabilityScorer(6.0);
    private final PrevalenceResolver resolver = new PrevalenceResolver(RarityScale.defaults(), scorer);

    private CuratedValue resolve(EvidenceRecord... records) {
        List<EvidenceRecord> scored = Arrays.stream(records).map(scorer::scored).toList();
        return resolver.resolve(ID, Criterion.PREVALENCE, scored);
    }

    @Nested
    @DisplayName("Tier order")
    class TierTests {

        @Test
        @DisplayName("Point prevalence wins over case reports")
        void pointBeatsCaseReports() {
            CuratedValue value = resolve(
                    weakPrevalence("case-series", "<1 / 1 000 000", MeasurementType.CASES_FAMILIES, "Worldwide"),
                    prevalence("orphadata", "1-9 / 1,000,000", MeasurementType.POINT_PREVALENCE, "Worldwide"));

            assertEquals(SelectionMethod.POINT_PREVALENCE, value.getSelectionMethod());
            assertEquals("1-9 / 1 000 000", value.getLabel().orElseThrow());
            assertEquals(List.of("orphadata"), value.getSupportingSources());
            assertEquals(9.0, value.getConfidence(), 1e-9);
        }

        @Test
        @DisplayName("Reliable global record wins over a more reliable regional one")
        void globalBeatsRegional() {
            CuratedValue value = resolve(
                    prevalence("regional", "1-5 / 10 000", MeasurementType.ANNUAL_INCIDENCE, "France"),
                    prevalence("global", "1-9 / 100 000", MeasurementType.ANNUAL_INCIDENCE, "Worldwide"));

            assertEquals(SelectionMethod.GLOBAL_RELIABLE, value.getSelectionMethod());
            assertEquals("1-9 / 100 000", value.getLabel().orElseThrow());
        }

        @Test
        @DisplayName("Reliable regional record is used when no global one qualifies")
        void regionalFallback() {
            CuratedValue value = resolve(
                    weakPrevalence("weak-global", ">1 / 1000", MeasurementType.ANNUAL_INCIDENCE, "Worldwide"),
                    prevalence("regional", "1-5 / 10 000", MeasurementType.ANNUAL_INCIDENCE, "Spain"));

            assertEquals(SelectionMethod.REGIONAL_RELIABLE, value.getSelectionMethod());
            assertEquals("1-5 / 10 000", value.getLabel().orElseThrow());
        }

        @Test
        @DisplayName("Birth prevalence is moved one class rarer")
        void birthShifted() {
            CuratedValue value = resolve(
                    weakPrevalence("birth", ">1 / 1000", MeasurementType.PREVALENCE_AT_BIRTH, "Worldwide"));

            assertEquals(SelectionMethod.BIRTH_PREVALENCE_ADJUSTED, value.getSelectionMethod());
            assertEquals("6-9 / 10 000", value.getLabel().orElseThrow());
        }

        @Test
        @DisplayName("Birth prevalence already at the rarest class stays there")
        void birthAtFloor() {
            CuratedValue value = resolve(
                    weakPrevalence("birth", "<1 / 1 000 000", MeasurementType.PREVALENCE_AT_BIRTH, "Worldwide"));

            assertEquals("<1 / 1 000 000", value.getLabel().orElseThrow());
        }

        @Test
        @DisplayName("Case reports alone map to the rarest class even with a placeholder label")
        void caseReportsDefault() {
            CuratedValue value = resolve(
                    weakPrevalence("case-series", "Unknown", MeasurementType.CASES_FAMILIES, "Worldwide"));

            assertEquals(SelectionMethod.CASE_REPORT_DEFAULT, value.getSelectionMethod());
            assertEquals("<1 / 1 000 000", value.getLabel().orElseThrow());
        }
    }

    @Test
    @DisplayName("Placeholders and unreliable non-point records give no usable data")
    void noUsableData() {
        CuratedValue value = resolve(
                prevalence("orphadata", "Not yet documented", MeasurementType.POINT_PREVALENCE, "Worldwide"),
                weakPrevalence("weak", "1-9 / 100 000", MeasurementType.ANNUAL_INCIDENCE, "Worldwide"));

        assertFalse(value.hasUsableData());
        assertEquals(SelectionMethod.NO_USABLE_DATA, value.getSelectionMethod());
        assertTrue(value.getExcludedSources().contains("orphadata"));
    }

    @Nested
    @DisplayName("Tie-break")
    class TieBreakTests {

        @Test
        @DisplayName("Equal reliability prefers the most recent observation")
        void mostRecentWins() {
            EvidenceRecord older = prevalence("older", "1-9 / 100 000", MeasurementType.POINT_PREVALENCE, "Worldwide")
                    .toBuilder().observedAt(Instant.parse("2019-01-01T00:00:00Z")).build();
            EvidenceRecord newer = prevalence("newer", "1-5 / 10 000", MeasurementType.POINT_PREVALENCE, "Worldwide")
                    .toBuilder().observedAt(Instant.parse("2023-01-01T00:00:00Z")).build();

            assertEquals("1-5 / 10 000", resolve(older, newer).getLabel().orElseThrow());
            assertEquals("1-5 / 10 000", resolve(newer, older).getLabel().orElseThrow());
        }

        @Test
        @DisplayName("Equal reliability and date fall back to source name")
        void sourceNameWins() {
            EvidenceRecord b = prevalence("b-source", "1-9 / 100 000", MeasurementType.POINT_PREVALENCE, "Worldwide");
            EvidenceRecord a = prevalence("a-source", "1-5 / 10 000", MeasurementType.POINT_PREVALENCE, "Worldwide");

            assertEquals("1-5 / 10 000", resolve(b, a).getLabel().orElseThrow());
        }
    }
}
