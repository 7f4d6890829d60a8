package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.SelectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raredisease.prioritization.EvidenceFixtures.item;
import static com.raredisease.prioritization.EvidenceFixtures.scored;
import static org.junit.jupiter.api.Assertions.*;

class EvidenceLevelResolverTest {

    private final EvidenceLevelResolver resolver = new EvidenceLevelResolver(
            PrioritizationConfig.defaults().settings(Criterion.SOCIOECONOMIC).labelScores());

    @Test
    @DisplayName("Most reliable known level wins, case-insensitively")
    void mostReliableKnownLevel() {
        CuratedValue value = resolver.resolve("ORPHA:1", Criterion.SOCIOECONOMIC, List.of(
                scored(item("search-a", "medium evidence", null, ""), 4.0),
                scored(item("search-b", "High evidence", null, ""), 7.0),
                scored(item("search-c", "overwhelming", null, ""), 9.0)));

        assertEquals("High evidence", value.getLabel().orElseThrow());
        assertEquals(SelectionMethod.BEST_RELIABILITY, value.getSelectionMethod());
        assertEquals(List.of("search-c"), value.getExcludedSources());
    }

    @Test
    @DisplayName("Only unknown levels give no usable data")
    void unknownLevels() {
        CuratedValue value = resolver.resolve("ORPHA:1", Criterion.SOCIOECONOMIC, List.of(
                scored(item("search-c", "overwhelming", null, ""), 9.0)));
        assertFalse(value.hasUsableData());
    }
}
