package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.SelectionMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.raredisease.prioritization.EvidenceFixtures.item;
import static com.raredisease.prioritization.EvidenceFixtures.scored;
import static org.junit.jupiter.api.Assertions.*;

class PresenceResolverTest {

    private static final String ID = "ORPHA:558";
    private static final String GERMLINE = "Disease-causing germline mutation(s) in";

    private final Set<String> allowList =
            PrioritizationConfig.defaults().settings(Criterion.GENE_TRACEABILITY).qualifyingSubtypes();

    @Test
    @DisplayName("One disease-causing association is enough")
    void presentWithOneQualifying() {
        PresenceResolver resolver = new PresenceResolver(allowList, false);
        CuratedValue value = resolver.resolve(ID, Criterion.GENE_TRACEABILITY, List.of(
                scored(item("orphadata", "FBN1", GERMLINE, ""), 0.0),
                scored(item("orphadata", "TGFBR2", "Candidate gene tested in", ""), 0.0)));

        assertTrue(value.getPresent().orElseThrow());
        assertEquals(SelectionMethod.QUALIFYING_PRESENCE, value.getSelectionMethod());
        assertEquals(List.of("orphadata"), value.getSupportingSources());
    }

    @Test
    @DisplayName("Associations outside the allow-list do not count")
    void absentWithoutQualifying() {
        PresenceResolver resolver = new PresenceResolver(allowList, false);
        CuratedValue value = resolver.resolve(ID, Criterion.GENE_TRACEABILITY, List.of(
                scored(item("orphadata", "TGFBR2", "Major susceptibility factor in", ""), 0.0)));

        assertFalse(value.getPresent().orElseThrow());
        assertTrue(value.hasUsableData());
    }

    @Test
    @DisplayName("Single-value mode requires exactly one distinct gene")
    void singleValueOnly() {
        PresenceResolver resolver = new PresenceResolver(allowList, true);
        CuratedValue polygenic = resolver.resolve(ID, Criterion.GENE_TRACEABILITY, List.of(
                scored(item("orphadata", "FBN1", GERMLINE, ""), 0.0),
                scored(item("orphadata", "FBN2", GERMLINE, ""), 0.0)));
        CuratedValue monogenic = resolver.resolve(ID, Criterion.GENE_TRACEABILITY, List.of(
                scored(item("orphadata", "FBN1", GERMLINE, ""), 0.0),
                scored(item("clinvar", "FBN1", GERMLINE, ""), 0.0)));

        assertFalse(polygenic.getPresent().orElseThrow());
        assertTrue(monogenic.getPresent().orElseThrow());
    }

    @Test
    @DisplayName("Empty evidence means absent")
    void emptyEvidence() {
        CuratedValue value = new PresenceResolver(allowList, false).emptyEvidence(ID, Criterion.GENE_TRACEABILITY);
        assertFalse(value.getPresent().orElseThrow());
        assertEquals(SelectionMethod.EMPTY_EVIDENCE, value.getSelectionMethod());
    }
}
