package com.raredisease.prioritization.run;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.EvidenceRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceValidatorTest {

    private final EvidenceValidator validator = new EvidenceValidator();

    @Test
    @DisplayName("Well-formed records pass untouched")
    void wellFormed() {
        EvidenceRecord record = EvidenceRecord.builder().source("ctgov").value("NCT01").amount(3.0).build();
        EvidenceValidator.Result result = validator.validate("ORPHA:1", Criterion.CLINICAL_TRIALS, List.of(record));
        assertEquals(List.of(record), result.valid());
        assertEquals(0, result.dropped());
        assertFalse(result.allMalformed());
    }

    @Test
    @DisplayName("Null, sourceless, valueless and negative-amount records are dropped")
    void malformedDropped() {
        List<EvidenceRecord> batch = Arrays.asList(
                null,
                EvidenceRecord.builder().value("NCT01").build(),
                EvidenceRecord.builder().source("ctgov").value("").build(),
                EvidenceRecord.builder().source("ctgov").value("NCT02").amount(-1.0).build(),
                EvidenceRecord.builder().source("ctgov").value("NCT03").amount(Double.NaN).build());

        EvidenceValidator.Result result = validator.validate("ORPHA:1", Criterion.CLINICAL_TRIALS, batch);

        assertEquals(5, result.dropped());
        assertTrue(result.allMalformed());
    }

    @Test
    @DisplayName("Problem description names the missing field")
    void problemDescription() {
        assertEquals("missing value",
                validator.problem(EvidenceRecord.builder().source("s").build()).orElseThrow());
        assertTrue(validator.problem(EvidenceRecord.builder().source("s").value("v").build()).isEmpty());
    }
}
