package com.raredisease.prioritization.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RarityScaleTest {

    private final RarityScale scale = RarityScale.defaults();

    @Test
    @DisplayName("Labels resolve with or without thousands separators")
    void aliasesResolve() {
        RarityClass canonical = scale.find("1-9 / 1 000 000").orElseThrow();
        assertEquals(canonical, scale.find("1-9 / 1,000,000").orElseThrow());
        assertEquals(canonical, scale.find(" 1-9/1 000 000 ").orElseThrow());
    }

    @Test
    @DisplayName("Placeholders never resolve to a class")
    void placeholders() {
        assertTrue(scale.find("Unknown").isEmpty());
        assertTrue(scale.find("Not yet documented").isEmpty());
        assertTrue(scale.find("").isEmpty());
        assertTrue(scale.isPlaceholder(null));
    }

    @Test
    @DisplayName("One step rarer moves down the scale and stops at the floor")
    void oneStepRarer() {
        RarityClass common = scale.find(">1 / 1000").orElseThrow();
        assertEquals("6-9 / 10 000", scale.oneStepRarer(common).label());

        RarityClass floor = scale.rarest();
        assertEquals("<1 / 1 000 000", floor.label());
        assertEquals(floor, scale.oneStepRarer(floor));
    }

    @Test
    @DisplayName("Score table maps the rarest-but-one class to 5")
    void scoreTable() {
        assertEquals(5.0, scale.scoreTable().get("1-9 / 1 000 000"));
        assertEquals(6, scale.scoreTable().size());
    }
}
