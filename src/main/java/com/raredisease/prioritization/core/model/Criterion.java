package com.raredisease.prioritization.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six evidence dimensions a disease is scored on.
 * Each criterion carries the key used for it in configuration files and exports.
 */
public enum Criterion {
    PREVALENCE("prevalence"),
    SOCIOECONOMIC("socioeconomic"),
    THERAPIES("therapies"),
    CLINICAL_TRIALS("clinical_trials"),
    GENE_TRACEABILITY("gene"),
    RESEARCH_CAPACITY("research_groups");

    private final String key;

    Criterion(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Looks up a criterion by its configuration key or enum name, case-insensitively.
     */
    public static Optional<Criterion> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        return Arrays.stream(values())
                .filter(c -> c.key.equalsIgnoreCase(trimmed) || c.name().equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
