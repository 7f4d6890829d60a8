package com.raredisease.prioritization.config;

import java.util.Objects;
import java.util.Set;

/**
 * One ordinal prevalence class.
 *
 * @param label              canonical label, e.g. {@code "1-9 / 1 000 000"}
 * @param midpointPerMillion representative cases per million, for reporting
 * @param score              normalized score the class maps to
 * @param aliases            alternative spellings found in source data
 */
public record RarityClass(String label, double midpointPerMillion, double score, Set<String> aliases) {

    public RarityClass {
        Objects.requireNonNull(label, "label is required");
        if (score < 0.0 || score > 10.0) {
            throw new ConfigurationException("score of rarity class '" + label + "' must be within [0, 10]");
        }
        aliases = aliases != null ? Set.copyOf(aliases) : Set.of();
    }

    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        String normalized = RarityScale.normalizeLabel(candidate);
        if (RarityScale.normalizeLabel(label).equals(normalized)) {
            return true;
        }
        return aliases.stream().anyMatch(a -> RarityScale.normalizeLabel(a).equals(normalized));
    }
}
