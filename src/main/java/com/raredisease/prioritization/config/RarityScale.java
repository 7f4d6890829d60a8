package com.raredisease.prioritization.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordinal scale of prevalence classes, ordered from rarest (index 0) to most prevalent.
 * Also knows the placeholder labels that mean "no data".
 */
public final class RarityScale {

    private final List<RarityClass> classes;
    private final Set<String> placeholders;

    public RarityScale(List<RarityClass> classes, Set<String> placeholders) {
        if (classes == null || classes.isEmpty()) {
            throw new ConfigurationException("rarity scale must define at least one class");
        }
        this.classes = List.copyOf(classes);
        this.placeholders = placeholders != null ? Set.copyOf(placeholders) : Set.of();
        long distinct = this.classes.stream().map(c -> normalizeLabel(c.label())).distinct().count();
        if (distinct != this.classes.size()) {
            throw new ConfigurationException("rarity scale contains duplicate class labels");
        }
    }

    /**
     * Orphanet prevalence classes. The open-ended top class maps to a fixed ceiling.
     */
    public static RarityScale defaults() {
        return new RarityScale(List.of(
                new RarityClass("<1 / 1 000 000", 0.5, 2.0, Set.of("<1 / 1,000,000")),
                new RarityClass("1-9 / 1 000 000", 5.0, 5.0, Set.of("1-9 / 1,000,000")),
                new RarityClass("1-9 / 100 000", 50.0, 7.0, Set.of("1-9 / 100,000")),
                new RarityClass("1-5 / 10 000", 300.0, 8.0, Set.of("1-5 / 10,000")),
                new RarityClass("6-9 / 10 000", 750.0, 9.0, Set.of("6-9 / 10,000")),
                new RarityClass(">1 / 1000", 5000.0, 10.0, Set.of(">1 / 1,000"))
        ), Set.of("Unknown", "Not yet documented"));
    }

    public List<RarityClass> classes() {
        return classes;
    }

    public Set<String> placeholders() {
        return placeholders;
    }

    public boolean isPlaceholder(String label) {
        if (label == null || label.isBlank()) {
            return true;
        }
        String normalized = normalizeLabel(label);
        return placeholders.stream().anyMatch(p -> normalizeLabel(p).equals(normalized));
    }

    /**
     * Resolves a source label to its class, accepting aliases. Placeholders and
     * unknown labels resolve to empty.
     */
    public Optional<RarityClass> find(String label) {
        if (isPlaceholder(label)) {
            return Optional.empty();
        }
        return classes.stream().filter(c -> c.matches(label)).findFirst();
    }

    public int ordinal(RarityClass rarityClass) {
        return classes.indexOf(rarityClass);
    }

    public RarityClass rarest() {
        return classes.get(0);
    }

    /**
     * The class one step rarer, or the same class when already at the floor.
     */
    public RarityClass oneStepRarer(RarityClass rarityClass) {
        int index = classes.indexOf(rarityClass);
        if (index < 0) {
            throw new IllegalArgumentException("Class not on this scale: " + rarityClass.label());
        }
        return classes.get(Math.max(0, index - 1));
    }

    /**
     * Label to score table used by the class-midpoint normalization.
     */
    public Map<String, Double> scoreTable() {
        Map<String, Double> table = new LinkedHashMap<>();
        for (RarityClass c : classes) {
            table.put(c.label(), c.score());
        }
        return table;
    }

    static String normalizeLabel(String label) {
        return label.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s,]+", "");
    }
}
