package com.raredisease.prioritization.config;

import java.util.Objects;
import java.util.Set;

/**
 * One sub-count of a count-style criterion, e.g. commercial-name drugs versus
 * general medical products.
 *
 * <p>A record qualifies when its subtype is on {@code qualifyingSubtypes} (an empty
 * list admits every subtype) and, when {@code preferredRegions} is non-empty, its
 * geographic area is in that set. If nothing qualifies in the preferred set and
 * {@code fallbackRegions} is non-empty, the fallback set is counted instead.</p>
 *
 * @param name               component name used in curated values and exports
 * @param qualifyingSubtypes allow-list of subtypes
 * @param preferredRegions   regions counted first
 * @param fallbackRegions    regions counted when the preferred set yields nothing
 * @param weight             share of the criterion score, components sum to 1
 * @param direction          whether more records raise or lower priority
 * @param fixedCap           winsorization cap overriding the corpus IQR cap, or null
 */
public record CountComponent(
        String name,
        Set<String> qualifyingSubtypes,
        Set<String> preferredRegions,
        Set<String> fallbackRegions,
        double weight,
        ScoreDirection direction,
        Double fixedCap
) {
    public CountComponent {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(direction, "direction is required");
        qualifyingSubtypes = qualifyingSubtypes != null ? Set.copyOf(qualifyingSubtypes) : Set.of();
        preferredRegions = preferredRegions != null ? Set.copyOf(preferredRegions) : Set.of();
        fallbackRegions = fallbackRegions != null ? Set.copyOf(fallbackRegions) : Set.of();
        if (weight <= 0.0 || weight > 1.0) {
            throw new ConfigurationException("weight of component '" + name + "' must be within (0, 1]");
        }
        if (fixedCap != null && fixedCap <= 0.0) {
            throw new ConfigurationException("fixedCap of component '" + name + "' must be > 0");
        }
        if (!fallbackRegions.isEmpty() && preferredRegions.isEmpty()) {
            throw new ConfigurationException("component '" + name + "' declares fallback regions without preferred ones");
        }
    }

    public static CountComponent of(String name, Set<String> qualifyingSubtypes, ScoreDirection direction) {
        return new CountComponent(name, qualifyingSubtypes, Set.of(), Set.of(), 1.0, direction, null);
    }

    /**
     * Subtypes match case-insensitively; an empty allow-list admits everything.
     */
    public boolean admitsSubtype(String subtype) {
        if (qualifyingSubtypes.isEmpty()) {
            return true;
        }
        return subtype != null && qualifyingSubtypes.stream().anyMatch(s -> s.equalsIgnoreCase(subtype.trim()));
    }

    public boolean inPreferredRegion(String area) {
        return preferredRegions.isEmpty() || matchesRegion(preferredRegions, area);
    }

    public boolean inFallbackRegion(String area) {
        return matchesRegion(fallbackRegions, area);
    }

    private static boolean matchesRegion(Set<String> regions, String area) {
        return area != null && regions.stream().anyMatch(r -> r.equalsIgnoreCase(area.trim()));
    }

    public boolean hasFallback() {
        return !fallbackRegions.isEmpty();
    }

    public CountComponent withFixedCap(Double cap) {
        return new CountComponent(name, qualifyingSubtypes, preferredRegions, fallbackRegions, weight, direction, cap);
    }
}
