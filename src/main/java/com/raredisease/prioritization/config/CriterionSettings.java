package com.raredisease.prioritization.config;

import com.raredisease.prioritization.core.model.Criterion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Curation and normalization settings of one criterion.
 *
 * <p>Which fields matter depends on the strategy:</p>
 * <ul>
 *   <li>{@link NormalizationStrategy#CLASS_MIDPOINT}: {@code labelScores}</li>
 *   <li>{@link NormalizationStrategy#WINSORIZED_MIN_MAX}: {@code components}</li>
 *   <li>{@link NormalizationStrategy#BINARY}: {@code qualifyingSubtypes},
 *       {@code direction}, {@code singleValueOnly}</li>
 * </ul>
 */
public record CriterionSettings(
        Criterion criterion,
        double weight,
        NormalizationStrategy strategy,
        Map<String, Double> labelScores,
        List<CountComponent> components,
        Set<String> qualifyingSubtypes,
        ScoreDirection direction,
        boolean singleValueOnly
) {
    private static final double COMPONENT_WEIGHT_TOLERANCE = 0.001;

    public CriterionSettings {
        Objects.requireNonNull(criterion, "criterion is required");
        Objects.requireNonNull(strategy, "strategy is required");
        labelScores = labelScores != null ? Collections.unmodifiableMap(new LinkedHashMap<>(labelScores)) : Map.of();
        components = components != null ? List.copyOf(components) : List.of();
        qualifyingSubtypes = qualifyingSubtypes != null ? Set.copyOf(qualifyingSubtypes) : Set.of();
        direction = direction != null ? direction : ScoreDirection.MORE_IS_BETTER;
    }

    public static CriterionSettings classMidpoint(Criterion criterion, double weight, Map<String, Double> labelScores) {
        return new CriterionSettings(criterion, weight, NormalizationStrategy.CLASS_MIDPOINT,
                labelScores, null, null, null, false);
    }

    public static CriterionSettings winsorized(Criterion criterion, double weight, List<CountComponent> components) {
        return new CriterionSettings(criterion, weight, NormalizationStrategy.WINSORIZED_MIN_MAX,
                null, components, null, null, false);
    }

    public static CriterionSettings binary(Criterion criterion, double weight, Set<String> qualifyingSubtypes,
                                           ScoreDirection direction, boolean singleValueOnly) {
        return new CriterionSettings(criterion, weight, NormalizationStrategy.BINARY,
                null, null, qualifyingSubtypes, direction, singleValueOnly);
    }

    public CriterionSettings withWeight(double newWeight) {
        return new CriterionSettings(criterion, newWeight, strategy, labelScores, components,
                qualifyingSubtypes, direction, singleValueOnly);
    }

    public CriterionSettings withComponents(List<CountComponent> newComponents) {
        return new CriterionSettings(criterion, weight, strategy, labelScores, newComponents,
                qualifyingSubtypes, direction, singleValueOnly);
    }

    public CriterionSettings withLabelScores(Map<String, Double> newLabelScores) {
        return new CriterionSettings(criterion, weight, strategy, newLabelScores, components,
                qualifyingSubtypes, direction, singleValueOnly);
    }

    public CriterionSettings withQualifyingSubtypes(Set<String> subtypes, boolean singleOnly) {
        return new CriterionSettings(criterion, weight, strategy, labelScores, components,
                subtypes, direction, singleOnly);
    }

    /**
     * Checks the settings are complete for their strategy.
     *
     * @throws ConfigurationException on the first problem found
     */
    public void validate() {
        if (Double.isNaN(weight) || weight < 0.0) {
            throw new ConfigurationException("weight of " + criterion.key() + " must be >= 0");
        }
        switch (strategy) {
            case CLASS_MIDPOINT -> {
                if (criterion != Criterion.PREVALENCE && labelScores.isEmpty()) {
                    throw new ConfigurationException(criterion.key() + " needs a label score table");
                }
                labelScores.forEach((label, score) -> {
                    if (score == null || score < 0.0 || score > 10.0) {
                        throw new ConfigurationException("score of label '" + label + "' in "
                                + criterion.key() + " must be within [0, 10]");
                    }
                });
            }
            case WINSORIZED_MIN_MAX -> {
                if (components.isEmpty()) {
                    throw new ConfigurationException(criterion.key() + " needs at least one count component");
                }
                double sum = components.stream().mapToDouble(CountComponent::weight).sum();
                if (Math.abs(sum - 1.0) > COMPONENT_WEIGHT_TOLERANCE) {
                    throw new ConfigurationException("component weights of " + criterion.key()
                            + " must sum to 1.0, got " + sum);
                }
                long distinctNames = components.stream().map(CountComponent::name).distinct().count();
                if (distinctNames != components.size()) {
                    throw new ConfigurationException(criterion.key() + " has duplicate component names");
                }
            }
            case BINARY -> {
                if (qualifyingSubtypes.isEmpty()) {
                    throw new ConfigurationException(criterion.key() + " needs a qualifying subtype allow-list");
                }
            }
        }
    }
}
