package com.raredisease.prioritization.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Final weighted score and rank of one disease. Purely derived from normalized
 * scores and a weight vector; holds no state of its own.
 */
public final class PriorityResult {
    private final String entityId;
    private final String name;
    private final Map<Criterion, Double> normalizedScores;
    private final Map<Criterion, Double> weights;
    private final double finalScore;
    private final int rank;

    public PriorityResult(String entityId, String name, Map<Criterion, Double> normalizedScores,
                          Map<Criterion, Double> weights, double finalScore, int rank) {
        this.entityId = Objects.requireNonNull(entityId, "entityId is required");
        this.name = name != null ? name : entityId;
        this.normalizedScores = Collections.unmodifiableMap(copy(normalizedScores));
        this.weights = Collections.unmodifiableMap(copy(weights));
        this.finalScore = finalScore;
        this.rank = rank;
    }

    private static Map<Criterion, Double> copy(Map<Criterion, Double> source) {
        Map<Criterion, Double> copy = new EnumMap<>(Criterion.class);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getName() {
        return name;
    }

    /**
     * Normalized scores per criterion. A criterion without usable data is absent.
     */
    public Map<Criterion, Double> getNormalizedScores() {
        return normalizedScores;
    }

    public OptionalDouble getNormalizedScore(Criterion criterion) {
        Double score = normalizedScores.get(criterion);
        return score != null ? OptionalDouble.of(score) : OptionalDouble.empty();
    }

    public Map<Criterion, Double> getWeights() {
        return weights;
    }

    /**
     * Weighted contribution of one criterion; zero when the criterion has no score.
     */
    public double contribution(Criterion criterion) {
        return normalizedScores.getOrDefault(criterion, 0.0) * weights.getOrDefault(criterion, 0.0);
    }

    public double getFinalScore() {
        return finalScore;
    }

    /**
     * 1-based rank, or 0 while unranked.
     */
    public int getRank() {
        return rank;
    }

    public boolean isRanked() {
        return rank > 0;
    }

    public PriorityResult withRank(int newRank) {
        return new PriorityResult(entityId, name, normalizedScores, weights, finalScore, newRank);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PriorityResult that = (PriorityResult) o;
        return Double.compare(that.finalScore, finalScore) == 0
                && rank == that.rank
                && entityId.equals(that.entityId)
                && normalizedScores.equals(that.normalizedScores)
                && weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, normalizedScores, weights, finalScore, rank);
    }

    @Override
    public String toString() {
        return "PriorityResult{" +
                "entityId='" + entityId + '\'' +
                ", finalScore=" + finalScore +
                ", rank=" + rank +
                '}';
    }
}
