package com.raredisease.prioritization.aggregate;

import com.raredisease.prioritization.config.ConfigurationException;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.PriorityResult;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines normalized criterion scores into one weighted score per disease:
 * {@code final = sum(score[c] * weight[c])}. A criterion without a score
 * contributes zero.
 */
public class WeightedAggregator {

    public PriorityResult aggregate(String entityId, Map<Criterion, Double> scores, Map<Criterion, Double> weights) {
        return aggregate(entityId, entityId, scores, weights);
    }

    public PriorityResult aggregate(String entityId, String name, Map<Criterion, Double> scores,
                                    Map<Criterion, Double> weights) {
        double finalScore = 0.0;
        for (Criterion criterion : Criterion.values()) {
            Double weight = weights.get(criterion);
            Double score = scores.get(criterion);
            if (weight != null && score != null) {
                finalScore += score * weight;
            }
        }
        return new PriorityResult(entityId, name, scores, weights, finalScore, 0);
    }

    /**
     * Recomputes final scores and ranks under a new weight vector without touching
     * curated or normalized values. Every weight must be non-negative and name a
     * criterion the results were scored under.
     *
     * @throws ConfigurationException if the weight vector is invalid
     */
    public List<PriorityResult> reweight(List<PriorityResult> results, Map<Criterion, Double> weights) {
        validate(results, weights);
        List<PriorityResult> reweighted = results.stream()
                .map(r -> aggregate(r.getEntityId(), r.getName(), r.getNormalizedScores(), weights))
                .toList();
        return PriorityRanking.rank(reweighted);
    }

    private static void validate(List<PriorityResult> results, Map<Criterion, Double> weights) {
        Set<Criterion> configured = EnumSet.noneOf(Criterion.class);
        results.forEach(r -> configured.addAll(r.getWeights().keySet()));
        weights.forEach((criterion, weight) -> {
            if (weight == null || Double.isNaN(weight) || weight < 0.0) {
                throw new ConfigurationException("weight of " + criterion.key() + " must be >= 0");
            }
            if (!results.isEmpty() && !configured.contains(criterion)) {
                throw new ConfigurationException("Cannot weight unconfigured criterion: " + criterion.key());
            }
        });
    }
}
