package com.raredisease.prioritization.export;

import java.util.List;
import java.util.Optional;

/**
 * Ranked disease with the justification of every criterion.
 */
public record EntityJustification(
        int rank,
        String entityId,
        String name,
        double finalScore,
        List<CriterionJustification> criteria
) {
    public EntityJustification {
        criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public Optional<CriterionJustification> criterion(String key) {
        return criteria.stream().filter(c -> c.criterion().equals(key)).findFirst();
    }
}
