package com.raredisease.prioritization.aggregate;

import com.raredisease.prioritization.core.model.PriorityResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders results by final score, highest first, breaking ties by entity id, and
 * assigns ranks 1..n.
 */
public final class PriorityRanking {

    public static final Comparator<PriorityResult> ORDER =
            Comparator.comparingDouble(PriorityResult::getFinalScore).reversed()
                    .thenComparing(PriorityResult::getEntityId);

    private PriorityRanking() {
    }

    public static List<PriorityResult> rank(List<PriorityResult> results) {
        List<PriorityResult> sorted = new ArrayList<>(results);
        sorted.sort(ORDER);
        List<PriorityResult> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
