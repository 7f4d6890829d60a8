package com.raredisease.prioritization.export;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.NormalizedScore;
import com.raredisease.prioritization.core.model.PriorityResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Joins ranked results with the curated values and normalized scores behind them.
 */
public class JustificationBuilder {

    public List<EntityJustification> build(List<PriorityResult> ranked, Collection<CuratedValue> curatedValues,
                                           Collection<NormalizedScore> scores) {
        Map<String, CuratedValue> curatedByKey = new HashMap<>();
        curatedValues.forEach(v -> curatedByKey.put(key(v.getEntityId(), v.getCriterion()), v));
        Map<String, NormalizedScore> scoresByKey = new HashMap<>();
        scores.forEach(s -> scoresByKey.put(key(s.entityId(), s.criterion()), s));

        List<EntityJustification> justifications = new ArrayList<>(ranked.size());
        for (PriorityResult result : ranked) {
            List<CriterionJustification> criteria = new ArrayList<>();
            for (Criterion criterion : Criterion.values()) {
                if (!result.getWeights().containsKey(criterion)) {
                    continue;
                }
                CuratedValue curated = curatedByKey.get(key(result.getEntityId(), criterion));
                NormalizedScore score = scoresByKey.get(key(result.getEntityId(), criterion));
                criteria.add(justify(result, criterion, curated, score));
            }
            justifications.add(new EntityJustification(result.getRank(), result.getEntityId(), result.getName(),
                    result.getFinalScore(), criteria));
        }
        return justifications;
    }

    private CriterionJustification justify(PriorityResult result, Criterion criterion,
                                           CuratedValue curated, NormalizedScore score) {
        OptionalDouble normalized = result.getNormalizedScore(criterion);
        Double scoreValue = normalized.isPresent() ? normalized.getAsDouble() : null;
        double weight = result.getWeights().getOrDefault(criterion, 0.0);
        if (curated == null) {
            return new CriterionJustification(criterion.key(), "not curated", "NONE", 0.0,
                    List.of(), List.of(), scoreValue, true, weight, result.contribution(criterion),
                    "No curated value exists for this criterion.");
        }
        return new CriterionJustification(
                criterion.key(),
                curated.describeValue(),
                curated.getSelectionMethod().name(),
                curated.getConfidence(),
                curated.getSupportingSources(),
                curated.getExcludedSources(),
                scoreValue,
                score != null ? score.lowConfidence() : !curated.hasUsableData(),
                weight,
                result.contribution(criterion),
                explain(criterion, curated, scoreValue));
    }

    static String explain(Criterion criterion, CuratedValue value, Double score) {
        String scoreText = score != null ? String.format(Locale.ROOT, "%.2f", score) : "no score";
        return switch (value.getSelectionMethod()) {
            case POINT_PREVALENCE -> "Point prevalence class '" + value.describeValue()
                    + "' taken from the most reliable point-prevalence record (score " + scoreText + ").";
            case GLOBAL_RELIABLE -> "Class '" + value.describeValue()
                    + "' taken from the most reliable worldwide record above the reliability threshold (score "
                    + scoreText + ").";
            case REGIONAL_RELIABLE -> "Class '" + value.describeValue()
                    + "' taken from the most reliable regional record above the reliability threshold (score "
                    + scoreText + ").";
            case BIRTH_PREVALENCE_ADJUSTED -> "Birth prevalence moved one class rarer to '"
                    + value.describeValue() + "' (score " + scoreText + ").";
            case CASE_REPORT_DEFAULT -> "Only case or family reports found; rarest class '"
                    + value.describeValue() + "' assigned (score " + scoreText + ").";
            case BEST_RELIABILITY -> "Level '" + value.describeValue()
                    + "' taken from the most reliable record (score " + scoreText + ").";
            case QUALIFYING_COUNT -> "Qualifying " + criterion.key() + " counts " + value.describeValue()
                    + " (score " + scoreText + ").";
            case REGIONAL_FALLBACK -> "No qualifying " + criterion.key()
                    + " in the preferred region; fallback region counts " + value.describeValue()
                    + " (score " + scoreText + ").";
            case QUALIFYING_PRESENCE -> Boolean.TRUE.equals(value.getPresent().orElse(false))
                    ? "Qualifying association found (score " + scoreText + ")."
                    : "No qualifying association among the records found (score " + scoreText + ").";
            case EMPTY_EVIDENCE -> "Sources returned nothing after every attempt; treated as none (score "
                    + scoreText + ").";
            case NO_USABLE_DATA -> "No usable data; contributes nothing to the final score.";
        };
    }

    private static String key(String entityId, Criterion criterion) {
        return entityId + ":" + criterion.key();
    }
}
