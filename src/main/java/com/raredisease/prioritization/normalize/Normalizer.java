package com.raredisease.prioritization.normalize;

import com.raredisease.prioritization.config.CountComponent;
import com.raredisease.prioritization.config.CriterionSettings;
import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.config.ScoreDirection;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.NormalizedScore;
import com.raredisease.prioritization.core.model.SelectionMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps curated values onto the common 0-10 scale using the strategy configured for
 * each criterion:
 *
 * <ul>
 *   <li>class midpoint: table lookup of the class label;</li>
 *   <li>winsorized min-max: {@code min(count, cap) / cap * 10}, inverted when fewer is
 *       better, combined across components by component weight;</li>
 *   <li>binary: 10 when present, 0 otherwise, inverted when fewer is better.</li>
 * </ul>
 *
 * A value without usable data yields no score at all.
 */
public class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    public static final double SCALE_MAX = 10.0;

    private static final Set<SelectionMethod> LOW_CONFIDENCE_METHODS = Set.of(
            SelectionMethod.EMPTY_EVIDENCE,
            SelectionMethod.CASE_REPORT_DEFAULT,
            SelectionMethod.BIRTH_PREVALENCE_ADJUSTED);

    private final PrioritizationConfig config;

    public Normalizer(PrioritizationConfig config) {
        this.config = config;
    }

    /**
     * Normalizes one curated value against frozen corpus statistics.
     *
     * @return the score, or empty when the value carries no usable data
     * @throws CorpusNotReadyException if statistics are missing or do not cover the disease
     */
    public Optional<NormalizedScore> normalize(CuratedValue value, CorpusStatistics statistics) {
        if (statistics == null) {
            throw new CorpusNotReadyException("Corpus statistics have not been computed");
        }
        if (!statistics.contains(value.getEntityId())) {
            throw new CorpusNotReadyException("Disease " + value.getEntityId()
                    + " is not part of the corpus the statistics were computed for");
        }
        if (!value.hasUsableData()) {
            return Optional.empty();
        }

        CriterionSettings settings = config.settings(value.getCriterion());
        boolean lowConfidence = LOW_CONFIDENCE_METHODS.contains(value.getSelectionMethod());
        NormalizedScore score = switch (settings.strategy()) {
            case CLASS_MIDPOINT -> classMidpoint(value, settings, lowConfidence);
            case WINSORIZED_MIN_MAX -> winsorized(value, settings, statistics, lowConfidence);
            case BINARY -> binary(value, settings, lowConfidence);
        };
        return Optional.of(score);
    }

    public List<NormalizedScore> normalizeAll(Collection<CuratedValue> values, CorpusStatistics statistics) {
        List<NormalizedScore> scores = new ArrayList<>(values.size());
        for (CuratedValue value : values) {
            normalize(value, statistics).ifPresent(scores::add);
        }
        log.info("normalize.completed values={} scored={}", values.size(), scores.size());
        return scores;
    }

    private NormalizedScore classMidpoint(CuratedValue value, CriterionSettings settings, boolean lowConfidence) {
        String label = value.getLabel().orElse("");
        Optional<Double> tableScore = lookup(settings.labelScores(), label);
        if (tableScore.isEmpty()) {
            log.warn("normalize.label.unknown entityId={} criterion={} label={}",
                    value.getEntityId(), value.getCriterion().key(), label);
            return new NormalizedScore(value.getEntityId(), value.getCriterion(), 0.0, true, Map.of());
        }
        return new NormalizedScore(value.getEntityId(), value.getCriterion(), tableScore.get(),
                lowConfidence, Map.of());
    }

    private NormalizedScore winsorized(CuratedValue value, CriterionSettings settings,
                                       CorpusStatistics statistics, boolean lowConfidence) {
        Map<String, Double> componentScores = new LinkedHashMap<>();
        double combined = 0.0;
        for (CountComponent component : settings.components()) {
            double cap = statistics.cap(value.getCriterion(), component.name());
            double componentScore = scoreCount(value.getCount(component.name()), cap, component.direction());
            componentScores.put(component.name(), componentScore);
            combined += component.weight() * componentScore;
        }
        return new NormalizedScore(value.getEntityId(), value.getCriterion(), clamp(combined),
                lowConfidence, componentScores);
    }

    private NormalizedScore binary(CuratedValue value, CriterionSettings settings, boolean lowConfidence) {
        boolean present = value.getPresent().orElse(false);
        double score = settings.direction().orient(present ? SCALE_MAX : 0.0, SCALE_MAX);
        return new NormalizedScore(value.getEntityId(), value.getCriterion(), score, lowConfidence, Map.of());
    }

    /**
     * Winsorized min-max score of one count. A count at or above the cap is saturated.
     * A non-positive cap arises when at least three quarters of the corpus counts zero;
     * any positive count is then saturated and a zero count is not.
     */
    static double scoreCount(int count, double cap, ScoreDirection direction) {
        double ratio;
        if (cap <= 0.0) {
            ratio = count > 0 ? 1.0 : 0.0;
        } else {
            ratio = Math.min(count, cap) / cap;
        }
        return clamp(direction.orient(ratio * SCALE_MAX, SCALE_MAX));
    }

    private static Optional<Double> lookup(Map<String, Double> table, String label) {
        Double exact = table.get(label);
        if (exact != null) {
            return Optional.of(exact);
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return table.entrySet().stream()
                .filter(e -> e.getKey().trim().toLowerCase(Locale.ROOT).equals(normalized))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(SCALE_MAX, score));
    }
}
