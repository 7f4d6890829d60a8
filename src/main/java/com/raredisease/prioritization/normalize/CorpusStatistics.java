package com.raredisease.prioritization.normalize;

import com.raredisease.prioritization.config.CountComponent;
import com.raredisease.prioritization.config.CriterionSettings;
import com.raredisease.prioritization.config.NormalizationStrategy;
import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Winsorization caps of every count component, frozen for one corpus.
 *
 * <p>Computed once per batch from the curated values of all diseases in the batch.
 * Diseases without usable data for a criterion do not contribute to its statistics.
 * Scores normalized against the same instance are comparable with each other.</p>
 */
public final class CorpusStatistics {
    private static final Logger log = LoggerFactory.getLogger(CorpusStatistics.class);

    private final Set<String> entityIds;
    private final Map<Criterion, Map<String, ComponentStatistics>> components;

    private CorpusStatistics(Set<String> entityIds, Map<Criterion, Map<String, ComponentStatistics>> components) {
        this.entityIds = Set.copyOf(entityIds);
        this.components = Collections.unmodifiableMap(components);
    }

    /**
     * Runs the pre-pass over a corpus.
     *
     * @param entityIds     every disease in the batch
     * @param curatedValues curated values of the batch; values of other diseases are ignored
     * @param config        supplies components, fixed caps and the IQR multiplier
     */
    public static CorpusStatistics compute(Collection<String> entityIds, Collection<CuratedValue> curatedValues,
                                           PrioritizationConfig config) {
        Set<String> corpus = Set.copyOf(entityIds);
        Map<Criterion, Map<String, ComponentStatistics>> byCriterion = new EnumMap<>(Criterion.class);

        for (CriterionSettings settings : config.getCriteria().values()) {
            if (settings.strategy() != NormalizationStrategy.WINSORIZED_MIN_MAX) {
                continue;
            }
            List<CuratedValue> usable = curatedValues.stream()
                    .filter(v -> v.getCriterion() == settings.criterion())
                    .filter(v -> corpus.contains(v.getEntityId()))
                    .filter(CuratedValue::hasUsableData)
                    .toList();

            Map<String, ComponentStatistics> stats = new LinkedHashMap<>();
            for (CountComponent component : settings.components()) {
                List<Integer> sample = new ArrayList<>(usable.size());
                usable.forEach(v -> sample.add(v.getCount(component.name())));
                Quartiles quartiles = Quartiles.of(sample);
                double cap = component.fixedCap() != null
                        ? component.fixedCap()
                        : quartiles.upperFence(config.getIqrMultiplier());
                stats.put(component.name(), new ComponentStatistics(component.name(), quartiles, cap,
                        sample.size(), component.fixedCap() != null));
                log.debug("corpus.component criterion={} component={} n={} q1={} q3={} cap={}",
                        settings.criterion().key(), component.name(), sample.size(),
                        quartiles.q1(), quartiles.q3(), cap);
            }
            byCriterion.put(settings.criterion(), Collections.unmodifiableMap(stats));
        }

        log.info("corpus.statistics.computed entities={} criteria={}", corpus.size(), byCriterion.keySet());
        return new CorpusStatistics(corpus, byCriterion);
    }

    public boolean contains(String entityId) {
        return entityIds.contains(entityId);
    }

    public Set<String> getEntityIds() {
        return entityIds;
    }

    public Map<String, ComponentStatistics> componentStatistics(Criterion criterion) {
        return components.getOrDefault(criterion, Map.of());
    }

    public Optional<ComponentStatistics> find(Criterion criterion, String component) {
        return Optional.ofNullable(componentStatistics(criterion).get(component));
    }

    /**
     * Winsorization cap of a component.
     *
     * @throws CorpusNotReadyException if no statistics were computed for it
     */
    public double cap(Criterion criterion, String component) {
        return find(criterion, component)
                .orElseThrow(() -> new CorpusNotReadyException("No corpus statistics for "
                        + criterion.key() + "/" + component))
                .cap();
    }

    /**
     * Statistics of one count component.
     *
     * @param component  component name
     * @param quartiles  quartiles of the usable counts
     * @param cap        winsorization cap
     * @param sampleSize number of diseases that contributed
     * @param fixedCap   true when the cap came from configuration rather than the corpus
     */
    public record ComponentStatistics(String component, Quartiles quartiles, double cap,
                                      int sampleSize, boolean fixedCap) {
    }
}
