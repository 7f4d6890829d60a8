package com.raredisease.prioritization.curation;

import com.raredisease.prioritization.cache.CuratedValueCache;
import com.raredisease.prioritization.cache.NoOpCuratedValueCache;
import com.raredisease.prioritization.config.CriterionSettings;
import com.raredisease.prioritization.config.NormalizationStrategy;
import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.RunRecord;
import com.raredisease.prioritization.core.model.RunStatus;
import com.raredisease.prioritization.logging.LogContext;
import com.raredisease.prioritization.metrics.NoOpPipelineMetrics;
import com.raredisease.prioritization.metrics.PipelineMetrics;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import com.raredisease.prioritization.store.EvidenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the active run of each key into a stored curated value.
 *
 * <p>The resolver used for a criterion follows its configured strategy. Keys whose
 * active run is a successful but empty fetch go through the resolver's empty-evidence
 * rule; failed and never-run keys always resolve to {@code NO_USABLE_DATA}.</p>
 */
public class CurationService {
    private static final Logger log = LoggerFactory.getLogger(CurationService.class);

    private final EvidenceStore store;
    private final PrioritizationConfig config;
    private final CuratedValueCache cache;
    private final PipelineMetrics metrics;
    private final Map<Criterion, CriterionResolver> resolvers;

    public CurationService(EvidenceStore store, PrioritizationConfig config, ReliabilityScorer scorer) {
        this(store, config, scorer, new NoOpCuratedValueCache(), NoOpPipelineMetrics.INSTANCE);
    }

    public CurationService(EvidenceStore store, PrioritizationConfig config, ReliabilityScorer scorer,
                           CuratedValueCache cache, PipelineMetrics metrics) {
        this.store = store;
        this.config = config;
        this.cache = cache;
        this.metrics = metrics;
        this.resolvers = new EnumMap<>(Criterion.class);
        config.getCriteria().forEach((criterion, settings) ->
                resolvers.put(criterion, resolverFor(settings, config, scorer)));
    }

    static CriterionResolver resolverFor(CriterionSettings settings, PrioritizationConfig config,
                                         ReliabilityScorer scorer) {
        return switch (settings.strategy()) {
            case CLASS_MIDPOINT -> settings.criterion() == Criterion.PREVALENCE
                    ? new PrevalenceResolver(config.getRarityScale(), scorer)
                    : new EvidenceLevelResolver(settings.labelScores());
            case WINSORIZED_MIN_MAX -> new CountResolver(settings.components());
            case BINARY -> new PresenceResolver(settings.qualifyingSubtypes(), settings.singleValueOnly());
        };
    }

    /**
     * Resolves the key from its active run, superseding any previous curated value.
     */
    public CuratedValue resolve(String entityId, Criterion criterion) {
        CriterionResolver resolver = resolvers.get(criterion);
        if (resolver == null) {
            throw new IllegalArgumentException("Criterion not configured: " + criterion.key());
        }
        try (LogContext ignored = LogContext.forCuration(entityId, criterion.key())) {
            Optional<RunRecord> active = store.history(entityId, criterion).active();
            CuratedValue value;
            if (active.isEmpty() || active.get().status() == RunStatus.FAILED) {
                value = CuratedValue.noUsableData(entityId, criterion, List.of());
            } else if (active.get().status() == RunStatus.SUCCESS_EMPTY) {
                value = config.settings(criterion).strategy() == NormalizationStrategy.CLASS_MIDPOINT
                        ? CuratedValue.noUsableData(entityId, criterion, List.of())
                        : resolver.emptyEvidence(entityId, criterion);
            } else {
                value = resolver.resolve(entityId, criterion, active.get().evidence());
            }

            store.saveCuratedValue(value);
            cache.put(value);
            metrics.incrementCuration(criterion, value.getSelectionMethod());
            log.debug("curation.resolved entityId={} criterion={} value={} method={} confidence={}",
                    entityId, criterion.key(), value.describeValue(), value.getSelectionMethod(),
                    value.getConfidence());
            return value;
        }
    }

    /**
     * Resolves every (disease, criterion) pair.
     */
    public List<CuratedValue> resolveAll(Collection<String> entityIds, Collection<Criterion> criteria) {
        List<CuratedValue> values = new ArrayList<>(entityIds.size() * criteria.size());
        for (String entityId : entityIds) {
            for (Criterion criterion : criteria) {
                values.add(resolve(entityId, criterion));
            }
        }
        long noData = values.stream().filter(v -> !v.hasUsableData()).count();
        log.info("curation.completed values={} noUsableData={}", values.size(), noData);
        return values;
    }

    /**
     * The current curated value of a key, from the cache or the store.
     */
    public Optional<CuratedValue> find(String entityId, Criterion criterion) {
        Optional<CuratedValue> cached = cache.get(entityId, criterion);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        Optional<CuratedValue> stored = store.findCuratedValue(entityId, criterion);
        stored.ifPresent(cache::put);
        return stored;
    }
}
