package com.raredisease.prioritization.pipeline;

import com.raredisease.prioritization.aggregate.PriorityRanking;
import com.raredisease.prioritization.aggregate.WeightedAggregator;
import com.raredisease.prioritization.cache.CaffeineCuratedValueCache;
import com.raredisease.prioritization.cache.CuratedValueCache;
import com.raredisease.prioritization.config.PrioritizationConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.core.model.CuratedValue;
import com.raredisease.prioritization.core.model.Disease;
import com.raredisease.prioritization.core.model.NormalizedScore;
import com.raredisease.prioritization.core.model.PriorityResult;
import com.raredisease.prioritization.curation.CurationService;
import com.raredisease.prioritization.export.JustificationBuilder;
import com.raredisease.prioritization.fetch.EvidenceFetchAdapter;
import com.raredisease.prioritization.lock.KeyLock;
import com.raredisease.prioritization.lock.LocalKeyLock;
import com.raredisease.prioritization.logging.LogContext;
import com.raredisease.prioritization.metrics.NoOpPipelineMetrics;
import com.raredisease.prioritization.metrics.PipelineMetrics;
import com.raredisease.prioritization.normalize.CorpusStatistics;
import com.raredisease.prioritization.normalize.Normalizer;
import com.raredisease.prioritization.reliability.ReliabilityScorer;
import com.raredisease.prioritization.run.CollectionReport;
import com.raredisease.prioritization.run.EvidenceCollector;
import com.raredisease.prioritization.run.RunManager;
import com.raredisease.prioritization.store.EvidenceStore;
import com.raredisease.prioritization.store.InMemoryEvidenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a batch end to end: collect evidence, curate, freeze corpus statistics,
 * normalize, aggregate and rank.
 *
 * <pre>
 * try (PrioritizationPipeline pipeline = PrioritizationPipeline.builder()
 *         .config(config)
 *         .adapter(Criterion.PREVALENCE, prevalenceClient)
 *         .build()) {
 *     PrioritizationOutcome outcome = pipeline.run(diseases);
 * }
 * </pre>
 */
public class PrioritizationPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrioritizationPipeline.class);

    private final PrioritizationConfig config;
    private final EvidenceStore store;
    private final PipelineMetrics metrics;
    private final RunManager runManager;
    private final EvidenceCollector collector;
    private final CurationService curationService;
    private final Normalizer normalizer;
    private final WeightedAggregator aggregator;
    private final JustificationBuilder justificationBuilder;

    private PrioritizationPipeline(Builder builder) {
        this.config = builder.config != null ? builder.config : PrioritizationConfig.defaults();
        this.store = builder.store != null ? builder.store : new InMemoryEvidenceStore();
        this.metrics = builder.metrics != null ? builder.metrics : NoOpPipelineMetrics.INSTANCE;
        KeyLock keyLock = builder.keyLock != null ? builder.keyLock : new LocalKeyLock(config.getLockConfig());
        CuratedValueCache cache = builder.cache != null
                ? builder.cache
                : CaffeineCuratedValueCache.create(config.getCacheConfig());
        ReliabilityScorer scorer = new ReliabilityScorer(config.getReliabilityThreshold());

        this.runManager = RunManager.builder()
                .store(store)
                .keyLock(keyLock)
                .scorer(scorer)
                .metrics(metrics)
                .clock(builder.clock)
                .defaultTimeout(config.getFetchTimeout().orElse(null))
                .build();
        this.collector = new EvidenceCollector(runManager, builder.adapters,
                config.getMaxAttempts(), config.getMaxConcurrency());
        this.curationService = new CurationService(store, config, scorer, cache, metrics);
        this.normalizer = new Normalizer(config);
        this.aggregator = new WeightedAggregator();
        this.justificationBuilder = new JustificationBuilder();
    }

    /**
     * Collects missing evidence for every disease, then scores and ranks the batch.
     */
    public PrioritizationOutcome run(List<Disease> diseases) {
        requireUniqueIds(diseases);
        metrics.recordBatchSize(diseases.size());
        CollectionReport collection = collector.collect(diseases, config.configuredCriteria());
        return score(diseases, collection);
    }

    /**
     * Scores and ranks the batch from evidence already in the store, without fetching.
     */
    public PrioritizationOutcome score(List<Disease> diseases) {
        requireUniqueIds(diseases);
        return score(diseases, null);
    }

    /**
     * Re-ranks a finished batch under a new weight vector. Curated values and
     * normalized scores are reused as they are.
     */
    public PrioritizationOutcome reweight(PrioritizationOutcome outcome, Map<Criterion, Double> weights) {
        List<PriorityResult> ranking = aggregator.reweight(outcome.ranking(), weights);
        log.info("pipeline.reweighted entities={} weights={}", ranking.size(), weights);
        return new PrioritizationOutcome(outcome.collection(), outcome.curatedValues(), outcome.statistics(),
                outcome.scores(), ranking,
                justificationBuilder.build(ranking, outcome.curatedValues(), outcome.scores()));
    }

    private PrioritizationOutcome score(List<Disease> diseases, CollectionReport collection) {
        try (LogContext ignored = LogContext.forBatch(LogContext.generateBatchId())) {
            List<String> entityIds = diseases.stream().map(Disease::getEntityId).toList();
            Set<Criterion> criteria = config.configuredCriteria();

            List<CuratedValue> curated = curationService.resolveAll(entityIds, criteria);
            CorpusStatistics statistics = CorpusStatistics.compute(entityIds, curated, config);
            List<NormalizedScore> scores = normalizer.normalizeAll(curated, statistics);

            Map<String, Map<Criterion, Double>> scoresByEntity = new LinkedHashMap<>();
            entityIds.forEach(id -> scoresByEntity.put(id, new EnumMap<>(Criterion.class)));
            scores.forEach(s -> scoresByEntity.get(s.entityId()).put(s.criterion(), s.score()));

            Map<Criterion, Double> weights = config.weights();
            List<PriorityResult> results = new ArrayList<>(diseases.size());
            for (Disease disease : diseases) {
                results.add(aggregator.aggregate(disease.getEntityId(), disease.getName(),
                        scoresByEntity.get(disease.getEntityId()), weights));
            }
            List<PriorityResult> ranking = PriorityRanking.rank(results);
            log.info("pipeline.completed entities={} criteria={} scores={}",
                    ranking.size(), criteria.size(), scores.size());
            return new PrioritizationOutcome(collection, curated, statistics, scores, ranking,
                    justificationBuilder.build(ranking, curated, scores));
        }
    }

    private static void requireUniqueIds(List<Disease> diseases) {
        Set<String> seen = new HashSet<>();
        for (Disease disease : diseases) {
            if (!seen.add(disease.getEntityId())) {
                throw new IllegalArgumentException("Duplicate disease id in batch: " + disease.getEntityId());
            }
        }
    }

    public PrioritizationConfig getConfig() {
        return config;
    }

    public EvidenceStore getStore() {
        return store;
    }

    public RunManager getRunManager() {
        return runManager;
    }

    public CurationService getCurationService() {
        return curationService;
    }

    @Override
    public void close() {
        collector.close();
        runManager.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PrioritizationConfig config;
        private EvidenceStore store;
        private final Map<Criterion, EvidenceFetchAdapter> adapters = new EnumMap<>(Criterion.class);
        private PipelineMetrics metrics;
        private CuratedValueCache cache;
        private KeyLock keyLock;
        private Clock clock;

        public Builder config(PrioritizationConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(EvidenceStore store) {
            this.store = store;
            return this;
        }

        public Builder adapter(Criterion criterion, EvidenceFetchAdapter adapter) {
            adapters.put(criterion, Objects.requireNonNull(adapter, "adapter is required"));
            return this;
        }

        public Builder metrics(PipelineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder cache(CuratedValueCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder keyLock(KeyLock keyLock) {
            this.keyLock = keyLock;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PrioritizationPipeline build() {
            return new PrioritizationPipeline(this);
        }
    }
}
