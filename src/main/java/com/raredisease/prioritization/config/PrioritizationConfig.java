package com.raredisease.prioritization.config;

import com.raredisease.prioritization.cache.CacheConfig;
import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.lock.LockConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Every recognized option of a prioritization run: weights, thresholds, retry budget,
 * winsorization parameters, the rarity scale and the per-criterion allow-lists.
 *
 * <p>Instances are immutable and validated once by {@link Builder#build()}.
 * Scoring components receive the values they need from here; none of them
 * hard-codes a threshold or a table.</p>
 */
public class PrioritizationConfig {
    private static final Logger log = LoggerFactory.getLogger(PrioritizationConfig.class);

    public static final double DEFAULT_IQR_MULTIPLIER = 1.5;
    public static final double DEFAULT_RELIABILITY_THRESHOLD = 6.0;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(120);

    static final Set<String> DISEASE_CAUSING_ASSOCIATIONS = Set.of(
            "Disease-causing germline mutation(s) in",
            "Disease-causing germline mutation(s) (loss of function) in",
            "Disease-causing germline mutation(s) (gain of function) in",
            "Disease-causing somatic mutation(s) in");

    static final Set<String> ACTIVE_TRIAL_STATUSES = Set.of(
            "RECRUITING",
            "NOT_YET_RECRUITING",
            "ACTIVE_NOT_RECRUITING",
            "ENROLLING_BY_INVITATION");

    static final Set<String> EU_COUNTRIES_EXCEPT_SPAIN = Set.of(
            "Austria", "Belgium", "Bulgaria", "Croatia", "Cyprus", "Czechia", "Denmark",
            "Estonia", "Finland", "France", "Germany", "Greece", "Hungary", "Ireland", "Italy",
            "Latvia", "Lithuania", "Luxembourg", "Malta", "Netherlands", "Poland", "Portugal",
            "Romania", "Slovakia", "Slovenia", "Sweden");

    private final Map<Criterion, CriterionSettings> criteria;
    private final double iqrMultiplier;
    private final double reliabilityThreshold;
    private final int maxAttempts;
    private final Duration fetchTimeout;
    private final int maxConcurrency;
    private final RarityScale rarityScale;
    private final CacheConfig cacheConfig;
    private final LockConfig lockConfig;

    private PrioritizationConfig(Builder builder) {
        EnumMap<Criterion, CriterionSettings> copy = new EnumMap<>(Criterion.class);
        copy.putAll(builder.criteria);
        this.criteria = Collections.unmodifiableMap(copy);
        this.iqrMultiplier = builder.iqrMultiplier;
        this.reliabilityThreshold = builder.reliabilityThreshold;
        this.maxAttempts = builder.maxAttempts;
        this.fetchTimeout = builder.fetchTimeout;
        this.maxConcurrency = builder.maxConcurrency;
        this.rarityScale = builder.rarityScale;
        this.cacheConfig = builder.cacheConfig;
        this.lockConfig = builder.lockConfig;
    }

    public Map<Criterion, CriterionSettings> getCriteria() {
        return criteria;
    }

    /**
     * Settings of a configured criterion.
     *
     * @throws ConfigurationException if the criterion is not configured
     */
    public CriterionSettings settings(Criterion criterion) {
        CriterionSettings settings = criteria.get(criterion);
        if (settings == null) {
            throw new ConfigurationException("Criterion not configured: " + criterion.key());
        }
        return settings;
    }

    public Optional<CriterionSettings> findSettings(Criterion criterion) {
        return Optional.ofNullable(criteria.get(criterion));
    }

    public Set<Criterion> configuredCriteria() {
        return criteria.keySet();
    }

    /**
     * The weight vector, one entry per configured criterion.
     */
    public Map<Criterion, Double> weights() {
        EnumMap<Criterion, Double> weights = new EnumMap<>(Criterion.class);
        criteria.forEach((c, s) -> weights.put(c, s.weight()));
        return Collections.unmodifiableMap(weights);
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public double getReliabilityThreshold() {
        return reliabilityThreshold;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Timeout applied to each fetch; empty when fetches run unbounded on the caller thread.
     */
    public Optional<Duration> getFetchTimeout() {
        return Optional.ofNullable(fetchTimeout);
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public RarityScale getRarityScale() {
        return rarityScale;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    /**
     * Default configuration mirroring the funding call's weighting:
     * prevalence 0.20, socioeconomic 0.20, therapies 0.25, clinical trials 0.10,
     * gene traceability 0.15, research capacity 0.10.
     */
    public static PrioritizationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.criteria.clear();
        builder.criteria.putAll(criteria);
        return builder.iqrMultiplier(iqrMultiplier)
                .reliabilityThreshold(reliabilityThreshold)
                .maxAttempts(maxAttempts)
                .fetchTimeout(fetchTimeout)
                .maxConcurrency(maxConcurrency)
                .rarityScale(rarityScale)
                .cacheConfig(cacheConfig)
                .lockConfig(lockConfig);
    }

    static Map<Criterion, CriterionSettings> defaultCriteria(RarityScale scale) {
        EnumMap<Criterion, CriterionSettings> defaults = new EnumMap<>(Criterion.class);
        defaults.put(Criterion.PREVALENCE,
                CriterionSettings.classMidpoint(Criterion.PREVALENCE, 0.20, scale.scoreTable()));
        defaults.put(Criterion.SOCIOECONOMIC,
                CriterionSettings.classMidpoint(Criterion.SOCIOECONOMIC, 0.20, evidenceLevelScores()));
        defaults.put(Criterion.THERAPIES, CriterionSettings.winsorized(Criterion.THERAPIES, 0.25, List.of(
                new CountComponent("eu_tradename", Set.of("TRADENAME"), Set.of("EU"), Set.of(),
                        0.8, ScoreDirection.FEWER_IS_BETTER, null),
                new CountComponent("eu_medical_product", Set.of("MEDICAL_PRODUCT"), Set.of("EU"), Set.of(),
                        0.2, ScoreDirection.FEWER_IS_BETTER, null))));
        defaults.put(Criterion.CLINICAL_TRIALS, CriterionSettings.winsorized(Criterion.CLINICAL_TRIALS, 0.10, List.of(
                new CountComponent("active_trials", ACTIVE_TRIAL_STATUSES, Set.of("Spain"),
                        EU_COUNTRIES_EXCEPT_SPAIN, 1.0, ScoreDirection.MORE_IS_BETTER, null))));
        defaults.put(Criterion.GENE_TRACEABILITY, CriterionSettings.binary(Criterion.GENE_TRACEABILITY, 0.15,
                DISEASE_CAUSING_ASSOCIATIONS, ScoreDirection.MORE_IS_BETTER, false));
        defaults.put(Criterion.RESEARCH_CAPACITY, CriterionSettings.winsorized(Criterion.RESEARCH_CAPACITY, 0.10,
                List.of(CountComponent.of("research_groups", Set.of(), ScoreDirection.MORE_IS_BETTER))));
        return defaults;
    }

    private static Map<String, Double> evidenceLevelScores() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("High evidence", 10.0);
        scores.put("Medium-High evidence", 7.0);
        scores.put("Medium evidence", 5.0);
        scores.put("Low evidence", 3.0);
        scores.put("No evidence", 0.0);
        return scores;
    }

    public static class Builder {
        private final Map<Criterion, CriterionSettings> criteria = new EnumMap<>(Criterion.class);
        private final Set<Criterion> removed = new LinkedHashSet<>();
        private double iqrMultiplier = DEFAULT_IQR_MULTIPLIER;
        private double reliabilityThreshold = DEFAULT_RELIABILITY_THRESHOLD;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private RarityScale rarityScale = RarityScale.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private LockConfig lockConfig = LockConfig.defaults();

        private Builder() {
            criteria.putAll(defaultCriteria(rarityScale));
        }

        public Builder criterion(CriterionSettings settings) {
            criteria.put(settings.criterion(), settings);
            removed.remove(settings.criterion());
            return this;
        }

        /**
         * Drops a criterion from scoring altogether.
         */
        public Builder withoutCriterion(Criterion criterion) {
            criteria.remove(criterion);
            removed.add(criterion);
            return this;
        }

        public Builder weight(Criterion criterion, double weight) {
            CriterionSettings settings = criteria.get(criterion);
            if (settings == null) {
                throw new ConfigurationException("Cannot weight unconfigured criterion: " + criterion.key());
            }
            criteria.put(criterion, settings.withWeight(weight));
            return this;
        }

        /**
         * Replaces every weight. Criteria missing from the map keep their current weight.
         */
        public Builder weights(Map<Criterion, Double> weights) {
            weights.forEach(this::weight);
            return this;
        }

        public Builder iqrMultiplier(double iqrMultiplier) {
            this.iqrMultiplier = iqrMultiplier;
            return this;
        }

        public Builder reliabilityThreshold(double reliabilityThreshold) {
            this.reliabilityThreshold = reliabilityThreshold;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Per-fetch timeout; null disables it.
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        /**
         * Replaces the rarity scale. The prevalence score table follows the new scale
         * unless prevalence settings are supplied explicitly afterwards.
         */
        public Builder rarityScale(RarityScale rarityScale) {
            this.rarityScale = rarityScale;
            CriterionSettings prevalence = criteria.get(Criterion.PREVALENCE);
            if (prevalence != null && rarityScale != null) {
                criteria.put(Criterion.PREVALENCE, prevalence.withLabelScores(rarityScale.scoreTable()));
            }
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public PrioritizationConfig build() {
            if (iqrMultiplier < 0.0 || Double.isNaN(iqrMultiplier)) {
                throw new ConfigurationException("iqrMultiplier must be >= 0");
            }
            if (reliabilityThreshold < 0.0 || reliabilityThreshold > 10.0) {
                throw new ConfigurationException("reliabilityThreshold must be between 0.0 and 10.0");
            }
            if (maxAttempts < 1) {
                throw new ConfigurationException("maxAttempts must be >= 1");
            }
            if (fetchTimeout != null && (fetchTimeout.isNegative() || fetchTimeout.isZero())) {
                throw new ConfigurationException("fetchTimeout must be positive");
            }
            if (maxConcurrency < 1) {
                throw new ConfigurationException("maxConcurrency must be >= 1");
            }
            if (rarityScale == null) {
                throw new ConfigurationException("rarityScale is required");
            }
            if (cacheConfig == null || lockConfig == null) {
                throw new ConfigurationException("cacheConfig and lockConfig are required");
            }
            if (criteria.isEmpty()) {
                throw new ConfigurationException("at least one criterion must be configured");
            }
            criteria.values().forEach(CriterionSettings::validate);

            double weightSum = criteria.values().stream().mapToDouble(CriterionSettings::weight).sum();
            if (Math.abs(weightSum - 1.0) > 0.001) {
                log.warn("config.weights.unnormalized sum={} removed={}", weightSum, removed);
            }
            return new PrioritizationConfig(this);
        }
    }
}
