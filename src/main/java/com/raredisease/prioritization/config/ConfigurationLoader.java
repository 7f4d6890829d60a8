package com.raredisease.prioritization.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raredisease.prioritization.cache.CacheConfig;
import com.raredisease.prioritization.core.model.Criterion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a {@link PrioritizationConfig} from JSON. Every key is optional; anything
 * absent keeps its default. Unknown criterion keys are rejected.
 *
 * <pre>
 * {
 *   "maxAttempts": 3,
 *   "reliabilityThreshold": 6.0,
 *   "iqrMultiplier": 1.5,
 *   "fetchTimeoutMs": 120000,
 *   "maxConcurrency": 4,
 *   "weights": { "prevalence": 0.2, "therapies": 0.25 },
 *   "criteria": {
 *     "therapies": { "components": [ { "name": "eu_tradename", "subtypes": ["TRADENAME"],
 *                                      "preferredRegions": ["EU"], "weight": 0.8,
 *                                      "direction": "FEWER_IS_BETTER", "fixedCap": 4 } ] },
 *     "socioeconomic": { "labelScores": { "High evidence": 10 } },
 *     "gene": { "subtypes": ["Disease-causing germline mutation(s) in"], "singleValueOnly": false }
 *   },
 *   "rarityScale": { "classes": [ { "label": "&lt;1 / 1 000 000", "score": 2, "midpointPerMillion": 0.5 } ],
 *                    "placeholders": ["Unknown"] },
 *   "cache": { "maxSize": 5000, "ttlSeconds": 600, "enabled": true }
 * }
 * </pre>
 */
public class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigurationLoader() {
        this(new ObjectMapper());
    }

    public ConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PrioritizationConfig load(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            PrioritizationConfig config = fromTree(objectMapper.readTree(reader));
            log.info("config.loaded path={} criteria={}", path, config.configuredCriteria().size());
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path, e);
        }
    }

    public PrioritizationConfig load(InputStream input) {
        try {
            return fromTree(objectMapper.readTree(input));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration", e);
        }
    }

    public PrioritizationConfig parse(String json) {
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    PrioritizationConfig fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration root must be a JSON object");
        }
        PrioritizationConfig.Builder builder = PrioritizationConfig.builder();

        if (root.has("maxAttempts")) {
            builder.maxAttempts(requireInt(root, "maxAttempts"));
        }
        if (root.has("reliabilityThreshold")) {
            builder.reliabilityThreshold(requireDouble(root, "reliabilityThreshold"));
        }
        if (root.has("iqrMultiplier")) {
            builder.iqrMultiplier(requireDouble(root, "iqrMultiplier"));
        }
        if (root.has("fetchTimeoutMs")) {
            JsonNode timeout = root.get("fetchTimeoutMs");
            builder.fetchTimeout(timeout.isNull() ? null : Duration.ofMillis(requireLong(root, "fetchTimeoutMs")));
        }
        if (root.has("maxConcurrency")) {
            builder.maxConcurrency(requireInt(root, "maxConcurrency"));
        }
        if (root.has("cache")) {
            JsonNode cache = root.get("cache");
            CacheConfig defaults = CacheConfig.defaults();
            builder.cacheConfig(new CacheConfig(
                    cache.has("maxSize") ? requireInt(cache, "maxSize") : defaults.maxSize(),
                    cache.has("ttlSeconds") ? requireInt(cache, "ttlSeconds") : defaults.ttlSeconds(),
                    !cache.has("enabled") || cache.get("enabled").asBoolean(true)));
        }
        if (root.has("criteria")) {
            applyCriteria(builder, root.get("criteria"));
        }
        // prevalence scores follow the scale, so it is applied after the criteria
        if (root.has("rarityScale")) {
            builder.rarityScale(parseRarityScale(root.get("rarityScale")));
        }
        if (root.has("weights")) {
            JsonNode weights = root.get("weights");
            Iterator<Map.Entry<String, JsonNode>> fields = weights.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Criterion criterion = criterion(field.getKey());
                if (!field.getValue().isNumber()) {
                    throw new ConfigurationException("Weight of '" + field.getKey() + "' must be a number");
                }
                builder.weight(criterion, field.getValue().asDouble());
            }
        }
        return builder.build();
    }

    private void applyCriteria(PrioritizationConfig.Builder builder, JsonNode criteria) {
        PrioritizationConfig defaults = PrioritizationConfig.defaults();
        Iterator<Map.Entry<String, JsonNode>> fields = criteria.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Criterion criterion = criterion(field.getKey());
            JsonNode node = field.getValue();
            if (node.has("enabled") && !node.get("enabled").asBoolean(true)) {
                builder.withoutCriterion(criterion);
                continue;
            }
            CriterionSettings settings = defaults.settings(criterion);
            if (node.has("labelScores")) {
                settings = settings.withLabelScores(parseLabelScores(node.get("labelScores")));
            }
            if (node.has("components")) {
                List<CountComponent> components = new ArrayList<>();
                for (JsonNode componentNode : node.get("components")) {
                    components.add(parseComponent(componentNode));
                }
                settings = settings.withComponents(components);
            }
            if (node.has("subtypes") || node.has("singleValueOnly")) {
                Set<String> subtypes = node.has("subtypes")
                        ? stringSet(node.get("subtypes"))
                        : settings.qualifyingSubtypes();
                boolean single = node.has("singleValueOnly")
                        ? node.get("singleValueOnly").asBoolean()
                        : settings.singleValueOnly();
                settings = settings.withQualifyingSubtypes(subtypes, single);
            }
            if (node.has("weight")) {
                settings = settings.withWeight(requireDouble(node, "weight"));
            }
            builder.criterion(settings);
        }
    }

    private CountComponent parseComponent(JsonNode node) {
        if (!node.hasNonNull("name")) {
            throw new ConfigurationException("Count component without a name");
        }
        String direction = node.hasNonNull("direction") ? node.get("direction").asText() : "MORE_IS_BETTER";
        ScoreDirection scoreDirection;
        try {
            scoreDirection = ScoreDirection.valueOf(direction.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown direction '" + direction + "'", e);
        }
        return new CountComponent(
                node.get("name").asText(),
                node.has("subtypes") ? stringSet(node.get("subtypes")) : Set.of(),
                node.has("preferredRegions") ? stringSet(node.get("preferredRegions")) : Set.of(),
                node.has("fallbackRegions") ? stringSet(node.get("fallbackRegions")) : Set.of(),
                node.has("weight") ? requireDouble(node, "weight") : 1.0,
                scoreDirection,
                node.hasNonNull("fixedCap") ? requireDouble(node, "fixedCap") : null);
    }

    private RarityScale parseRarityScale(JsonNode node) {
        List<RarityClass> classes = new ArrayList<>();
        for (JsonNode classNode : node.path("classes")) {
            if (!classNode.hasNonNull("label") || !classNode.has("score")) {
                throw new ConfigurationException("Rarity class needs 'label' and 'score'");
            }
            classes.add(new RarityClass(
                    classNode.get("label").asText(),
                    classNode.path("midpointPerMillion").asDouble(0.0),
                    requireDouble(classNode, "score"),
                    classNode.has("aliases") ? stringSet(classNode.get("aliases")) : Set.of()));
        }
        Set<String> placeholders = node.has("placeholders")
                ? stringSet(node.get("placeholders"))
                : RarityScale.defaults().placeholders();
        return new RarityScale(classes, placeholders);
    }

    private Map<String, Double> parseLabelScores(JsonNode node) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new ConfigurationException("Score of label '" + field.getKey() + "' must be a number");
            }
            scores.put(field.getKey(), field.getValue().asDouble());
        }
        return scores;
    }

    private static Criterion criterion(String key) {
        return Criterion.fromKey(key)
                .orElseThrow(() -> new ConfigurationException("Unknown criterion '" + key + "'"));
    }

    private static Set<String> stringSet(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigurationException("Expected a JSON array but got: " + node);
        }
        Set<String> values = new LinkedHashSet<>();
        node.forEach(n -> values.add(n.asText()));
        return values;
    }

    private static double requireDouble(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isNumber()) {
            throw new ConfigurationException("'" + field + "' must be a number");
        }
        return node.asDouble();
    }

    private static int requireInt(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.canConvertToInt()) {
            throw new ConfigurationException("'" + field + "' must be an integer");
        }
        return node.asInt();
    }

    private static long requireLong(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.canConvertToLong()) {
            throw new ConfigurationException("'" + field + "' must be an integer");
        }
        return node.asLong();
    }
}
