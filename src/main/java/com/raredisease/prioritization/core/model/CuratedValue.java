package com.raredisease.prioritization.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The single resolved value of one criterion for one disease.
 *
 * <p>Exactly one of three shapes is populated, according to {@link #getKind()}:
 * a class label, a map of component counts, or a presence flag. The fourth kind,
 * {@link Kind#NO_USABLE_DATA}, is the sentinel for "nothing usable was found";
 * it is distinct from a zero count or a false flag.</p>
 */
public final class CuratedValue {

    public enum Kind {
        CLASS_LABEL,
        COUNTS,
        PRESENCE,
        NO_USABLE_DATA
    }

    private final String entityId;
    private final Criterion criterion;
    private final Kind kind;
    private final String label;
    private final Map<String, Integer> counts;
    private final Boolean present;
    private final SelectionMethod selectionMethod;
    private final double confidence;
    private final List<String> supportingSources;
    private final List<String> excludedSources;
    private final Instant curatedAt;

    private CuratedValue(String entityId, Criterion criterion, Kind kind, String label,
                         Map<String, Integer> counts, Boolean present, SelectionMethod selectionMethod,
                         double confidence, List<String> supportingSources, List<String> excludedSources,
                         Instant curatedAt) {
        this.entityId = Objects.requireNonNull(entityId, "entityId is required");
        this.criterion = Objects.requireNonNull(criterion, "criterion is required");
        this.kind = kind;
        this.label = label;
        this.counts = counts != null ? Map.copyOf(counts) : Map.of();
        this.present = present;
        this.selectionMethod = Objects.requireNonNull(selectionMethod, "selectionMethod is required");
        this.confidence = confidence;
        this.supportingSources = supportingSources != null ? List.copyOf(supportingSources) : List.of();
        this.excludedSources = excludedSources != null ? List.copyOf(excludedSources) : List.of();
        this.curatedAt = curatedAt != null ? curatedAt : Instant.now();
    }

    public static CuratedValue ofLabel(String entityId, Criterion criterion, String label,
                                       SelectionMethod method, double confidence,
                                       List<String> supportingSources, List<String> excludedSources) {
        Objects.requireNonNull(label, "label is required");
        return new CuratedValue(entityId, criterion, Kind.CLASS_LABEL, label, null, null,
                method, confidence, supportingSources, excludedSources, null);
    }

    public static CuratedValue ofCounts(String entityId, Criterion criterion, Map<String, Integer> counts,
                                        SelectionMethod method, double confidence,
                                        List<String> supportingSources, List<String> excludedSources) {
        Objects.requireNonNull(counts, "counts are required");
        return new CuratedValue(entityId, criterion, Kind.COUNTS, null, new LinkedHashMap<>(counts), null,
                method, confidence, supportingSources, excludedSources, null);
    }

    public static CuratedValue ofPresence(String entityId, Criterion criterion, boolean present,
                                          SelectionMethod method, double confidence,
                                          List<String> supportingSources, List<String> excludedSources) {
        return new CuratedValue(entityId, criterion, Kind.PRESENCE, null, null, present,
                method, confidence, supportingSources, excludedSources, null);
    }

    public static CuratedValue noUsableData(String entityId, Criterion criterion, List<String> excludedSources) {
        return new CuratedValue(entityId, criterion, Kind.NO_USABLE_DATA, null, null, null,
                SelectionMethod.NO_USABLE_DATA, 0.0, List.of(), excludedSources, null);
    }

    public String getEntityId() {
        return entityId;
    }

    public Criterion getCriterion() {
        return criterion;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean hasUsableData() {
        return kind != Kind.NO_USABLE_DATA;
    }

    public Optional<String> getLabel() {
        return Optional.ofNullable(label);
    }

    /**
     * Component counts, empty unless the kind is {@link Kind#COUNTS}.
     */
    public Map<String, Integer> getCounts() {
        return counts;
    }

    public int getCount(String component) {
        return counts.getOrDefault(component, 0);
    }

    public Optional<Boolean> getPresent() {
        return Optional.ofNullable(present);
    }

    public SelectionMethod getSelectionMethod() {
        return selectionMethod;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getSupportingSources() {
        return supportingSources;
    }

    public List<String> getExcludedSources() {
        return excludedSources;
    }

    public Instant getCuratedAt() {
        return curatedAt;
    }

    /**
     * Human-readable rendering of the value for tables and logs.
     */
    public String describeValue() {
        return switch (kind) {
            case CLASS_LABEL -> label;
            case COUNTS -> counts.toString();
            case PRESENCE -> String.valueOf(present);
            case NO_USABLE_DATA -> "no usable data";
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CuratedValue that = (CuratedValue) o;
        return Double.compare(that.confidence, confidence) == 0
                && entityId.equals(that.entityId)
                && criterion == that.criterion
                && kind == that.kind
                && Objects.equals(label, that.label)
                && counts.equals(that.counts)
                && Objects.equals(present, that.present)
                && selectionMethod == that.selectionMethod;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, criterion, kind, label, counts, present, selectionMethod, confidence);
    }

    @Override
    public String toString() {
        return "CuratedValue{" +
                "entityId='" + entityId + '\'' +
                ", criterion=" + criterion +
                ", value=" + describeValue() +
                ", method=" + selectionMethod +
                ", confidence=" + confidence +
                '}';
    }
}
