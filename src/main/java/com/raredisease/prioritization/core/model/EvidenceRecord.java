package com.raredisease.prioritization.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One raw observation for one (disease, criterion) pair, as returned by a fetch adapter.
 *
 * <p>The {@code value} is criterion specific: a prevalence class label, a gene symbol,
 * a drug or trial identifier, a research group name or an evidence level. The optional
 * {@code subtype} qualifies it (association type, product type, trial status). The
 * optional {@code amount} is a raw numeric figure exactly as the source reported it;
 * it is kept for audit only and is never used to derive a class.</p>
 *
 * <p>Records are immutable. The reliability score is computed once before
 * persistence and attached through {@link #withReliability(double)}.</p>
 */
public final class EvidenceRecord {
    private final String source;
    private final String value;
    private final String subtype;
    private final Double amount;
    private final EvidenceQualifiers qualifiers;
    private final Instant observedAt;
    private final Double reliabilityScore;

    private EvidenceRecord(Builder builder) {
        this.source = builder.source;
        this.value = builder.value;
        this.subtype = builder.subtype;
        this.amount = builder.amount;
        this.qualifiers = builder.qualifiers != null ? builder.qualifiers : EvidenceQualifiers.unspecified();
        this.observedAt = builder.observedAt;
        this.reliabilityScore = builder.reliabilityScore;
    }

    public String getSource() {
        return source;
    }

    public String getValue() {
        return value;
    }

    public String getSubtype() {
        return subtype;
    }

    public OptionalDouble getAmount() {
        return amount != null ? OptionalDouble.of(amount) : OptionalDouble.empty();
    }

    public EvidenceQualifiers getQualifiers() {
        return qualifiers;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public boolean isScored() {
        return reliabilityScore != null;
    }

    /**
     * Returns the cached reliability score.
     *
     * @throws IllegalStateException if the record has not been scored yet
     */
    public double getReliabilityScore() {
        if (reliabilityScore == null) {
            throw new IllegalStateException("Evidence record from '" + source + "' has not been scored");
        }
        return reliabilityScore;
    }

    /**
     * Returns a copy of this record carrying the given reliability score.
     */
    public EvidenceRecord withReliability(double score) {
        return toBuilder().reliabilityScore(score).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .source(source)
                .value(value)
                .subtype(subtype)
                .amount(amount)
                .qualifiers(qualifiers)
                .observedAt(observedAt)
                .reliabilityScore(reliabilityScore);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EvidenceRecord that = (EvidenceRecord) o;
        return Objects.equals(source, that.source)
                && Objects.equals(value, that.value)
                && Objects.equals(subtype, that.subtype)
                && Objects.equals(amount, that.amount)
                && Objects.equals(qualifiers, that.qualifiers)
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(reliabilityScore, that.reliabilityScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, value, subtype, amount, qualifiers, observedAt, reliabilityScore);
    }

    @Override
    public String toString() {
        return "EvidenceRecord{" +
                "source='" + source + '\'' +
                ", value='" + value + '\'' +
                ", subtype='" + subtype + '\'' +
                ", measurement=" + qualifiers.measurementType() +
                ", area='" + qualifiers.geographicArea() + '\'' +
                ", reliability=" + reliabilityScore +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String source;
        private String value;
        private String subtype;
        private Double amount;
        private EvidenceQualifiers qualifiers;
        private Instant observedAt;
        private Double reliabilityScore;

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder value(String value) {
            this.value = value;
            return this;
        }

        public Builder subtype(String subtype) {
            this.subtype = subtype;
            return this;
        }

        public Builder amount(Double amount) {
            this.amount = amount;
            return this;
        }

        public Builder qualifiers(EvidenceQualifiers qualifiers) {
            this.qualifiers = qualifiers;
            return this;
        }

        public Builder observedAt(Instant observedAt) {
            this.observedAt = observedAt;
            return this;
        }

        Builder reliabilityScore(Double reliabilityScore) {
            this.reliabilityScore = reliabilityScore;
            return this;
        }

        public EvidenceRecord build() {
            return new EvidenceRecord(this);
        }
    }
}
