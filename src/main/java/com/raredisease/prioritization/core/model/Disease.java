package com.raredisease.prioritization.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A disease being scored. Immutable; the entity id is a stable external code
 * (for instance an ORPHA code) and is unique across the corpus.
 */
public final class Disease {
    private final String entityId;
    private final String name;
    private final List<String> classificationPath;

    private Disease(Builder builder) {
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId is required");
        if (entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        this.name = builder.name != null ? builder.name : entityId;
        this.classificationPath = builder.classificationPath != null
                ? List.copyOf(builder.classificationPath)
                : List.of();
    }

    public static Disease of(String entityId, String name) {
        return builder().entityId(entityId).name(name).build();
    }

    public String getEntityId() {
        return entityId;
    }

    public String getName() {
        return name;
    }

    public List<String> getClassificationPath() {
        return classificationPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Disease disease = (Disease) o;
        return entityId.equals(disease.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId);
    }

    @Override
    public String toString() {
        return "Disease{" +
                "entityId='" + entityId + '\'' +
                ", name='" + name + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityId;
        private String name;
        private List<String> classificationPath;

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder classificationPath(List<String> classificationPath) {
            this.classificationPath = classificationPath;
            return this;
        }

        public Disease build() {
            return new Disease(this);
        }
    }
}
