package com.entity.pipeline.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Typed, weighted edge between two entities.
 * At most one edge exists per unordered entity pair and type.
 */
public class Relationship {
    private final Long id;
    private final long sourceId;
    private final long targetId;
    private final RelationshipType type;
    private final double weight;
    private final double confidence;
    private final double riskScore;
    private final EvidenceSummary evidence;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Relationship(Builder builder) {
        if (builder.sourceId == builder.targetId) {
            throw new IllegalArgumentException("Relationship endpoints must differ: " + builder.sourceId);
        }
        this.id = builder.id;
        this.sourceId = builder.sourceId;
        this.targetId = builder.targetId;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.weight = builder.weight;
        this.confidence = builder.confidence;
        this.riskScore = builder.riskScore;
        this.evidence = builder.evidence != null ? builder.evidence : EvidenceSummary.empty();
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public Long getId() {
        return id;
    }

    public long getSourceId() {
        return sourceId;
    }

    public long getTargetId() {
        return targetId;
    }

    public RelationshipType getType() {
        return type;
    }

    public double getWeight() {
        return weight;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public EvidenceSummary getEvidence() {
        return evidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Returns the endpoint that is not {@code entityId}.
     */
    public long otherEndpoint(long entityId) {
        if (sourceId == entityId) {
            return targetId;
        }
        if (targetId == entityId) {
            return sourceId;
        }
        throw new IllegalArgumentException("Entity " + entityId + " is not an endpoint of relationship " + id);
    }

    public boolean touches(long entityId) {
        return sourceId == entityId || targetId == entityId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Relationship that = (Relationship) o;
        return Math.min(sourceId, targetId) == Math.min(that.sourceId, that.targetId)
                && Math.max(sourceId, targetId) == Math.max(that.sourceId, that.targetId)
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Math.min(sourceId, targetId), Math.max(sourceId, targetId), type);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id=" + id +
                ", " + sourceId + " -[" + type.getValue() + "]-> " + targetId +
                ", weight=" + weight +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long id;
        private long sourceId;
        private long targetId;
        private RelationshipType type;
        private double weight;
        private double confidence;
        private double riskScore;
        private EvidenceSummary evidence;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder sourceId(long sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder targetId(long targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder type(RelationshipType type) {
            this.type = type;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder evidence(EvidenceSummary evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Relationship build() {
            return new Relationship(this);
        }
    }
}
