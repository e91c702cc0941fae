package com.entity.pipeline.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical identity record.
 * The id is assigned by the store; entities built before insertion carry a null id.
 */
public class Entity {
    private final Long id;
    private String canonicalName;
    private EntityType type;
    private final Set<String> aliases;
    private int mentionCount;
    private double importanceScore;
    private int riskRating;
    private double riskScore;
    private boolean needsReview;
    private String reviewReason;
    private boolean consolidated;
    private boolean inCuratedSource;
    private final Instant createdAt;
    private Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.canonicalName = Objects.requireNonNull(builder.canonicalName, "canonicalName is required");
        this.type = builder.type != null ? builder.type : EntityType.PERSON;
        this.aliases = new LinkedHashSet<>(builder.aliases);
        this.mentionCount = builder.mentionCount;
        this.importanceScore = builder.importanceScore;
        this.riskRating = builder.riskRating;
        this.riskScore = builder.riskScore;
        this.needsReview = builder.needsReview;
        this.reviewReason = builder.reviewReason;
        this.consolidated = builder.consolidated;
        this.inCuratedSource = builder.inCuratedSource;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public Long getId() {
        return id;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
        this.updatedAt = Instant.now();
    }

    public EntityType getType() {
        return type;
    }

    /**
     * Alias strings, excluding the canonical name itself.
     */
    public Set<String> getAliases() {
        return Collections.unmodifiableSet(aliases);
    }

    /**
     * Canonical name followed by every alias.
     */
    public Set<String> getAllNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(canonicalName);
        names.addAll(aliases);
        return names;
    }

    public boolean addAlias(String alias) {
        if (alias == null || alias.isBlank() || alias.equalsIgnoreCase(canonicalName)) {
            return false;
        }
        for (String existing : aliases) {
            if (existing.equalsIgnoreCase(alias)) {
                return false;
            }
        }
        aliases.add(alias);
        updatedAt = Instant.now();
        return true;
    }

    public int getMentionCount() {
        return mentionCount;
    }

    public double getImportanceScore() {
        return importanceScore;
    }

    public int getRiskRating() {
        return riskRating;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public String getReviewReason() {
        return reviewReason;
    }

    public boolean isConsolidated() {
        return consolidated;
    }

    public boolean isInCuratedSource() {
        return inCuratedSource;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isPersisted() {
        return id != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        if (id == null || entity.id == null) {
            return Objects.equals(canonicalName, entity.canonicalName);
        }
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return id != null ? Objects.hash(id) : Objects.hash(canonicalName);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id=" + id +
                ", canonicalName='" + canonicalName + '\'' +
                ", type=" + type +
                ", mentionCount=" + mentionCount +
                ", aliases=" + aliases +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long id;
        private String canonicalName;
        private EntityType type;
        private final Set<String> aliases = new LinkedHashSet<>();
        private int mentionCount;
        private double importanceScore;
        private int riskRating = 1;
        private double riskScore;
        private boolean needsReview;
        private String reviewReason;
        private boolean consolidated;
        private boolean inCuratedSource;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder aliases(Set<String> aliases) {
            this.aliases.clear();
            if (aliases != null) {
                this.aliases.addAll(aliases);
            }
            return this;
        }

        public Builder alias(String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder mentionCount(int mentionCount) {
            this.mentionCount = mentionCount;
            return this;
        }

        public Builder importanceScore(double importanceScore) {
            this.importanceScore = importanceScore;
            return this;
        }

        public Builder riskRating(int riskRating) {
            this.riskRating = riskRating;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder needsReview(boolean needsReview) {
            this.needsReview = needsReview;
            return this;
        }

        public Builder reviewReason(String reviewReason) {
            this.reviewReason = reviewReason;
            return this;
        }

        public Builder consolidated(boolean consolidated) {
            this.consolidated = consolidated;
            return this;
        }

        public Builder inCuratedSource(boolean inCuratedSource) {
            this.inCuratedSource = inCuratedSource;
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

        public Entity build() {
            return new Entity(this);
        }
    }
}
