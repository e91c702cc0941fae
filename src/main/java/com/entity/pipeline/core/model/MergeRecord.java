package com.entity.pipeline.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of one completed merge.
 */
public record MergeRecord(
        String id,
        long sourceEntityId,
        long targetEntityId,
        String sourceName,
        String targetName,
        MatchMethod matchMethod,
        double matchScore,
        int mentionsMoved,
        int mentionsCombined,
        int relationshipsMoved,
        int relationshipsCombined,
        int selfLoopsRemoved,
        String triggeredBy,
        Instant mergedAt
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(matchMethod, "matchMethod is required");
        Objects.requireNonNull(mergedAt, "mergedAt is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private long sourceEntityId;
        private long targetEntityId;
        private String sourceName;
        private String targetName;
        private MatchMethod matchMethod;
        private double matchScore;
        private int mentionsMoved;
        private int mentionsCombined;
        private int relationshipsMoved;
        private int relationshipsCombined;
        private int selfLoopsRemoved;
        private String triggeredBy;
        private Instant mergedAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceEntityId(long sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(long targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder sourceName(String sourceName) {
            this.sourceName = sourceName;
            return this;
        }

        public Builder targetName(String targetName) {
            this.targetName = targetName;
            return this;
        }

        public Builder matchMethod(MatchMethod matchMethod) {
            this.matchMethod = matchMethod;
            return this;
        }

        public Builder matchScore(double matchScore) {
            this.matchScore = matchScore;
            return this;
        }

        public Builder mentionsMoved(int mentionsMoved) {
            this.mentionsMoved = mentionsMoved;
            return this;
        }

        public Builder mentionsCombined(int mentionsCombined) {
            this.mentionsCombined = mentionsCombined;
            return this;
        }

        public Builder relationshipsMoved(int relationshipsMoved) {
            this.relationshipsMoved = relationshipsMoved;
            return this;
        }

        public Builder relationshipsCombined(int relationshipsCombined) {
            this.relationshipsCombined = relationshipsCombined;
            return this;
        }

        public Builder selfLoopsRemoved(int selfLoopsRemoved) {
            this.selfLoopsRemoved = selfLoopsRemoved;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder mergedAt(Instant mergedAt) {
            this.mergedAt = mergedAt;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(id, sourceEntityId, targetEntityId, sourceName, targetName,
                    matchMethod, matchScore, mentionsMoved, mentionsCombined, relationshipsMoved,
                    relationshipsCombined, selfLoopsRemoved, triggeredBy, mergedAt);
        }
    }
}
