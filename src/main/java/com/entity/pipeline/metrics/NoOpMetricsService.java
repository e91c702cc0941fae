package com.entity.pipeline.metrics;

import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.RelationshipType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, boolean success, Duration duration) {
    }

    @Override
    public void incrementMentionsWritten(long count) {
    }

    @Override
    public void incrementEntityMerged(EntityType type, MatchMethod method) {
    }

    @Override
    public void incrementEntityDeleted(String reason) {
    }

    @Override
    public void incrementEntityFlagged(String reason) {
    }

    @Override
    public void incrementRelationshipUpserted(RelationshipType type, boolean created) {
    }

    @Override
    public void incrementItemSkipped(String stage, String reason) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
