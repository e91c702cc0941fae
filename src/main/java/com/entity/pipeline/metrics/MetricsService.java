package com.entity.pipeline.metrics;

import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.RelationshipType;

import java.time.Duration;

/**
 * Interface for recording pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing; the command line uses the Micrometer
 * implementation and logs a summary at the end of a run.
 */
public interface MetricsService {

    void recordStageDuration(String stage, boolean success, Duration duration);

    void incrementMentionsWritten(long count);

    void incrementEntityMerged(EntityType type, MatchMethod method);

    void incrementEntityDeleted(String reason);

    void incrementEntityFlagged(String reason);

    void incrementRelationshipUpserted(RelationshipType type, boolean created);

    void incrementItemSkipped(String stage, String reason);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
