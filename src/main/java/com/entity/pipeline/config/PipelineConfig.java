package com.entity.pipeline.config;

import com.entity.pipeline.cache.CacheConfig;
import com.entity.pipeline.integrity.IntegrityConfig;
import com.entity.pipeline.lock.LockConfig;
import com.entity.pipeline.mention.ExtractionConfig;
import com.entity.pipeline.pipeline.StageOptions;
import com.entity.pipeline.relationship.RelationshipConfig;
import com.entity.pipeline.scoring.ScoringConfig;

import java.util.Objects;

/**
 * Complete configuration of a pipeline run. Every section has defaults; a JSON file passed
 * with {@code --config} overrides individual values (see {@link ConfigLoader}).
 *
 * @param batchSize    default number of items per transaction
 * @param extraction   mention extraction settings
 * @param relationship relationship building settings
 * @param scoring      scoring weights
 * @param integrity    integrity pass settings
 * @param lock         entity lock settings
 * @param cache        resolution cache settings
 */
public record PipelineConfig(
        int batchSize,
        ExtractionConfig extraction,
        RelationshipConfig relationship,
        ScoringConfig scoring,
        IntegrityConfig integrity,
        LockConfig lock,
        CacheConfig cache
) {
    public PipelineConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        Objects.requireNonNull(extraction, "extraction is required");
        Objects.requireNonNull(relationship, "relationship is required");
        Objects.requireNonNull(scoring, "scoring is required");
        Objects.requireNonNull(integrity, "integrity is required");
        Objects.requireNonNull(lock, "lock is required");
        Objects.requireNonNull(cache, "cache is required");
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(
                StageOptions.DEFAULT_BATCH_SIZE,
                ExtractionConfig.defaults(),
                RelationshipConfig.defaults(),
                ScoringConfig.defaults(),
                IntegrityConfig.defaults(),
                LockConfig.defaults(),
                CacheConfig.defaults()
        );
    }
}
