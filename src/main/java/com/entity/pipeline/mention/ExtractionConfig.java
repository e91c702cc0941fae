package com.entity.pipeline.mention;

/**
 * Configuration for mention extraction.
 *
 * @param contextWindow          maximum characters a snippet extends on each side of a match
 * @param maxContextsPerMention  snippets kept per (entity, document) row
 * @param maxEntitiesPerDocument documents with more distinct entities are reported as index-like
 * @param patternCacheSize       compiled name patterns kept in memory
 * @param documentCacheSize      document bodies kept in memory during a run
 */
public record ExtractionConfig(
        int contextWindow,
        int maxContextsPerMention,
        int maxEntitiesPerDocument,
        int patternCacheSize,
        int documentCacheSize
) {
    public ExtractionConfig {
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must be >= 0");
        }
        if (maxContextsPerMention < 0) {
            throw new IllegalArgumentException("maxContextsPerMention must be >= 0");
        }
        if (maxEntitiesPerDocument < 2) {
            throw new IllegalArgumentException("maxEntitiesPerDocument must be >= 2");
        }
        if (patternCacheSize <= 0 || documentCacheSize <= 0) {
            throw new IllegalArgumentException("cache sizes must be > 0");
        }
    }

    public static ExtractionConfig defaults() {
        return new ExtractionConfig(200, 3, 50, 10_000, 2_000);
    }
}
