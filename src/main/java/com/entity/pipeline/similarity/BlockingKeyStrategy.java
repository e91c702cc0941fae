package com.entity.pipeline.similarity;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from entity names.
 * Blocking keys narrow the candidate set for pairwise name matching, so the resolver
 * never compares every entity against every other.
 *
 * <p>Entities that share at least one blocking key are compared. Keys should be coarse
 * enough to capture likely matches while fine enough to exclude obvious non-matches.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates a set of blocking keys for a normalized entity name.
     *
     * @param normalizedName the normalized entity name
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String normalizedName);
}
