package com.entity.pipeline.similarity;

/**
 * Interface for string edit-distance algorithms used by name matching.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the edit distance between two strings.
     */
    int distance(String s1, String s2);

    /**
     * Computes the edit distance, stopping early once it is known to exceed {@code maxDistance}.
     *
     * @return the distance, or {@code maxDistance + 1} if it is larger than {@code maxDistance}
     */
    default int boundedDistance(String s1, String s2, int maxDistance) {
        int d = distance(s1, s2);
        return Math.min(d, maxDistance + 1);
    }

    /**
     * Similarity in [0,1] derived from the distance: 1 - distance / longest length.
     */
    default double similarity(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        int longest = Math.max(s1.length(), s2.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - ((double) distance(s1, s2) / longest);
    }

    String getName();
}
