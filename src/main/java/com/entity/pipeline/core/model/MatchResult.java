package com.entity.pipeline.core.model;

/**
 * Result of comparing two names.
 *
 * @param matched      whether the names denote the same identity
 * @param method       the rule that matched, null when not matched
 * @param editDistance edit distance for fuzzy matches, 0 otherwise, -1 when not computed
 * @param score        similarity in [0,1]
 * @param reasoning    short human-readable explanation
 */
public record MatchResult(boolean matched, MatchMethod method, int editDistance, double score, String reasoning) {

    public static MatchResult exact() {
        return new MatchResult(true, MatchMethod.EXACT, 0, 1.0, "case-insensitive equality");
    }

    public static MatchResult alias(String reasoning) {
        return new MatchResult(true, MatchMethod.ALIAS, 0, 0.95, reasoning);
    }

    public static MatchResult fuzzy(int distance, int longestLength) {
        double score = longestLength == 0 ? 1.0 : 1.0 - ((double) distance / longestLength);
        return new MatchResult(true, MatchMethod.FUZZY, distance, score,
                "edit distance " + distance);
    }

    public static MatchResult noMatch(String reasoning) {
        return new MatchResult(false, null, -1, 0.0, reasoning);
    }
}
