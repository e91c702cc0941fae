package com.entity.pipeline.rules;

import java.util.List;
import java.util.Map;

/**
 * Declarative identity-resolution rules, loaded from JSON.
 *
 * @param nicknames            formal first name to its nicknames; applied in both directions
 * @param junkPatterns         regexes classifying a name as a sentence fragment or metadata
 * @param connectorWords       words counted by the connector-ratio junk check
 * @param connectorRatio       share of connector words above which a multi-word name is junk
 * @param whitelist            names never classified as junk
 * @param maxLengthDelta       fuzzy pairs whose lengths differ by more are not compared
 * @param shortNameLength      names up to this length use the short-name distance bound
 * @param shortNameMaxDistance maximum edit distance for short names
 * @param longNameMaxDistance  maximum edit distance for longer names
 */
public record ResolverRules(
        Map<String, List<String>> nicknames,
        List<String> junkPatterns,
        List<String> connectorWords,
        double connectorRatio,
        List<String> whitelist,
        int maxLengthDelta,
        int shortNameLength,
        int shortNameMaxDistance,
        int longNameMaxDistance
) {
    public ResolverRules {
        nicknames = nicknames != null ? Map.copyOf(nicknames) : Map.of();
        junkPatterns = junkPatterns != null ? List.copyOf(junkPatterns) : List.of();
        connectorWords = connectorWords != null ? List.copyOf(connectorWords) : List.of();
        whitelist = whitelist != null ? List.copyOf(whitelist) : List.of();
        if (connectorRatio <= 0 || connectorRatio > 1) {
            throw new IllegalArgumentException("connectorRatio must be in (0, 1]");
        }
        if (maxLengthDelta < 0 || shortNameMaxDistance < 0 || longNameMaxDistance < 0) {
            throw new IllegalArgumentException("distance bounds must be >= 0");
        }
        if (shortNameLength <= 0) {
            throw new IllegalArgumentException("shortNameLength must be > 0");
        }
    }

    /**
     * Distance bound for a pair whose longer name has {@code longestLength} characters.
     */
    public int maxDistanceFor(int longestLength) {
        return longestLength <= shortNameLength ? shortNameMaxDistance : longNameMaxDistance;
    }

    /**
     * The bundled rules.
     */
    public static ResolverRules defaults() {
        return RulesLoader.loadResolverRules(null);
    }
}
