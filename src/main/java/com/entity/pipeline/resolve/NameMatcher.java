package com.entity.pipeline.resolve;

import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import com.entity.pipeline.core.model.MatchResult;
import com.entity.pipeline.rules.NameNormalizer;
import com.entity.pipeline.rules.ResolverRules;
import com.entity.pipeline.similarity.OptimalStringAlignment;
import com.entity.pipeline.similarity.SimilarityAlgorithm;

import java.util.Collection;
import java.util.List;

/**
 * Decides whether two names denote the same identity.
 * Stages run in priority order and the first that succeeds wins:
 * <ol>
 *   <li>exact: case-insensitive equality after whitespace collapse</li>
 *   <li>alias: a stored alias of either side, or token-wise nickname equivalence</li>
 *   <li>fuzzy: bounded edit distance on the normalized forms</li>
 * </ol>
 * Entities of different types never match.
 */
public class NameMatcher {

    private final ResolverRules rules;
    private final NameNormalizer normalizer;
    private final NicknameAliases nicknames;
    private final SimilarityAlgorithm distance;

    public NameMatcher(ResolverRules rules) {
        this(rules, new NameNormalizer(), new OptimalStringAlignment());
    }

    public NameMatcher(ResolverRules rules, NameNormalizer normalizer, SimilarityAlgorithm distance) {
        this.rules = rules;
        this.normalizer = normalizer;
        this.nicknames = new NicknameAliases(rules.nicknames());
        this.distance = distance;
    }

    /**
     * Compares two entities using their canonical names and alias sets.
     */
    public MatchResult match(Entity a, Entity b) {
        if (a.getType() != b.getType()) {
            return MatchResult.noMatch("different entity types");
        }
        return match(a.getCanonicalName(), a.getAliases(), b.getCanonicalName(), b.getAliases(), a.getType());
    }

    /**
     * Compares a free-standing name against an entity.
     */
    public MatchResult match(String name, EntityType type, Entity candidate) {
        if (type != candidate.getType()) {
            return MatchResult.noMatch("different entity types");
        }
        return match(name, List.of(), candidate.getCanonicalName(), candidate.getAliases(), type);
    }

    /**
     * Compares two bare names of the same type.
     */
    public MatchResult match(String nameA, String nameB, EntityType type) {
        return match(nameA, List.of(), nameB, List.of(), type);
    }

    private MatchResult match(String canonicalA, Collection<String> aliasesA,
                              String canonicalB, Collection<String> aliasesB, EntityType type) {
        String exactA = NameNormalizer.exactKey(canonicalA);
        String exactB = NameNormalizer.exactKey(canonicalB);
        if (exactA.isEmpty() || exactB.isEmpty()) {
            return MatchResult.noMatch("blank name");
        }
        if (exactA.equals(exactB)) {
            return MatchResult.exact();
        }

        for (String alias : aliasesB) {
            if (NameNormalizer.exactKey(alias).equals(exactA)) {
                return MatchResult.alias("stored alias '" + alias + "'");
            }
        }
        for (String alias : aliasesA) {
            if (NameNormalizer.exactKey(alias).equals(exactB)) {
                return MatchResult.alias("stored alias '" + alias + "'");
            }
        }

        String normA = normalizer.normalize(canonicalA, type);
        String normB = normalizer.normalize(canonicalB, type);
        if (normA.isEmpty() || normB.isEmpty()) {
            return MatchResult.noMatch("name normalizes to nothing");
        }
        if (normA.equals(normB)) {
            return MatchResult.alias("same normalized form '" + normA + "'");
        }
        if (type == EntityType.PERSON && nicknames.namesEquivalent(normA, normB)) {
            return MatchResult.alias("nickname variant");
        }

        return fuzzy(normA, normB);
    }

    private MatchResult fuzzy(String normA, String normB) {
        int lengthDelta = Math.abs(normA.length() - normB.length());
        if (lengthDelta > rules.maxLengthDelta()) {
            return MatchResult.noMatch("length difference " + lengthDelta);
        }
        int longest = Math.max(normA.length(), normB.length());
        int bound = rules.maxDistanceFor(longest);
        int d = distance.boundedDistance(normA, normB, bound);
        if (d <= bound) {
            return MatchResult.fuzzy(d, longest);
        }
        return MatchResult.noMatch("edit distance above " + bound);
    }

    /**
     * Normalized comparison form of a name.
     */
    public String normalize(String name, EntityType type) {
        return normalizer.normalize(name, type);
    }

    /**
     * Normalized form with every nickname replaced by its formal name.
     */
    public String nicknameCanonicalForm(String name, EntityType type) {
        String normalized = normalizer.normalize(name, type);
        return type == EntityType.PERSON ? nicknames.canonicalForm(normalized) : normalized;
    }

    public NicknameAliases getNicknames() {
        return nicknames;
    }
}
