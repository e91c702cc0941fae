package com.entity.pipeline.rules;

import com.entity.pipeline.core.model.EntityType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Reduces a name to the comparison form used for blocking, fuzzy matching and cache keys:
 * honorifics and corporate suffixes removed, punctuation replaced by spaces, lowercased,
 * whitespace collapsed. Display names are never rewritten.
 */
public class NameNormalizer {

    private final List<NormalizationRule> rules;

    public NameNormalizer() {
        this(defaultRules());
    }

    public NameNormalizer(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::priority));
    }

    public String normalize(String name, EntityType type) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String result = name.trim();
        for (NormalizationRule rule : rules) {
            if (type == null || rule.appliesTo(type)) {
                result = rule.apply(result);
            }
        }
        return result.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    /**
     * Lowercased, whitespace-collapsed form used for exact comparison.
     */
    public static String exactKey(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public static List<NormalizationRule> defaultRules() {
        return List.of(
                NormalizationRule.strip("person-honorific", "^(mr|mrs|ms|miss|dr|prof)\\.?\\s+", 10,
                        EntityType.PERSON),
                NormalizationRule.strip("person-suffix", ",?\\s+(jr|sr|ii|iii|esq)\\.?$", 10,
                        EntityType.PERSON),
                NormalizationRule.strip("organization-suffix", ",?\\s+(inc|corp|corporation|llc|ltd|plc|co)\\.?$", 10,
                        EntityType.ORGANIZATION),
                NormalizationRule.rewrite("ampersand", "\\s*&\\s*", " and ", 50),
                NormalizationRule.rewrite("punctuation", "[^\\p{L}\\p{N}\\s]", " ", 100)
        );
    }
}
