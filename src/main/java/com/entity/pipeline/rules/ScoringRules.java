package com.entity.pipeline.rules;

import java.util.List;

/**
 * Keyword tiers and anchor entities used by risk scoring, loaded from JSON.
 *
 * @param highRiskKeywords   terms worth the high-tier weight per occurrence
 * @param mediumRiskKeywords terms worth the medium-tier weight per occurrence
 * @param anchorEntities     canonical names of high-risk anchor entities
 */
public record ScoringRules(
        List<String> highRiskKeywords,
        List<String> mediumRiskKeywords,
        List<String> anchorEntities
) {
    public ScoringRules {
        highRiskKeywords = highRiskKeywords != null ? List.copyOf(highRiskKeywords) : List.of();
        mediumRiskKeywords = mediumRiskKeywords != null ? List.copyOf(mediumRiskKeywords) : List.of();
        anchorEntities = anchorEntities != null ? List.copyOf(anchorEntities) : List.of();
    }

    public static ScoringRules defaults() {
        return RulesLoader.loadScoringRules(null);
    }
}
