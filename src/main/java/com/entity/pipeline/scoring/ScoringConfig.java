package com.entity.pipeline.scoring;

/**
 * Weights of the importance and risk formulas.
 *
 * @param mentionImportanceWeight  share of importance from log-scaled mentions
 * @param degreeImportanceFactor   importance per evidence link
 * @param degreeImportanceCap      cap on the degree share of importance
 * @param curatedBonus             importance bonus for entities in the curated roster
 * @param highKeywordWeight        document risk per high-tier keyword hit
 * @param mediumKeywordWeight      document risk per medium-tier keyword hit
 * @param documentAnchorWeight     document risk per anchor entity mentioned in it
 * @param mentionRiskFactor        entity risk per log10 of mentions
 * @param mentionRiskCap           cap on the mention share of entity risk
 * @param documentRiskFactor       share of the riskiest linked document in entity risk
 * @param anchorLinkWeight         entity risk per evidence link to an anchor
 * @param anchorLinkCap            cap on the anchor-link share of entity risk
 * @param anchorBonus              entity risk bonus for the anchors themselves
 */
public record ScoringConfig(
        double mentionImportanceWeight,
        double degreeImportanceFactor,
        double degreeImportanceCap,
        double curatedBonus,
        double highKeywordWeight,
        double mediumKeywordWeight,
        double documentAnchorWeight,
        double mentionRiskFactor,
        double mentionRiskCap,
        double documentRiskFactor,
        double anchorLinkWeight,
        double anchorLinkCap,
        double anchorBonus
) {
    public ScoringConfig {
        requireNonNegative(mentionImportanceWeight, "mentionImportanceWeight");
        requireNonNegative(degreeImportanceFactor, "degreeImportanceFactor");
        requireNonNegative(degreeImportanceCap, "degreeImportanceCap");
        requireNonNegative(curatedBonus, "curatedBonus");
        requireNonNegative(highKeywordWeight, "highKeywordWeight");
        requireNonNegative(mediumKeywordWeight, "mediumKeywordWeight");
        requireNonNegative(documentAnchorWeight, "documentAnchorWeight");
        requireNonNegative(mentionRiskFactor, "mentionRiskFactor");
        requireNonNegative(mentionRiskCap, "mentionRiskCap");
        requireNonNegative(anchorLinkWeight, "anchorLinkWeight");
        requireNonNegative(anchorLinkCap, "anchorLinkCap");
        requireNonNegative(anchorBonus, "anchorBonus");
        if (documentRiskFactor < 0.0 || documentRiskFactor > 1.0) {
            throw new IllegalArgumentException("documentRiskFactor must be between 0.0 and 1.0");
        }
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(50, 0.3, 30, 20, 10, 3, 5, 10, 30, 0.4, 4, 20, 10);
    }

    private static void requireNonNegative(double value, String name) {
        if (value < 0.0) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
