package com.entity.pipeline.relationship;

/**
 * Configuration for relationship building.
 *
 * @param maxEntitiesPerDocument documents with more distinct entities produce no co-occurrence edges
 * @param proximityWindow        first mentions closer than this many characters earn the proximity bonus
 * @param proximityBonus         bonus added when two first mentions are close
 * @param baseCap                cap on the per-document mention count used for the base weight
 * @param riskTypeBonusFactor    share of the document type bonus added to an edge's risk
 */
public record RelationshipConfig(
        int maxEntitiesPerDocument,
        int proximityWindow,
        double proximityBonus,
        int baseCap,
        double riskTypeBonusFactor
) {
    public RelationshipConfig {
        if (maxEntitiesPerDocument < 2) {
            throw new IllegalArgumentException("maxEntitiesPerDocument must be >= 2");
        }
        if (proximityWindow < 0) {
            throw new IllegalArgumentException("proximityWindow must be >= 0");
        }
        if (proximityBonus < 0) {
            throw new IllegalArgumentException("proximityBonus must be >= 0");
        }
        if (baseCap <= 0) {
            throw new IllegalArgumentException("baseCap must be > 0");
        }
        if (riskTypeBonusFactor < 0) {
            throw new IllegalArgumentException("riskTypeBonusFactor must be >= 0");
        }
    }

    public static RelationshipConfig defaults() {
        return new RelationshipConfig(50, 500, 2.0, 3, 0.5);
    }
}
