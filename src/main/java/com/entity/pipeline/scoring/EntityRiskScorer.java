package com.entity.pipeline.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the risk of an entity.
 *
 * <p>Formula:</p>
 * <pre>
 * risk = min(mentionCap, mentionFactor * log10(1 + mentions))
 *      + documentFactor * max risk of the documents mentioning it
 *      + min(anchorLinkCap, anchorLinkWeight * evidence links to anchors)
 *      + anchorBonus (entity is itself an anchor)
 * </pre>
 */
public class EntityRiskScorer {
    private static final Logger log = LoggerFactory.getLogger(EntityRiskScorer.class);

    private final ScoringConfig config;

    public EntityRiskScorer(ScoringConfig config) {
        this.config = config;
    }

    public double score(long mentions, double maxDocumentRisk, long anchorLinks, boolean anchor) {
        double mentionShare = Math.min(config.mentionRiskCap(),
                config.mentionRiskFactor() * Math.log10(1 + Math.max(0, mentions)));
        double documentShare = config.documentRiskFactor() * Math.max(0.0, maxDocumentRisk);
        double anchorShare = Math.min(config.anchorLinkCap(), config.anchorLinkWeight() * Math.max(0, anchorLinks));
        double bonus = anchor ? config.anchorBonus() : 0.0;
        double risk = RiskRating.round2(RiskRating.clamp(mentionShare + documentShare + anchorShare + bonus));

        log.trace("Entity risk: mentions={} maxDocumentRisk={} anchorLinks={} anchor={} risk={}",
                mentions, maxDocumentRisk, anchorLinks, anchor, risk);
        return risk;
    }
}
