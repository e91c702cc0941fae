package com.entity.pipeline.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the importance of an entity.
 *
 * <p>Formula:</p>
 * <pre>
 * importance = mentionWeight * log10(1 + mentions) / log10(1 + maxMentions)
 *            + min(degreeCap, degreeFactor * evidenceDegree)
 *            + curatedBonus (entity is in the curated roster)
 * </pre>
 *
 * <p>Clamped to [0, 100] and rounded to two decimals. Synthetic links never count toward
 * the degree.</p>
 */
public class ImportanceScorer {
    private static final Logger log = LoggerFactory.getLogger(ImportanceScorer.class);

    private final ScoringConfig config;

    public ImportanceScorer(ScoringConfig config) {
        this.config = config;
    }

    public double score(long mentions, long maxMentions, long evidenceDegree, boolean curated) {
        double mentionShare = 0.0;
        if (mentions > 0 && maxMentions > 0) {
            mentionShare = config.mentionImportanceWeight()
                    * Math.log10(1 + mentions) / Math.log10(1 + Math.max(mentions, maxMentions));
        }
        double degreeShare = Math.min(config.degreeImportanceCap(),
                config.degreeImportanceFactor() * Math.max(0, evidenceDegree));
        double bonus = curated ? config.curatedBonus() : 0.0;
        double importance = RiskRating.round2(RiskRating.clamp(mentionShare + degreeShare + bonus));

        log.trace("Importance: mentions={} max={} degree={} curated={} importance={}",
                mentions, maxMentions, evidenceDegree, curated, importance);
        return importance;
    }
}
