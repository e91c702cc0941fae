package com.entity.pipeline.relationship;

import com.entity.pipeline.core.model.Document;
import com.entity.pipeline.core.model.Mention;
import com.entity.pipeline.core.model.RelationshipType;
import com.entity.pipeline.core.model.WeightComponents;

import java.util.regex.Pattern;

/**
 * Weight of the evidence that two entities mentioned in the same document are related.
 * <pre>
 * weight = min(min(countA, countB), baseCap) * baseWeight
 *        + proximityBonus   (first mentions within the window, no blank line between)
 *        + typeBonus        (document classification)
 *        + riskBonus        (document risk rating)
 * risk   = document risk score + riskTypeBonusFactor * typeBonus
 * </pre>
 */
public class CoOccurrenceWeigher {

    private static final Pattern BLANK_LINE = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");

    private final RelationshipConfig config;

    public CoOccurrenceWeigher(RelationshipConfig config) {
        this.config = config;
    }

    public WeightComponents weigh(Mention a, Mention b, Document document) {
        double base = Math.min(Math.min(a.count(), b.count()), config.baseCap())
                * RelationshipType.CO_OCCURRENCE.getBaseWeight();
        double proximity = isClose(a, b, document.content()) ? config.proximityBonus() : 0.0;
        double typeBonus = document.classification().getTypeBonus();
        return new WeightComponents(base, proximity, typeBonus, document.riskRating());
    }

    public double risk(Document document) {
        return document.riskScore() + config.riskTypeBonusFactor() * document.classification().getTypeBonus();
    }

    /**
     * Whether the first occurrences are within the proximity window and in the same paragraph.
     * Mentions without a known span are never close.
     */
    boolean isClose(Mention a, Mention b, String content) {
        if (!a.hasSpan() || !b.hasSpan()) {
            return false;
        }
        Mention first = a.firstStart() <= b.firstStart() ? a : b;
        Mention second = first == a ? b : a;
        int gapStart = Math.min(first.firstEnd(), content.length());
        int gapEnd = Math.min(second.firstStart(), content.length());
        if (gapEnd - gapStart > config.proximityWindow()) {
            return false;
        }
        if (gapEnd <= gapStart) {
            return true;
        }
        return !BLANK_LINE.matcher(content.substring(gapStart, gapEnd)).find();
    }
}
