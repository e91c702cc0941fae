package com.entity.pipeline.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed summary of the evidence accumulated on a relationship edge.
 * Stored as JSON on the relationship row.
 *
 * @param baseWeight      sum of base (mention count) components
 * @param proximityBonus  sum of proximity bonuses
 * @param typeBonus       sum of document type bonuses
 * @param riskBonus       sum of document risk bonuses
 * @param contributions   number of signals folded into the edge
 * @param recentSignals   most recent signal keys, newest last, bounded to {@link #MAX_RECENT_SIGNALS}
 */
public record EvidenceSummary(
        double baseWeight,
        double proximityBonus,
        double typeBonus,
        double riskBonus,
        int contributions,
        List<String> recentSignals
) {
    public static final int MAX_RECENT_SIGNALS = 20;

    public EvidenceSummary {
        recentSignals = recentSignals != null ? List.copyOf(recentSignals) : List.of();
    }

    public static EvidenceSummary empty() {
        return new EvidenceSummary(0, 0, 0, 0, 0, List.of());
    }

    public static EvidenceSummary of(WeightComponents components, String signalKey) {
        return new EvidenceSummary(components.base(), components.proximity(), components.typeBonus(),
                components.riskBonus(), 1, List.of(signalKey));
    }

    /**
     * Combines two summaries, keeping the most recent signal keys.
     */
    public EvidenceSummary plus(EvidenceSummary other) {
        List<String> signals = new ArrayList<>(recentSignals);
        for (String key : other.recentSignals) {
            if (!signals.contains(key)) {
                signals.add(key);
            }
        }
        if (signals.size() > MAX_RECENT_SIGNALS) {
            signals = signals.subList(signals.size() - MAX_RECENT_SIGNALS, signals.size());
        }
        return new EvidenceSummary(
                baseWeight + other.baseWeight,
                proximityBonus + other.proximityBonus,
                typeBonus + other.typeBonus,
                riskBonus + other.riskBonus,
                contributions + other.contributions,
                signals);
    }
}
