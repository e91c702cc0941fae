package com.entity.pipeline.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityRiskScorerTest {

    private final EntityRiskScorer scorer = new EntityRiskScorer(ScoringConfig.defaults());

    @Test
    void score_sumsAllShares() {
        // 10 * log10(10) + 0.4 * 50 + 4 * 2 + 10
        assertEquals(48.0, scorer.score(9, 50.0, 2, true), 1e-9);
    }

    @Test
    void score_mentionShareIsCapped() {
        assertEquals(30.0, scorer.score(1_000_000_000L, 0.0, 0, false), 1e-9);
    }

    @Test
    void score_anchorLinkShareIsCapped() {
        assertEquals(20.0, scorer.score(0, 0.0, 100, false), 1e-9);
    }

    @Test
    void score_clampedToHundred() {
        assertEquals(100.0, scorer.score(1_000_000_000L, 100.0, 100, true), 1e-9);
    }

    @Test
    void score_zeroWithoutEvidence() {
        assertEquals(0.0, scorer.score(0, 0.0, 0, false), 1e-9);
    }
}
