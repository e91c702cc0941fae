package com.entity.pipeline.scoring;

/**
 * Maps a risk score in [0, 100] to a 1-5 rating.
 */
public final class RiskRating {

    public static final int MIN = 1;
    public static final int MAX = 5;

    private RiskRating() {
    }

    public static int fromScore(double score) {
        if (score >= 80) {
            return 5;
        }
        if (score >= 60) {
            return 4;
        }
        if (score >= 40) {
            return 3;
        }
        if (score >= 20) {
            return 2;
        }
        return 1;
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }

    static double round2(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
