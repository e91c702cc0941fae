package com.entity.pipeline.relationship;

import com.entity.pipeline.core.model.RelationshipType;

/**
 * Maps the accumulated weight of an edge to a confidence in [0.5, 0.99].
 * The logistic curve saturates slowly: weight 6 gives about 0.73, weight 18 about 0.95.
 * Explicit signal types never fall below their confidence floor.
 */
public final class ConfidenceModel {

    public static final double MIN_CONFIDENCE = 0.5;
    public static final double MAX_CONFIDENCE = 0.99;
    static final double SCALE = 6.0;

    private ConfidenceModel() {
    }

    public static double confidence(RelationshipType type, double weight) {
        if (!type.isEvidenceBased()) {
            return type.getConfidenceFloor();
        }
        double squashed = 1.0 / (1.0 + Math.exp(-weight / SCALE));
        double withFloor = Math.max(type.getConfidenceFloor(), squashed);
        return Math.min(MAX_CONFIDENCE, Math.max(MIN_CONFIDENCE, withFloor));
    }
}
