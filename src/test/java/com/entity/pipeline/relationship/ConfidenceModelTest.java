package com.entity.pipeline.relationship;

import com.entity.pipeline.core.model.RelationshipType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceModelTest {

    @Test
    void coOccurrence_startsAtMinimum() {
        assertEquals(0.5, ConfidenceModel.confidence(RelationshipType.CO_OCCURRENCE, 0.0), 1e-9);
    }

    @Test
    void coOccurrence_followsLogisticCurve() {
        assertEquals(0.731, ConfidenceModel.confidence(RelationshipType.CO_OCCURRENCE, 6.0), 0.001);
        assertEquals(0.953, ConfidenceModel.confidence(RelationshipType.CO_OCCURRENCE, 18.0), 0.001);
    }

    @Test
    void largeWeight_cappedAtMaximum() {
        assertEquals(ConfidenceModel.MAX_CONFIDENCE,
                ConfidenceModel.confidence(RelationshipType.CO_OCCURRENCE, 1000.0), 1e-9);
    }

    @Test
    void explicitSignal_neverBelowFloor() {
        assertEquals(0.9, ConfidenceModel.confidence(RelationshipType.COMMUNICATED, 3.0), 1e-9);
        assertEquals(0.8, ConfidenceModel.confidence(RelationshipType.TIMELINE_CONNECTION, 5.0), 1e-9);
    }

    @Test
    void syntheticLink_hasFixedConfidence() {
        assertEquals(0.1, ConfidenceModel.confidence(RelationshipType.SYNTHETIC_ISOLATE_LINK, 50.0), 1e-9);
    }

    @ParameterizedTest
    @EnumSource(value = RelationshipType.class, names = "SYNTHETIC_ISOLATE_LINK", mode = EnumSource.Mode.EXCLUDE)
    void evidenceTypes_monotonicAndBounded(RelationshipType type) {
        double previous = 0;
        for (double weight = 0; weight <= 60; weight += 2) {
            double confidence = ConfidenceModel.confidence(type, weight);
            assertTrue(confidence >= previous);
            assertTrue(confidence >= ConfidenceModel.MIN_CONFIDENCE && confidence <= ConfidenceModel.MAX_CONFIDENCE);
            previous = confidence;
        }
    }
}
