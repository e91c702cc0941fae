package com.entity.pipeline.core.model;

/**
 * Relationship edge types.
 * Explicit signals carry a higher base weight and confidence floor than inferred co-occurrence.
 */
public enum RelationshipType {
    CO_OCCURRENCE("co_occurrence", 1.0, 0.5, true),
    TIMELINE_CONNECTION("timeline_connection", 5.0, 0.8, true),
    COMMUNICATED("communicated", 3.0, 0.9, true),
    TRAVELED_WITH("traveled_with", 2.0, 0.75, true),
    SYNTHETIC_ISOLATE_LINK("synthetic_isolate_link", 0.1, 0.1, false);

    private final String value;
    private final double baseWeight;
    private final double confidenceFloor;
    private final boolean evidenceBased;

    RelationshipType(String value, double baseWeight, double confidenceFloor, boolean evidenceBased) {
        this.value = value;
        this.baseWeight = baseWeight;
        this.confidenceFloor = confidenceFloor;
        this.evidenceBased = evidenceBased;
    }

    /**
     * Stored form of the type.
     */
    public String getValue() {
        return value;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    public double getConfidenceFloor() {
        return confidenceFloor;
    }

    /**
     * False for synthetic edges that downstream scoring and analysis must ignore.
     */
    public boolean isEvidenceBased() {
        return evidenceBased;
    }

    public static RelationshipType fromValue(String value) {
        for (RelationshipType type : values()) {
            if (type.value.equals(value) || type.name().equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown relationship type: " + value);
    }
}
