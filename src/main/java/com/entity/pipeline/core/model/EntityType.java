package com.entity.pipeline.core.model;

/**
 * Kinds of entities tracked by the pipeline.
 */
public enum EntityType {
    PERSON("Person"),
    ORGANIZATION("Organization"),
    LOCATION("Location");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses a stored or user-supplied kind, accepting either the enum name or the label.
     */
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PERSON;
        }
        for (EntityType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.label.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity type: " + value);
    }
}
