package com.entity.pipeline.core.model;

/**
 * Document classification assigned by ingestion.
 * The type bonus orders the classes legal &gt; financial &gt; travel &gt; communication &gt; generic.
 */
public enum DocumentClassification {
    LEGAL("legal", 4.0),
    FINANCIAL("financial", 3.0),
    TRAVEL("travel", 2.0),
    COMMUNICATION("communication", 1.0),
    GENERIC("generic", 0.0);

    private final String value;
    private final double typeBonus;

    DocumentClassification(String value, double typeBonus) {
        this.value = value;
        this.typeBonus = typeBonus;
    }

    public String getValue() {
        return value;
    }

    public double getTypeBonus() {
        return typeBonus;
    }

    /**
     * Maps a stored classification to the enum. Unknown or missing values are generic.
     */
    public static DocumentClassification fromValue(String value) {
        if (value == null) {
            return GENERIC;
        }
        String normalized = value.trim().toLowerCase();
        for (DocumentClassification c : values()) {
            if (c.value.equals(normalized)) {
                return c;
            }
        }
        // Ingestion also uses a few finer-grained labels
        return switch (normalized) {
            case "deposition", "court_filing", "court filing", "legal_document" -> LEGAL;
            case "bank_record", "invoice", "financial_record" -> FINANCIAL;
            case "flight_log", "flight log", "itinerary" -> TRAVEL;
            case "email", "letter", "message" -> COMMUNICATION;
            default -> GENERIC;
        };
    }
}
