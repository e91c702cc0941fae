package com.entity.pipeline.core.model;

import java.util.Objects;

/**
 * A unit of corpus text. Owned by ingestion; only the risk fields are written by the pipeline.
 */
public record Document(
        long id,
        String title,
        String content,
        DocumentClassification classification,
        int riskRating,
        double riskScore
) {
    public Document {
        Objects.requireNonNull(classification, "classification is required");
        content = content != null ? content : "";
    }

    public static Document of(long id, String content, DocumentClassification classification) {
        return new Document(id, null, content, classification, 1, 0.0);
    }
}
