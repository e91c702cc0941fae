package com.entity.pipeline.core.model;

import java.util.List;

/**
 * Structured message header extracted by ingestion (sender and recipients of one message).
 */
public record Communication(long id, Long documentId, String sender, List<String> recipients, String sentAt) {

    public Communication {
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }
}
