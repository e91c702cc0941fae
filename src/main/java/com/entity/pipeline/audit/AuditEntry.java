package com.entity.pipeline.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One append-only line of the audit trail.
 *
 * @param id        random identifier
 * @param action    what happened
 * @param entityId  entity the action applied to, null for run-level actions
 * @param actorId   stage or operator that caused the action
 * @param details   small JSON-serializable payload (names, counts, reasons)
 * @param timestamp when the action was recorded
 */
public record AuditEntry(String id, AuditAction action, Long entityId, String actorId,
                         Map<String, Object> details, Instant timestamp) {

    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    /**
     * New entry stamped with a fresh id and the current time.
     */
    public static AuditEntry of(AuditAction action, Long entityId, String actorId, Map<String, Object> details) {
        return new AuditEntry(UUID.randomUUID().toString(), action, entityId, actorId, details, Instant.now());
    }
}
