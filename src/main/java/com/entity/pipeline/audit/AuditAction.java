package com.entity.pipeline.audit;

/**
 * Types of auditable actions performed by the pipeline.
 */
public enum AuditAction {
    ENTITY_MERGED,
    ENTITY_DELETED,
    ENTITY_FLAGGED_FOR_REVIEW,
    SYNTHETIC_LINK_CREATED,
    RELATIONSHIPS_REBUILT
}
