package com.entity.pipeline.audit;

import java.util.List;

/**
 * Repository interface for audit entry persistence.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByEntityId(long entityId);

    List<AuditEntry> findByAction(AuditAction action);

    int count();
}
