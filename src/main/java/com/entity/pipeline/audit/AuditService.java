package com.entity.pipeline.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Service for recording and querying audit entries.
 * Provides append-only storage for merges, deletions, review flags and synthetic links.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} for entity {} by {}",
                entry.action(), entry.entityId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, Long entityId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.of(action, entityId, actorId, details));
    }

    public AuditEntry record(AuditAction action, Long entityId, String actorId) {
        return record(action, entityId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForEntity(long entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
