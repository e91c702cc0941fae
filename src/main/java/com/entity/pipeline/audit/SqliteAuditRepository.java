package com.entity.pipeline.audit;

import com.entity.pipeline.store.JsonColumns;
import com.entity.pipeline.store.SqlExecutor;
import com.entity.pipeline.store.StoreConnection;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit repository over the {@code audit_log} table.
 * Entries are written inside the caller's transaction, so a rolled-back merge leaves no audit trail.
 */
public class SqliteAuditRepository implements AuditRepository {

    private final SqlExecutor executor;

    public SqliteAuditRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public SqliteAuditRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    @Override
    public AuditEntry save(AuditEntry entry) {
        executor.insertAuditEntry(entry.id(), entry.action().name(), entry.entityId(), entry.actorId(),
                JsonColumns.writeDetails(entry.details()), entry.timestamp());
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return map(executor.findAuditEntries("", Map.of()));
    }

    @Override
    public List<AuditEntry> findByEntityId(long entityId) {
        return map(executor.findAuditEntries("WHERE entity_id = :entityId", Map.of("entityId", entityId)));
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return map(executor.findAuditEntries("WHERE action = :action", Map.of("action", action.name())));
    }

    @Override
    public int count() {
        return findAll().size();
    }

    private List<AuditEntry> map(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> new AuditEntry(
                (String) row.get("id"),
                AuditAction.valueOf((String) row.get("action")),
                row.get("entity_id") == null ? null : ((Number) row.get("entity_id")).longValue(),
                (String) row.get("actor_id"),
                JsonColumns.readDetails((String) row.get("details")),
                Instant.parse((String) row.get("occurred_at")))).toList();
    }
}
