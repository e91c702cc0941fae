package com.entity.pipeline.store;

import com.entity.pipeline.core.model.RelationshipType;

import java.time.Instant;

/**
 * Ledger of weight contributions already folded into relationship edges.
 * A contribution is keyed by (signal key, unordered entity pair, type); re-processing
 * a recorded key must not add weight again.
 */
public class EvidenceLedgerRepository {

    private final SqlExecutor executor;

    public EvidenceLedgerRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public EvidenceLedgerRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    public boolean isRecorded(String signalKey, long entityA, long entityB, RelationshipType type) {
        return executor.evidenceExists(signalKey, Math.min(entityA, entityB), Math.max(entityA, entityB),
                type.getValue());
    }

    public void record(String signalKey, long entityA, long entityB, RelationshipType type, double weight) {
        executor.insertEvidence(signalKey, Math.min(entityA, entityB), Math.max(entityA, entityB),
                type.getValue(), weight, Instant.now());
    }

    /**
     * Moves the ledger rows of a merged-away entity onto the surviving entity.
     */
    public void rekey(long sourceEntityId, long targetEntityId) {
        executor.rekeyEvidence(sourceEntityId, targetEntityId);
    }

    public int clear() {
        return executor.deleteAllEvidence();
    }

    public int deleteOrphans() {
        return executor.deleteOrphanEvidence();
    }

    public long count() {
        return executor.countEvidence();
    }
}
