package com.entity.pipeline.store;

import com.entity.pipeline.core.model.EvidenceSummary;
import com.entity.pipeline.core.model.Relationship;
import com.entity.pipeline.core.model.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for relationship edges. Edges are identified by (unordered pair, type).
 */
public class RelationshipRepository {
    private static final Logger log = LoggerFactory.getLogger(RelationshipRepository.class);

    private final SqlExecutor executor;

    public RelationshipRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public RelationshipRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Finds the edge of the given type between two entities, in either direction.
     */
    public Optional<Relationship> find(long entityA, long entityB, RelationshipType type) {
        List<Map<String, Object>> rows = executor.findRelationship(
                Math.min(entityA, entityB), Math.max(entityA, entityB), type.getValue());
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToRelationship(rows.get(0)));
    }

    public List<Relationship> findByEntity(long entityId) {
        return executor.findRelationshipsByEntity(entityId).stream().map(this::mapToRelationship).toList();
    }

    public List<Relationship> findAll() {
        return executor.findAllRelationships().stream().map(this::mapToRelationship).toList();
    }

    /**
     * Inserts a new edge. Callers check for an existing edge first.
     */
    public Relationship insert(Relationship relationship) {
        long id = executor.insertRelationship(
                relationship.getSourceId(),
                relationship.getTargetId(),
                relationship.getType().getValue(),
                relationship.getWeight(),
                relationship.getConfidence(),
                relationship.getRiskScore(),
                JsonColumns.writeEvidence(relationship.getEvidence()),
                relationship.getCreatedAt());
        log.debug("Created relationship {} {} -[{}]-> {}", id, relationship.getSourceId(),
                relationship.getType().getValue(), relationship.getTargetId());
        return Relationship.builder()
                .id(id)
                .sourceId(relationship.getSourceId())
                .targetId(relationship.getTargetId())
                .type(relationship.getType())
                .weight(relationship.getWeight())
                .confidence(relationship.getConfidence())
                .riskScore(relationship.getRiskScore())
                .evidence(relationship.getEvidence())
                .createdAt(relationship.getCreatedAt())
                .build();
    }

    public void updateTotals(long relationshipId, double weight, double confidence, double riskScore,
                             EvidenceSummary evidence) {
        executor.updateRelationshipTotals(relationshipId, weight, confidence, riskScore,
                JsonColumns.writeEvidence(evidence), Instant.now());
    }

    /**
     * Re-points the endpoint {@code fromEntityId} of an edge to {@code toEntityId}, keeping direction.
     */
    public void repoint(Relationship relationship, long fromEntityId, long toEntityId) {
        long source = relationship.getSourceId() == fromEntityId ? toEntityId : relationship.getSourceId();
        long target = relationship.getTargetId() == fromEntityId ? toEntityId : relationship.getTargetId();
        executor.repointRelationship(relationship.getId(), source, target, Instant.now());
    }

    public boolean delete(long relationshipId) {
        return executor.deleteRelationship(relationshipId) > 0;
    }

    public int deleteSelfLoops() {
        return executor.deleteSelfLoops();
    }

    public int deleteOrphans() {
        return executor.deleteOrphanRelationships();
    }

    /**
     * Deletes every evidence-based edge, leaving synthetic links in place.
     */
    public int deleteEvidenceBased() {
        return executor.deleteEvidenceRelationships();
    }

    public long count(RelationshipType type) {
        return executor.countRelationships(type.getValue());
    }

    public long countEvidenceBased(long entityId) {
        return executor.countEvidenceRelationships(entityId);
    }

    public long countAll(long entityId) {
        return executor.countAllRelationships(entityId);
    }

    public List<Long> findIsolatedEntityIds(long hubId) {
        return executor.findIsolatedEntityIds(hubId).stream().map(row -> Rows.getLong(row, "id")).toList();
    }

    public int deleteRedundantSyntheticLinks() {
        return executor.deleteRedundantSyntheticLinks();
    }

    public int deleteSyntheticLinksNotTo(long hubId) {
        return executor.deleteSyntheticLinksNotTo(hubId);
    }

    private Relationship mapToRelationship(Map<String, Object> row) {
        return Relationship.builder()
                .id(Rows.getLong(row, "id"))
                .sourceId(Rows.getLong(row, "source_id"))
                .targetId(Rows.getLong(row, "target_id"))
                .type(RelationshipType.fromValue(Rows.getString(row, "relationship_type")))
                .weight(Rows.getDouble(row, "weight"))
                .confidence(Rows.getDouble(row, "confidence"))
                .riskScore(Rows.getDouble(row, "risk_score"))
                .evidence(JsonColumns.readEvidence(Rows.getString(row, "evidence")))
                .createdAt(Rows.getInstant(row, "created_at"))
                .updatedAt(Rows.getInstant(row, "updated_at"))
                .build();
    }
}
