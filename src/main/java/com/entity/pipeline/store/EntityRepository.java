package com.entity.pipeline.store;

import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository for entity rows.
 */
public class EntityRepository {
    private static final Logger log = LoggerFactory.getLogger(EntityRepository.class);

    private final SqlExecutor executor;

    public EntityRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public EntityRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Inserts a new entity and returns it with its assigned id.
     */
    public Entity save(Entity entity) {
        InputSanitizer.validateEntityName(entity.getCanonicalName());
        long id = executor.insertEntity(
                entity.getCanonicalName(),
                entity.getType().name(),
                JsonColumns.writeStrings(entity.getAliases()),
                entity.getMentionCount(),
                entity.isInCuratedSource(),
                entity.getCreatedAt());
        return Entity.builder()
                .id(id)
                .canonicalName(entity.getCanonicalName())
                .type(entity.getType())
                .aliases(entity.getAliases())
                .mentionCount(entity.getMentionCount())
                .inCuratedSource(entity.isInCuratedSource())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    /**
     * Convenience for seeding: inserts a person or organization by name.
     */
    public Entity create(String canonicalName, EntityType type) {
        return save(Entity.builder().canonicalName(canonicalName).type(type).build());
    }

    public Optional<Entity> findById(long id) {
        List<Map<String, Object>> rows = executor.findEntityById(id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToEntity(rows.get(0)));
    }

    public Optional<Entity> findByCanonicalName(String canonicalName) {
        List<Map<String, Object>> rows = executor.findEntityByCanonicalName(canonicalName);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToEntity(rows.get(0)));
    }

    public List<Entity> findByNameIgnoreCase(String name, EntityType type) {
        return executor.findEntitiesByNameIgnoreCase(name, type.name()).stream()
                .map(this::mapToEntity).toList();
    }

    /**
     * Looks a name up across every entity kind, through canonical names first and then the
     * alias sets that merges leave behind.
     */
    public List<Entity> findByNameOrAlias(String name) {
        return executor.findEntitiesByNameOrAlias(name).stream().map(this::mapToEntity).toList();
    }

    public List<Entity> findAllByType(EntityType type) {
        return executor.findEntitiesByType(type.name()).stream().map(this::mapToEntity).toList();
    }

    public List<Entity> findAll() {
        return executor.findAllEntities().stream().map(this::mapToEntity).toList();
    }

    /**
     * Next page of entities with id greater than {@code afterId}, inside {@code range}.
     */
    public List<Entity> findPage(long afterId, IdRange range, int limit) {
        return executor.findEntityPage(afterId, range.fromId(), range.toId(), limit).stream()
                .map(this::mapToEntity).toList();
    }

    public void updateAliases(Entity entity) {
        executor.updateEntityAliases(entity.getId(), JsonColumns.writeStrings(entity.getAliases()), Instant.now());
    }

    public void markConsolidated(long entityId) {
        executor.markEntityConsolidated(entityId, Instant.now());
    }

    /**
     * Flags an entity for human review.
     *
     * @return true if the flag or its reason changed
     */
    public boolean flagForReview(long entityId, String reason) {
        return executor.flagEntityForReview(entityId, reason, Instant.now()) > 0;
    }

    public void updateScores(long entityId, double importance, double riskScore, int riskRating) {
        executor.updateEntityScores(entityId, importance, riskScore, riskRating);
    }

    public void recomputeMentionCount(long entityId) {
        executor.recomputeMentionCount(entityId);
    }

    public int recomputeAllMentionCounts() {
        return executor.recomputeAllMentionCounts();
    }

    public boolean delete(long entityId) {
        boolean deleted = executor.deleteEntity(entityId) > 0;
        if (deleted) {
            log.debug("Deleted entity {}", entityId);
        }
        return deleted;
    }

    public long count() {
        return executor.countEntities();
    }

    public long maxMentionCount() {
        return executor.maxMentionCount();
    }

    /**
     * Evidence-based degree of every entity, synthetic links excluded.
     */
    public Map<Long, Integer> evidenceDegrees() {
        Map<Long, Integer> degrees = new HashMap<>();
        for (Map<String, Object> row : executor.findEvidenceDegrees()) {
            degrees.put(Rows.getLong(row, "entity_id"), Rows.getInt(row, "degree", 0));
        }
        return degrees;
    }

    public SqlExecutor getExecutor() {
        return executor;
    }

    Entity mapToEntity(Map<String, Object> row) {
        return Entity.builder()
                .id(Rows.getLong(row, "id"))
                .canonicalName(Rows.getString(row, "canonical_name"))
                .type(EntityType.fromValue(Rows.getString(row, "entity_type")))
                .aliases(JsonColumns.readStringSet(Rows.getString(row, "aliases")))
                .mentionCount(Rows.getInt(row, "mention_count", 0))
                .importanceScore(Rows.getDouble(row, "importance_score"))
                .riskRating(Rows.getInt(row, "risk_rating", 1))
                .riskScore(Rows.getDouble(row, "risk_score"))
                .needsReview(Rows.getBoolean(row, "needs_review"))
                .reviewReason(Rows.getString(row, "review_reason"))
                .consolidated(Rows.getBoolean(row, "is_consolidated"))
                .inCuratedSource(Rows.getBoolean(row, "in_curated_source"))
                .createdAt(Rows.getInstant(row, "created_at"))
                .updatedAt(Rows.getInstant(row, "updated_at"))
                .build();
    }
}
