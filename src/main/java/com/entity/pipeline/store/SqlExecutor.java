package com.entity.pipeline.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the SQL statements of the pipeline, grouped by table.
 * Repositories map the returned rows to domain objects.
 */
public class SqlExecutor {
    private static final Logger log = LoggerFactory.getLogger(SqlExecutor.class);

    private static final String ENTITY_COLUMNS = """
            id, canonical_name, entity_type, aliases, mention_count, importance_score,
            risk_rating, risk_score, needs_review, review_reason, is_consolidated,
            in_curated_source, created_at, updated_at""";

    private static final String RELATIONSHIP_COLUMNS = """
            id, source_id, target_id, relationship_type, weight, confidence, risk_score,
            evidence, created_at, updated_at""";

    private static final String SYNTHETIC = "synthetic_isolate_link";

    private final StoreConnection connection;

    public SqlExecutor(StoreConnection connection) {
        this.connection = connection;
    }

    public StoreConnection getConnection() {
        return connection;
    }

    // ========== Entities ==========

    public long insertEntity(String canonicalName, String entityType, String aliasesJson,
                             int mentionCount, boolean inCuratedSource, Instant now) {
        String sql = """
                INSERT INTO entities (canonical_name, entity_type, aliases, mention_count,
                                      in_curated_source, created_at, updated_at)
                VALUES (:name, :type, :aliases, :mentionCount, :curated, :now, :now)
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("name", canonicalName);
        params.put("type", entityType);
        params.put("aliases", aliasesJson);
        params.put("mentionCount", mentionCount);
        params.put("curated", inCuratedSource);
        params.put("now", now.toString());
        long id = connection.insert(sql, params);
        log.debug("Created entity {} '{}'", id, canonicalName);
        return id;
    }

    public List<Map<String, Object>> findEntityById(long id) {
        return connection.query("SELECT " + ENTITY_COLUMNS + " FROM entities WHERE id = :id",
                Map.of("id", id));
    }

    public List<Map<String, Object>> findEntityByCanonicalName(String canonicalName) {
        return connection.query("SELECT " + ENTITY_COLUMNS + " FROM entities WHERE canonical_name = :name",
                Map.of("name", canonicalName));
    }

    /**
     * Candidates whose canonical name equals the given name ignoring ASCII case.
     */
    public List<Map<String, Object>> findEntitiesByNameIgnoreCase(String name, String entityType) {
        String sql = "SELECT " + ENTITY_COLUMNS + """
                 FROM entities
                WHERE canonical_name = :name COLLATE NOCASE
                  AND entity_type = :type
                ORDER BY id
                """;
        return connection.query(sql, Map.of("name", name, "type", entityType));
    }

    /**
     * Entities of any kind whose canonical name or one of whose aliases equals {@code name},
     * ignoring case. Canonical-name matches come first, then ascending id.
     */
    public List<Map<String, Object>> findEntitiesByNameOrAlias(String name) {
        String sql = "SELECT " + ENTITY_COLUMNS + """
                 FROM entities e
                WHERE e.canonical_name = :name COLLATE NOCASE
                   OR EXISTS (SELECT 1 FROM json_each(e.aliases) a WHERE a.value = :name COLLATE NOCASE)
                ORDER BY CASE WHEN e.canonical_name = :name COLLATE NOCASE THEN 0 ELSE 1 END, e.id
                """;
        return connection.query(sql, Map.of("name", name));
    }

    public List<Map<String, Object>> findEntitiesByType(String entityType) {
        return connection.query("SELECT " + ENTITY_COLUMNS + " FROM entities WHERE entity_type = :type ORDER BY id",
                Map.of("type", entityType));
    }

    public List<Map<String, Object>> findAllEntities() {
        return connection.query("SELECT " + ENTITY_COLUMNS + " FROM entities ORDER BY id");
    }

    /**
     * Next page of entities in id order, restricted to an inclusive id range.
     */
    public List<Map<String, Object>> findEntityPage(long afterId, long fromId, long toId, int limit) {
        String sql = "SELECT " + ENTITY_COLUMNS + """
                 FROM entities
                WHERE id > :afterId AND id >= :fromId AND id <= :toId
                ORDER BY id
                LIMIT :limit
                """;
        return connection.query(sql, Map.of("afterId", afterId, "fromId", fromId, "toId", toId, "limit", limit));
    }

    public void updateEntityAliases(long id, String aliasesJson, Instant now) {
        connection.execute("UPDATE entities SET aliases = :aliases, updated_at = :now WHERE id = :id",
                Map.of("id", id, "aliases", aliasesJson, "now", now.toString()));
    }

    public void markEntityConsolidated(long id, Instant now) {
        connection.execute("UPDATE entities SET is_consolidated = 1, updated_at = :now WHERE id = :id",
                Map.of("id", id, "now", now.toString()));
    }

    public int flagEntityForReview(long id, String reason, Instant now) {
        String sql = """
                UPDATE entities
                   SET needs_review = 1, review_reason = :reason, updated_at = :now
                 WHERE id = :id
                   AND (needs_review = 0 OR review_reason IS NOT :reason)
                """;
        return connection.execute(sql, Map.of("id", id, "reason", reason, "now", now.toString()));
    }

    public void updateEntityScores(long id, double importance, double riskScore, int riskRating) {
        String sql = """
                UPDATE entities
                   SET importance_score = :importance, risk_score = :riskScore, risk_rating = :riskRating
                 WHERE id = :id
                """;
        connection.execute(sql, Map.of("id", id, "importance", importance,
                "riskScore", riskScore, "riskRating", riskRating));
    }

    /**
     * Recomputes the derived mention count of one entity from its mention rows.
     */
    public void recomputeMentionCount(long id) {
        String sql = """
                UPDATE entities
                   SET mention_count = (SELECT COALESCE(SUM(m.mention_count), 0)
                                          FROM entity_mentions m WHERE m.entity_id = entities.id)
                 WHERE id = :id
                """;
        connection.execute(sql, Map.of("id", id));
    }

    /**
     * Recomputes every stale derived mention count.
     *
     * @return number of entities whose count changed
     */
    public int recomputeAllMentionCounts() {
        String sql = """
                UPDATE entities
                   SET mention_count = (SELECT COALESCE(SUM(m.mention_count), 0)
                                          FROM entity_mentions m WHERE m.entity_id = entities.id)
                 WHERE mention_count <> (SELECT COALESCE(SUM(m.mention_count), 0)
                                           FROM entity_mentions m WHERE m.entity_id = entities.id)
                """;
        return connection.execute(sql);
    }

    public int deleteEntity(long id) {
        return connection.execute("DELETE FROM entities WHERE id = :id", Map.of("id", id));
    }

    public long countEntities() {
        return scalar("SELECT COUNT(*) AS n FROM entities", Map.of());
    }

    public long maxMentionCount() {
        return scalar("SELECT COALESCE(MAX(mention_count), 0) AS n FROM entities", Map.of());
    }

    /**
     * Entity ids with their evidence-based degree (synthetic links excluded).
     */
    public List<Map<String, Object>> findEvidenceDegrees() {
        String sql = """
                SELECT e.id AS entity_id,
                       (SELECT COUNT(*) FROM relationships r
                         WHERE (r.source_id = e.id OR r.target_id = e.id)
                           AND r.relationship_type <> :synthetic) AS degree
                  FROM entities e
                """;
        return connection.query(sql, Map.of("synthetic", SYNTHETIC));
    }

    // ========== Documents ==========

    public long insertDocument(String title, String content, String classification,
                               int riskRating, double riskScore) {
        String sql = """
                INSERT INTO documents (title, content, classification, risk_rating, risk_score)
                VALUES (:title, :content, :classification, :riskRating, :riskScore)
                """;
        Map<String, Object> params = new HashMap<>();
        params.put("title", title);
        params.put("content", content);
        params.put("classification", classification);
        params.put("riskRating", riskRating);
        params.put("riskScore", riskScore);
        return connection.insert(sql, params);
    }

    public List<Map<String, Object>> findDocumentById(long id) {
        return connection.query("""
                SELECT id, title, content, classification, risk_rating, risk_score
                  FROM documents WHERE id = :id
                """, Map.of("id", id));
    }

    public List<Map<String, Object>> findDocumentPage(long afterId, long fromId, long toId, int limit) {
        String sql = """
                SELECT id, title, content, classification, risk_rating, risk_score
                  FROM documents
                 WHERE id > :afterId AND id >= :fromId AND id <= :toId
                 ORDER BY id
                 LIMIT :limit
                """;
        return connection.query(sql, Map.of("afterId", afterId, "fromId", fromId, "toId", toId, "limit", limit));
    }

    public void updateDocumentRisk(long id, double riskScore, int riskRating) {
        connection.execute("UPDATE documents SET risk_score = :riskScore, risk_rating = :riskRating WHERE id = :id",
                Map.of("id", id, "riskScore", riskScore, "riskRating", riskRating));
    }

    public long countDocuments() {
        return scalar("SELECT COUNT(*) AS n FROM documents", Map.of());
    }

    /**
     * Rebuilds the external-content full-text index from the documents table.
     */
    public void rebuildFullTextIndex() {
        connection.execute("INSERT INTO documents_fts (documents_fts) VALUES ('rebuild')");
        log.info("Full-text index rebuilt");
    }

    public List<Map<String, Object>> findDocumentIdsByPhrase(String ftsPhrase) {
        return connection.query("""
                SELECT rowid AS id FROM documents_fts WHERE documents_fts MATCH :phrase ORDER BY rowid
                """, Map.of("phrase", ftsPhrase));
    }

    public List<Map<String, Object>> findDocumentIdsBySubstring(String name) {
        return connection.query("""
                SELECT id FROM documents WHERE instr(lower(content), lower(:name)) > 0 ORDER BY id
                """, Map.of("name", name));
    }

    // ========== Mentions ==========

    public List<Map<String, Object>> findMention(long entityId, long documentId) {
        return connection.query("""
                SELECT entity_id, document_id, mention_count, first_start, first_end, contexts
                  FROM entity_mentions WHERE entity_id = :entityId AND document_id = :documentId
                """, Map.of("entityId", entityId, "documentId", documentId));
    }

    public List<Map<String, Object>> findMentionsByEntity(long entityId) {
        return connection.query("""
                SELECT entity_id, document_id, mention_count, first_start, first_end, contexts
                  FROM entity_mentions WHERE entity_id = :entityId ORDER BY document_id
                """, Map.of("entityId", entityId));
    }

    public List<Map<String, Object>> findMentionsByDocument(long documentId) {
        return connection.query("""
                SELECT entity_id, document_id, mention_count, first_start, first_end, contexts
                  FROM entity_mentions WHERE document_id = :documentId ORDER BY entity_id
                """, Map.of("documentId", documentId));
    }

    public void insertMention(long entityId, long documentId, int count, Integer firstStart,
                              Integer firstEnd, String contextsJson) {
        Map<String, Object> params = new HashMap<>();
        params.put("entityId", entityId);
        params.put("documentId", documentId);
        params.put("count", count);
        params.put("firstStart", firstStart);
        params.put("firstEnd", firstEnd);
        params.put("contexts", contextsJson);
        connection.execute("""
                INSERT INTO entity_mentions (entity_id, document_id, mention_count, first_start, first_end, contexts)
                VALUES (:entityId, :documentId, :count, :firstStart, :firstEnd, :contexts)
                """, params);
    }

    public void updateMention(long entityId, long documentId, int count, Integer firstStart,
                              Integer firstEnd, String contextsJson) {
        Map<String, Object> params = new HashMap<>();
        params.put("entityId", entityId);
        params.put("documentId", documentId);
        params.put("count", count);
        params.put("firstStart", firstStart);
        params.put("firstEnd", firstEnd);
        params.put("contexts", contextsJson);
        connection.execute("""
                UPDATE entity_mentions
                   SET mention_count = :count, first_start = :firstStart, first_end = :firstEnd, contexts = :contexts
                 WHERE entity_id = :entityId AND document_id = :documentId
                """, params);
    }

    public int reassignMention(long fromEntityId, long toEntityId, long documentId) {
        return connection.execute("""
                UPDATE entity_mentions SET entity_id = :toEntityId
                 WHERE entity_id = :fromEntityId AND document_id = :documentId
                """, Map.of("fromEntityId", fromEntityId, "toEntityId", toEntityId, "documentId", documentId));
    }

    public int deleteMention(long entityId, long documentId) {
        return connection.execute("DELETE FROM entity_mentions WHERE entity_id = :entityId AND document_id = :documentId",
                Map.of("entityId", entityId, "documentId", documentId));
    }

    public long sumMentions(long entityId) {
        return scalar("SELECT COALESCE(SUM(mention_count), 0) AS n FROM entity_mentions WHERE entity_id = :entityId",
                Map.of("entityId", entityId));
    }

    /**
     * Highest risk score among the documents mentioning the entity, 0 when it has none.
     */
    public double maxDocumentRisk(long entityId) {
        List<Map<String, Object>> rows = connection.query("""
                SELECT COALESCE(MAX(d.risk_score), 0) AS n
                  FROM entity_mentions m JOIN documents d ON d.id = m.document_id
                 WHERE m.entity_id = :entityId
                """, Map.of("entityId", entityId));
        if (rows.isEmpty() || rows.get(0).get("n") == null) {
            return 0.0;
        }
        return ((Number) rows.get(0).get("n")).doubleValue();
    }

    public long countMentionRows() {
        return scalar("SELECT COUNT(*) AS n FROM entity_mentions", Map.of());
    }

    /**
     * Documents whose distinct-entity count exceeds the ceiling.
     */
    public List<Map<String, Object>> findDenseDocuments(int ceiling) {
        return connection.query("""
                SELECT document_id, COUNT(*) AS entity_count
                  FROM entity_mentions
                 GROUP BY document_id
                HAVING COUNT(*) > :ceiling
                 ORDER BY document_id
                """, Map.of("ceiling", ceiling));
    }

    public int deleteOrphanMentions() {
        return connection.execute("""
                DELETE FROM entity_mentions
                 WHERE entity_id NOT IN (SELECT id FROM entities)
                    OR document_id NOT IN (SELECT id FROM documents)
                """);
    }

    // ========== Relationships ==========

    public List<Map<String, Object>> findRelationship(long lowId, long highId, String type) {
        String sql = "SELECT " + RELATIONSHIP_COLUMNS + """
                 FROM relationships
                WHERE min(source_id, target_id) = :lowId
                  AND max(source_id, target_id) = :highId
                  AND relationship_type = :type
                """;
        return connection.query(sql, Map.of("lowId", lowId, "highId", highId, "type", type));
    }

    public List<Map<String, Object>> findRelationshipsByEntity(long entityId) {
        String sql = "SELECT " + RELATIONSHIP_COLUMNS + """
                 FROM relationships
                WHERE source_id = :entityId OR target_id = :entityId
                ORDER BY id
                """;
        return connection.query(sql, Map.of("entityId", entityId));
    }

    public List<Map<String, Object>> findAllRelationships() {
        return connection.query("SELECT " + RELATIONSHIP_COLUMNS + " FROM relationships ORDER BY id");
    }

    public long insertRelationship(long sourceId, long targetId, String type, double weight,
                                   double confidence, double riskScore, String evidenceJson, Instant now) {
        Map<String, Object> params = new HashMap<>();
        params.put("sourceId", sourceId);
        params.put("targetId", targetId);
        params.put("type", type);
        params.put("weight", weight);
        params.put("confidence", confidence);
        params.put("riskScore", riskScore);
        params.put("evidence", evidenceJson);
        params.put("now", now.toString());
        return connection.insert("""
                INSERT INTO relationships (source_id, target_id, relationship_type, weight, confidence,
                                           risk_score, evidence, created_at, updated_at)
                VALUES (:sourceId, :targetId, :type, :weight, :confidence, :riskScore, :evidence, :now, :now)
                """, params);
    }

    public void updateRelationshipTotals(long id, double weight, double confidence, double riskScore,
                                         String evidenceJson, Instant now) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", id);
        params.put("weight", weight);
        params.put("confidence", confidence);
        params.put("riskScore", riskScore);
        params.put("evidence", evidenceJson);
        params.put("now", now.toString());
        connection.execute("""
                UPDATE relationships
                   SET weight = :weight, confidence = :confidence, risk_score = :riskScore,
                       evidence = :evidence, updated_at = :now
                 WHERE id = :id
                """, params);
    }

    public void repointRelationship(long id, long sourceId, long targetId, Instant now) {
        connection.execute("""
                UPDATE relationships SET source_id = :sourceId, target_id = :targetId, updated_at = :now
                 WHERE id = :id
                """, Map.of("id", id, "sourceId", sourceId, "targetId", targetId, "now", now.toString()));
    }

    public int deleteRelationship(long id) {
        return connection.execute("DELETE FROM relationships WHERE id = :id", Map.of("id", id));
    }

    public int deleteSelfLoops() {
        return connection.execute("DELETE FROM relationships WHERE source_id = target_id");
    }

    public int deleteOrphanRelationships() {
        return connection.execute("""
                DELETE FROM relationships
                 WHERE source_id NOT IN (SELECT id FROM entities)
                    OR target_id NOT IN (SELECT id FROM entities)
                """);
    }

    public int deleteEvidenceRelationships() {
        return connection.execute("DELETE FROM relationships WHERE relationship_type <> :synthetic",
                Map.of("synthetic", SYNTHETIC));
    }

    public long countRelationships(String type) {
        return scalar("SELECT COUNT(*) AS n FROM relationships WHERE relationship_type = :type",
                Map.of("type", type));
    }

    public long countEvidenceRelationships(long entityId) {
        return scalar("""
                SELECT COUNT(*) AS n FROM relationships
                 WHERE (source_id = :entityId OR target_id = :entityId)
                   AND relationship_type <> :synthetic
                """, Map.of("entityId", entityId, "synthetic", SYNTHETIC));
    }

    public long countAllRelationships(long entityId) {
        return scalar("SELECT COUNT(*) AS n FROM relationships WHERE source_id = :entityId OR target_id = :entityId",
                Map.of("entityId", entityId));
    }

    /**
     * Entities with no relationship of any type, other than the hub itself.
     */
    public List<Map<String, Object>> findIsolatedEntityIds(long hubId) {
        return connection.query("""
                SELECT e.id AS id FROM entities e
                 WHERE e.id <> :hubId
                   AND NOT EXISTS (SELECT 1 FROM relationships r
                                    WHERE r.source_id = e.id OR r.target_id = e.id)
                 ORDER BY e.id
                """, Map.of("hubId", hubId));
    }

    /**
     * Removes synthetic links from entities that have gained evidence-based edges.
     */
    public int deleteRedundantSyntheticLinks() {
        return connection.execute("""
                DELETE FROM relationships
                 WHERE relationship_type = :synthetic
                   AND EXISTS (SELECT 1 FROM relationships r
                                WHERE r.relationship_type <> :synthetic
                                  AND (r.source_id = relationships.source_id
                                       OR r.target_id = relationships.source_id))
                """, Map.of("synthetic", SYNTHETIC));
    }

    /**
     * Synthetic links that do not point at the given hub (left behind after a hub change or merge).
     */
    public int deleteSyntheticLinksNotTo(long hubId) {
        return connection.execute("""
                DELETE FROM relationships
                 WHERE relationship_type = :synthetic AND target_id <> :hubId
                """, Map.of("synthetic", SYNTHETIC, "hubId", hubId));
    }

    // ========== Evidence ledger ==========

    public boolean evidenceExists(String signalKey, long lowId, long highId, String type) {
        return scalar("""
                SELECT COUNT(*) AS n FROM relationship_evidence
                 WHERE signal_key = :key AND low_id = :lowId AND high_id = :highId AND relationship_type = :type
                """, Map.of("key", signalKey, "lowId", lowId, "highId", highId, "type", type)) > 0;
    }

    public void insertEvidence(String signalKey, long lowId, long highId, String type, double weight, Instant now) {
        connection.execute("""
                INSERT INTO relationship_evidence (signal_key, low_id, high_id, relationship_type, weight, recorded_at)
                VALUES (:key, :lowId, :highId, :type, :weight, :now)
                """, Map.of("key", signalKey, "lowId", lowId, "highId", highId, "type", type,
                "weight", weight, "now", now.toString()));
    }

    /**
     * Moves ledger rows of {@code sourceId} onto {@code targetId}.
     * Rows between the two entities are dropped; rows already present for the target are kept once.
     */
    public void rekeyEvidence(long sourceId, long targetId) {
        Map<String, Object> params = Map.of("sourceId", sourceId, "targetId", targetId);
        connection.execute("""
                DELETE FROM relationship_evidence
                 WHERE (low_id = :sourceId AND high_id = :targetId)
                    OR (low_id = :targetId AND high_id = :sourceId)
                """, params);
        connection.execute("""
                INSERT INTO relationship_evidence (signal_key, low_id, high_id, relationship_type, weight, recorded_at)
                SELECT moved.signal_key, min(:targetId, moved.other_id), max(:targetId, moved.other_id),
                       moved.relationship_type, moved.weight, moved.recorded_at
                  FROM (SELECT signal_key, relationship_type, weight, recorded_at,
                               CASE WHEN low_id = :sourceId THEN high_id ELSE low_id END AS other_id
                          FROM relationship_evidence
                         WHERE low_id = :sourceId OR high_id = :sourceId) AS moved
                 WHERE NOT EXISTS (SELECT 1 FROM relationship_evidence existing
                                    WHERE existing.signal_key = moved.signal_key
                                      AND existing.low_id = min(:targetId, moved.other_id)
                                      AND existing.high_id = max(:targetId, moved.other_id)
                                      AND existing.relationship_type = moved.relationship_type)
                """, params);
        connection.execute("DELETE FROM relationship_evidence WHERE low_id = :sourceId OR high_id = :sourceId",
                Map.of("sourceId", sourceId));
    }

    public int deleteAllEvidence() {
        return connection.execute("DELETE FROM relationship_evidence");
    }

    public int deleteOrphanEvidence() {
        return connection.execute("""
                DELETE FROM relationship_evidence
                 WHERE low_id NOT IN (SELECT id FROM entities)
                    OR high_id NOT IN (SELECT id FROM entities)
                """);
    }

    public long countEvidence() {
        return scalar("SELECT COUNT(*) AS n FROM relationship_evidence", Map.of());
    }

    // ========== Structured signals ==========

    public long insertCommunication(Long documentId, String sender, String recipientsJson, String sentAt) {
        Map<String, Object> params = new HashMap<>();
        params.put("documentId", documentId);
        params.put("sender", sender);
        params.put("recipients", recipientsJson);
        params.put("sentAt", sentAt);
        return connection.insert("""
                INSERT INTO communications (document_id, sender, recipients, sent_at)
                VALUES (:documentId, :sender, :recipients, :sentAt)
                """, params);
    }

    public List<Map<String, Object>> findCommunicationPage(long afterId, int limit) {
        return connection.query("""
                SELECT id, document_id, sender, recipients, sent_at FROM communications
                 WHERE id > :afterId ORDER BY id LIMIT :limit
                """, Map.of("afterId", afterId, "limit", limit));
    }

    public long insertTimelineEvent(String title, String eventDate, String participantsJson) {
        Map<String, Object> params = new HashMap<>();
        params.put("title", title);
        params.put("eventDate", eventDate);
        params.put("participants", participantsJson);
        return connection.insert("""
                INSERT INTO timeline_events (title, event_date, participants)
                VALUES (:title, :eventDate, :participants)
                """, params);
    }

    public List<Map<String, Object>> findTimelineEventPage(long afterId, int limit) {
        return connection.query("""
                SELECT id, title, event_date, participants FROM timeline_events
                 WHERE id > :afterId ORDER BY id LIMIT :limit
                """, Map.of("afterId", afterId, "limit", limit));
    }

    // ========== Merge log ==========

    public void insertMergeRecord(Map<String, Object> params) {
        connection.execute("""
                INSERT INTO merge_log (id, source_entity_id, target_entity_id, source_name, target_name,
                                       match_method, match_score, mentions_moved, mentions_combined,
                                       relationships_moved, relationships_combined, self_loops_removed,
                                       triggered_by, merged_at)
                VALUES (:id, :sourceEntityId, :targetEntityId, :sourceName, :targetName,
                        :matchMethod, :matchScore, :mentionsMoved, :mentionsCombined,
                        :relationshipsMoved, :relationshipsCombined, :selfLoopsRemoved,
                        :triggeredBy, :mergedAt)
                """, params);
    }

    public List<Map<String, Object>> findMergeRecords(String column, long entityId) {
        if (!"source_entity_id".equals(column) && !"target_entity_id".equals(column)) {
            throw new IllegalArgumentException("Unsupported merge log column: " + column);
        }
        return connection.query("SELECT * FROM merge_log WHERE " + column + " = :entityId ORDER BY merged_at, id",
                Map.of("entityId", entityId));
    }

    public List<Map<String, Object>> findAllMergeRecords() {
        return connection.query("SELECT * FROM merge_log ORDER BY merged_at, id");
    }

    // ========== Audit ==========

    public void insertAuditEntry(String id, String action, Long entityId, String actorId,
                                 String detailsJson, Instant occurredAt) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", id);
        params.put("action", action);
        params.put("entityId", entityId);
        params.put("actorId", actorId);
        params.put("details", detailsJson);
        params.put("occurredAt", occurredAt.toString());
        connection.execute("""
                INSERT INTO audit_log (id, action, entity_id, actor_id, details, occurred_at)
                VALUES (:id, :action, :entityId, :actorId, :details, :occurredAt)
                """, params);
    }

    public List<Map<String, Object>> findAuditEntries(String whereClause, Map<String, Object> params) {
        return connection.query("SELECT id, action, entity_id, actor_id, details, occurred_at FROM audit_log "
                + whereClause + " ORDER BY occurred_at, id", params);
    }

    // ========== Checkpoints ==========

    public List<Map<String, Object>> findCheckpoint(String stage) {
        return connection.query("""
                SELECT stage, last_processed_id, processed_count, updated_at
                  FROM pipeline_checkpoints WHERE stage = :stage
                """, Map.of("stage", stage));
    }

    public void saveCheckpoint(String stage, long lastProcessedId, long processedCount, Instant now) {
        connection.execute("""
                INSERT INTO pipeline_checkpoints (stage, last_processed_id, processed_count, updated_at)
                VALUES (:stage, :lastId, :count, :now)
                ON CONFLICT (stage) DO UPDATE
                   SET last_processed_id = excluded.last_processed_id,
                       processed_count = excluded.processed_count,
                       updated_at = excluded.updated_at
                """, Map.of("stage", stage, "lastId", lastProcessedId, "count", processedCount,
                "now", now.toString()));
    }

    public int deleteCheckpoint(String stage) {
        return connection.execute("DELETE FROM pipeline_checkpoints WHERE stage = :stage", Map.of("stage", stage));
    }

    // ========== Helpers ==========

    private long scalar(String sql, Map<String, Object> params) {
        List<Map<String, Object>> rows = connection.query(sql, params);
        if (rows.isEmpty()) {
            return 0L;
        }
        Object value = rows.get(0).get("n");
        return value == null ? 0L : ((Number) value).longValue();
    }
}
