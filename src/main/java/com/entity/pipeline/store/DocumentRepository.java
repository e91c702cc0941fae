package com.entity.pipeline.store;

import com.entity.pipeline.core.model.Document;
import com.entity.pipeline.core.model.DocumentClassification;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for the read-mostly document table and its full-text index.
 */
public class DocumentRepository {

    private final SqlExecutor executor;

    public DocumentRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public DocumentRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Inserts a document. Used by ingestion tooling and tests; the pipeline itself never creates documents.
     */
    public Document save(String title, String content, DocumentClassification classification) {
        long id = executor.insertDocument(title, content, classification.getValue(), 1, 0.0);
        return new Document(id, title, content, classification, 1, 0.0);
    }

    public Document save(String content, DocumentClassification classification) {
        return save(null, content, classification);
    }

    public Optional<Document> findById(long id) {
        List<Map<String, Object>> rows = executor.findDocumentById(id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToDocument(rows.get(0)));
    }

    public List<Document> findPage(long afterId, IdRange range, int limit) {
        return executor.findDocumentPage(afterId, range.fromId(), range.toId(), limit).stream()
                .map(this::mapToDocument).toList();
    }

    public void updateRisk(long documentId, double riskScore, int riskRating) {
        executor.updateDocumentRisk(documentId, riskScore, riskRating);
    }

    public long count() {
        return executor.countDocuments();
    }

    public void rebuildFullTextIndex() {
        executor.rebuildFullTextIndex();
    }

    /**
     * Candidate documents for an FTS5 phrase query.
     */
    public Set<Long> findCandidatesByPhrase(String ftsPhrase) {
        return toIdSet(executor.findDocumentIdsByPhrase(ftsPhrase));
    }

    /**
     * Candidate documents by case-insensitive substring, used when the index cannot be queried.
     */
    public Set<Long> findCandidatesBySubstring(String name) {
        return toIdSet(executor.findDocumentIdsBySubstring(name));
    }

    private Set<Long> toIdSet(List<Map<String, Object>> rows) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            ids.add(Rows.getLong(row, "id"));
        }
        return ids;
    }

    private Document mapToDocument(Map<String, Object> row) {
        return new Document(
                Rows.getLong(row, "id"),
                Rows.getString(row, "title"),
                Rows.getString(row, "content"),
                DocumentClassification.fromValue(Rows.getString(row, "classification")),
                Rows.getInt(row, "risk_rating", 1),
                Rows.getDouble(row, "risk_score"));
    }
}
