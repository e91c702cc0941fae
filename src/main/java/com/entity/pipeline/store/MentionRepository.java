package com.entity.pipeline.store;

import com.entity.pipeline.core.model.Mention;
import com.entity.pipeline.core.model.MentionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for mention rows. At most one row exists per (entity, document); counts accumulate.
 */
public class MentionRepository {
    private static final Logger log = LoggerFactory.getLogger(MentionRepository.class);

    public static final int MAX_CONTEXTS = 3;

    private final SqlExecutor executor;

    public MentionRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public MentionRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    public Optional<Mention> find(long entityId, long documentId) {
        List<Map<String, Object>> rows = executor.findMention(entityId, documentId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapToMention(rows.get(0)));
    }

    public List<Mention> findByEntity(long entityId) {
        return executor.findMentionsByEntity(entityId).stream().map(this::mapToMention).toList();
    }

    public List<Mention> findByDocument(long documentId) {
        return executor.findMentionsByDocument(documentId).stream().map(this::mapToMention).toList();
    }

    /**
     * Writes the exact result of a scan, replacing any previous count for the pair.
     *
     * @return true if a row was inserted or its values changed
     */
    public boolean replace(Mention mention) {
        Optional<Mention> existing = find(mention.entityId(), mention.documentId());
        Integer start = mention.hasSpan() ? mention.firstStart() : null;
        Integer end = mention.hasSpan() ? mention.firstEnd() : null;
        String contexts = JsonColumns.writeContexts(limit(mention.contexts()));
        if (existing.isEmpty()) {
            executor.insertMention(mention.entityId(), mention.documentId(), mention.count(), start, end, contexts);
            return true;
        }
        Mention current = existing.get();
        if (current.count() == mention.count() && current.firstStart() == mention.firstStart()
                && current.firstEnd() == mention.firstEnd()
                && current.contexts().equals(limit(mention.contexts()))) {
            return false;
        }
        executor.updateMention(mention.entityId(), mention.documentId(), mention.count(), start, end, contexts);
        return true;
    }

    /**
     * Adds {@code occurrences} to the pair's count, creating the row on first sight.
     * The earliest known span and the first snippets are kept.
     */
    public void recordOccurrences(long entityId, long documentId, int occurrences,
                                  int firstStart, int firstEnd, MentionContext context) {
        if (occurrences <= 0) {
            throw new IllegalArgumentException("occurrences must be > 0");
        }
        Optional<Mention> existing = find(entityId, documentId);
        List<MentionContext> contexts = new ArrayList<>();
        if (existing.isPresent()) {
            contexts.addAll(existing.get().contexts());
        }
        if (context != null && !contexts.contains(context)) {
            contexts.add(context);
        }
        if (existing.isEmpty()) {
            executor.insertMention(entityId, documentId, occurrences,
                    firstStart >= 0 ? firstStart : null, firstEnd >= 0 ? firstEnd : null,
                    JsonColumns.writeContexts(limit(contexts)));
            return;
        }
        Mention current = existing.get();
        boolean earlier = firstStart >= 0 && (!current.hasSpan() || firstStart < current.firstStart());
        int start = earlier ? firstStart : current.firstStart();
        int end = earlier ? firstEnd : current.firstEnd();
        executor.updateMention(entityId, documentId, current.count() + occurrences,
                start >= 0 ? start : null, end >= 0 ? end : null, JsonColumns.writeContexts(limit(contexts)));
    }

    /**
     * Deletes the entity's rows for documents outside {@code keepDocumentIds}.
     *
     * @return number of rows removed
     */
    public int removeStale(long entityId, Set<Long> keepDocumentIds) {
        int removed = 0;
        for (Mention mention : findByEntity(entityId)) {
            if (!keepDocumentIds.contains(mention.documentId())) {
                removed += executor.deleteMention(entityId, mention.documentId());
            }
        }
        return removed;
    }

    /**
     * Moves every mention of {@code sourceId} onto {@code targetId}.
     * Where both reference the same document the counts are summed into the target's row.
     */
    public ReassignOutcome reassign(long sourceId, long targetId) {
        int moved = 0;
        int combined = 0;
        for (Mention mention : findByEntity(sourceId)) {
            Optional<Mention> existing = find(targetId, mention.documentId());
            if (existing.isPresent()) {
                Mention target = existing.get();
                boolean sourceEarlier = mention.hasSpan()
                        && (!target.hasSpan() || mention.firstStart() < target.firstStart());
                List<MentionContext> contexts = new ArrayList<>(target.contexts());
                for (MentionContext context : mention.contexts()) {
                    if (!contexts.contains(context)) {
                        contexts.add(context);
                    }
                }
                int start = sourceEarlier ? mention.firstStart() : target.firstStart();
                int end = sourceEarlier ? mention.firstEnd() : target.firstEnd();
                executor.updateMention(targetId, mention.documentId(), target.count() + mention.count(),
                        start >= 0 ? start : null, end >= 0 ? end : null,
                        JsonColumns.writeContexts(limit(contexts)));
                executor.deleteMention(sourceId, mention.documentId());
                combined++;
            } else {
                executor.reassignMention(sourceId, targetId, mention.documentId());
                moved++;
            }
        }
        log.debug("Reassigned mentions {} -> {}: moved={} combined={}", sourceId, targetId, moved, combined);
        return new ReassignOutcome(moved, combined);
    }

    public long sumForEntity(long entityId) {
        return executor.sumMentions(entityId);
    }

    public double maxDocumentRisk(long entityId) {
        return executor.maxDocumentRisk(entityId);
    }

    public long countRows() {
        return executor.countMentionRows();
    }

    /**
     * Documents mentioning more distinct entities than {@code ceiling}, with their entity counts.
     */
    public Map<Long, Integer> findDenseDocuments(int ceiling) {
        Map<Long, Integer> dense = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findDenseDocuments(ceiling)) {
            dense.put(Rows.getLong(row, "document_id"), Rows.getInt(row, "entity_count", 0));
        }
        return dense;
    }

    public int deleteOrphans() {
        return executor.deleteOrphanMentions();
    }

    private static List<MentionContext> limit(List<MentionContext> contexts) {
        return contexts.size() <= MAX_CONTEXTS ? contexts : List.copyOf(contexts.subList(0, MAX_CONTEXTS));
    }

    private Mention mapToMention(Map<String, Object> row) {
        return new Mention(
                Rows.getLong(row, "entity_id"),
                Rows.getLong(row, "document_id"),
                Rows.getInt(row, "mention_count", 0),
                Rows.getInt(row, "first_start", -1),
                Rows.getInt(row, "first_end", -1),
                JsonColumns.readContexts(Rows.getString(row, "contexts")));
    }

    /**
     * Counts of a mention reassignment.
     *
     * @param moved    rows re-pointed to the target
     * @param combined rows folded into an existing target row
     */
    public record ReassignOutcome(int moved, int combined) {
    }
}
