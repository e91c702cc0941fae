package com.entity.pipeline.audit;

import com.entity.pipeline.core.model.MatchMethod;
import com.entity.pipeline.core.model.MergeRecord;
import com.entity.pipeline.store.SqlExecutor;
import com.entity.pipeline.store.StoreConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only ledger of merges with full provenance, stored in the {@code merge_log} table.
 */
public class MergeLedger {
    private static final Logger log = LoggerFactory.getLogger(MergeLedger.class);

    private final SqlExecutor executor;

    public MergeLedger(SqlExecutor executor) {
        this.executor = executor;
    }

    public MergeLedger(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    /**
     * Records a merge. Records cannot be modified or deleted.
     */
    public MergeRecord record(MergeRecord record) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", record.id());
        params.put("sourceEntityId", record.sourceEntityId());
        params.put("targetEntityId", record.targetEntityId());
        params.put("sourceName", record.sourceName());
        params.put("targetName", record.targetName());
        params.put("matchMethod", record.matchMethod().name());
        params.put("matchScore", record.matchScore());
        params.put("mentionsMoved", record.mentionsMoved());
        params.put("mentionsCombined", record.mentionsCombined());
        params.put("relationshipsMoved", record.relationshipsMoved());
        params.put("relationshipsCombined", record.relationshipsCombined());
        params.put("selfLoopsRemoved", record.selfLoopsRemoved());
        params.put("triggeredBy", record.triggeredBy());
        params.put("mergedAt", record.mergedAt().toString());
        executor.insertMergeRecord(params);
        log.info("Merge recorded: {} -> {} (method: {}, score: {})",
                record.sourceEntityId(), record.targetEntityId(), record.matchMethod(), record.matchScore());
        return record;
    }

    public List<MergeRecord> getAllRecords() {
        return executor.findAllMergeRecords().stream().map(MergeLedger::mapToRecord).toList();
    }

    public List<MergeRecord> getRecordsForTarget(long targetEntityId) {
        return executor.findMergeRecords("target_entity_id", targetEntityId).stream()
                .map(MergeLedger::mapToRecord).toList();
    }

    public List<MergeRecord> getRecordsForSource(long sourceEntityId) {
        return executor.findMergeRecords("source_entity_id", sourceEntityId).stream()
                .map(MergeLedger::mapToRecord).toList();
    }

    private static MergeRecord mapToRecord(Map<String, Object> row) {
        return MergeRecord.builder()
                .id((String) row.get("id"))
                .sourceEntityId(((Number) row.get("source_entity_id")).longValue())
                .targetEntityId(((Number) row.get("target_entity_id")).longValue())
                .sourceName((String) row.get("source_name"))
                .targetName((String) row.get("target_name"))
                .matchMethod(MatchMethod.valueOf((String) row.get("match_method")))
                .matchScore(((Number) row.get("match_score")).doubleValue())
                .mentionsMoved(((Number) row.get("mentions_moved")).intValue())
                .mentionsCombined(((Number) row.get("mentions_combined")).intValue())
                .relationshipsMoved(((Number) row.get("relationships_moved")).intValue())
                .relationshipsCombined(((Number) row.get("relationships_combined")).intValue())
                .selfLoopsRemoved(((Number) row.get("self_loops_removed")).intValue())
                .triggeredBy((String) row.get("triggered_by"))
                .mergedAt(Instant.parse((String) row.get("merged_at")))
                .build();
    }
}
