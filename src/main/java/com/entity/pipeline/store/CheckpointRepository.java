package com.entity.pipeline.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stage progress checkpoints. A checkpoint is saved inside the same transaction as the
 * batch it describes, so it never runs ahead of committed work.
 */
public class CheckpointRepository {

    private final SqlExecutor executor;

    public CheckpointRepository(SqlExecutor executor) {
        this.executor = executor;
    }

    public CheckpointRepository(StoreConnection connection) {
        this(new SqlExecutor(connection));
    }

    public Optional<Checkpoint> find(String stage) {
        List<Map<String, Object>> rows = executor.findCheckpoint(stage);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> row = rows.get(0);
        return Optional.of(new Checkpoint(
                Rows.getString(row, "stage"),
                Rows.getLong(row, "last_processed_id"),
                Rows.getLong(row, "processed_count"),
                Rows.getInstant(row, "updated_at")));
    }

    public void save(String stage, long lastProcessedId, long processedCount) {
        executor.saveCheckpoint(stage, lastProcessedId, processedCount, Instant.now());
    }

    public boolean clear(String stage) {
        return executor.deleteCheckpoint(stage) > 0;
    }

    /**
     * Last committed progress of a stage.
     *
     * @param stage           stage key
     * @param lastProcessedId id of the last item of the last committed batch
     * @param processedCount  running count of processed items
     * @param updatedAt       when the checkpoint was written
     */
    public record Checkpoint(String stage, long lastProcessedId, long processedCount, Instant updatedAt) {
    }
}
