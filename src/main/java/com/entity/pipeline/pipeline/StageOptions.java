package com.entity.pipeline.pipeline;

import com.entity.pipeline.store.IdRange;

import java.util.Objects;

/**
 * Per-invocation options of a stage.
 *
 * @param dryRun    compute and report, roll back every unit of work
 * @param batchSize items per transaction
 * @param range     restricts the pass to an id range
 * @param rebuild   discard previously accumulated results and recompute (relationship stage)
 * @param resume    continue after the last committed checkpoint instead of starting over
 * @param progress  progress listener
 */
public record StageOptions(boolean dryRun, int batchSize, IdRange range, boolean rebuild, boolean resume,
                           ProgressCallback progress) {

    public static final int DEFAULT_BATCH_SIZE = 500;

    public StageOptions {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        range = range != null ? range : IdRange.all();
        progress = progress != null ? progress : ProgressCallback.NOOP;
    }

    public static StageOptions defaults() {
        return new StageOptions(false, DEFAULT_BATCH_SIZE, IdRange.all(), false, false, ProgressCallback.NOOP);
    }

    public StageOptions withDryRun(boolean dryRun) {
        return new StageOptions(dryRun, batchSize, range, rebuild, resume, progress);
    }

    public StageOptions withBatchSize(int batchSize) {
        return new StageOptions(dryRun, batchSize, range, rebuild, resume, progress);
    }

    public StageOptions withRange(IdRange range) {
        return new StageOptions(dryRun, batchSize, Objects.requireNonNull(range), rebuild, resume, progress);
    }

    public StageOptions withRebuild(boolean rebuild) {
        return new StageOptions(dryRun, batchSize, range, rebuild, resume, progress);
    }

    public StageOptions withResume(boolean resume) {
        return new StageOptions(dryRun, batchSize, range, rebuild, resume, progress);
    }

    public StageOptions withProgress(ProgressCallback progress) {
        return new StageOptions(dryRun, batchSize, range, rebuild, resume, progress);
    }
}
