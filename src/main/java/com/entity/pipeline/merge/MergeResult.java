package com.entity.pipeline.merge;

import com.entity.pipeline.core.model.Entity;
import com.entity.pipeline.core.model.MergeRecord;

/**
 * Result of a merge operation.
 *
 * @param success         true when the merge ran (committed, or rolled back for a dry run)
 * @param dryRun          true when the changes were rolled back
 * @param canonicalEntity the surviving entity as it was before the merge
 * @param mergedEntity    the entity merged away
 * @param mergeRecord     ledger record describing what moved, null unless successful
 * @param errorMessage    why the merge was not performed
 */
public record MergeResult(
        boolean success,
        boolean dryRun,
        Entity canonicalEntity,
        Entity mergedEntity,
        MergeRecord mergeRecord,
        String errorMessage
) {

    public static MergeResult success(Entity canonicalEntity, Entity mergedEntity, MergeRecord mergeRecord,
                                      boolean dryRun) {
        return new MergeResult(true, dryRun, canonicalEntity, mergedEntity, mergeRecord, null);
    }

    /**
     * The merge was not performed, for example because the source no longer exists.
     */
    public static MergeResult skipped(String errorMessage) {
        return new MergeResult(false, false, null, null, null, errorMessage);
    }

    public static MergeResult skipped(Entity sourceEntity, Entity targetEntity, String errorMessage) {
        return new MergeResult(false, false, targetEntity, sourceEntity, null, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }
}
