package com.entity.pipeline.pipeline;

/**
 * Callback interface for tracking progress of batch passes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called after each committed batch.
     *
     * @param processed the number of items processed so far
     * @param total     the total number of items (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
