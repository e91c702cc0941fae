package com.entity.pipeline.pipeline;

/**
 * Unrecoverable structural failure that aborts a run: missing hub entity, unreachable
 * store, merge that fails to commit. The message names the stage and, when known, the
 * entity, so that the run can be repeated safely.
 */
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;
    private final Long entityId;

    public PipelineException(PipelineStage stage, String message) {
        this(stage, null, message, null);
    }

    public PipelineException(PipelineStage stage, Long entityId, String message, Throwable cause) {
        super(format(stage, entityId, message), cause);
        this.stage = stage;
        this.entityId = entityId;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public Long getEntityId() {
        return entityId;
    }

    private static String format(PipelineStage stage, Long entityId, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(stage != null ? stage.getCommand() : "pipeline");
        if (entityId != null) {
            sb.append(" entity=").append(entityId);
        }
        sb.append("] ").append(message);
        return sb.toString();
    }
}
