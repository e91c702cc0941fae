package com.entity.pipeline.pipeline;

/**
 * Batch stages of the pipeline, in run order.
 */
public enum PipelineStage {
    EXTRACT("extract"),
    RESOLVE("resolve"),
    RELATE("relate"),
    SCORE("score"),
    INTEGRITY("integrity");

    private final String command;

    PipelineStage(String command) {
        this.command = command;
    }

    /**
     * Name of the stage on the command line, in logs and in checkpoint keys.
     */
    public String getCommand() {
        return command;
    }

    public static PipelineStage fromCommand(String command) {
        for (PipelineStage stage : values()) {
            if (stage.command.equalsIgnoreCase(command)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + command);
    }
}
