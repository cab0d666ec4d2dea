package com.planwright.core.events;

/**
 * Lifecycle points of a pipeline run. A terminal type is the last event a run
 * publishes.
 */
public enum PipelineEventType {

    PROJECT_STARTED("project.started", false),
    PROJECT_RESUMED("project.resumed", false),
    RESUME_FALLBACK("project.resume_fallback", false),
    STAGE_STARTED("stage.started", false),
    STAGE_COMPLETED("stage.completed", false),
    CHECKPOINT_SAVED("checkpoint.saved", false),
    PROJECT_COMPLETED("project.completed", true),
    PROJECT_FAILED("project.failed", true),
    PROJECT_CANCELLED("project.cancelled", true);

    private final String code;
    private final boolean terminal;

    PipelineEventType(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    /** Dotted name used in logs and console output. */
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
