package com.planwright.core.state;

/**
 * Lifecycle of a pipeline run.
 * NOT_STARTED &rarr; PROCESSING &rarr; COMPLETED | FAILED, and FAILED &rarr; RESUMING &rarr; PROCESSING on resume.
 */
public enum PipelineStatus {
    NOT_STARTED,
    PROCESSING,
    RESUMING,
    COMPLETED,
    FAILED
}
