package com.planwright.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a pipeline run, used for CLI progress output.
 *
 * @param type      lifecycle point of the run
 * @param projectId the run this event belongs to
 * @param stage     stage or checkpoint label (nullable for project-level events)
 * @param payload   key-value details
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    PipelineEventType type,
    String projectId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public boolean isTerminal() {
        return type.isTerminal();
    }
}
