package com.planwright.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.core.state.PipelineState;
import com.planwright.core.state.PlanJson;

/**
 * An immutable snapshot of a pipeline state. This is also the persisted layout:
 * {@code {"metadata": {...}, "state": {...}}}.
 */
public record Checkpoint(
    CheckpointInfo metadata,
    JsonNode state
) {

    public static final String FORMAT_VERSION = "1.0";

    public Checkpoint {
        state = state == null ? null : state.deepCopy();
    }

    public static Checkpoint of(CheckpointInfo info, PipelineState state) {
        return new Checkpoint(info, PlanJson.mapper().valueToTree(state));
    }

    /**
     * Decodes a fresh {@link PipelineState} from the snapshot.
     *
     * @throws CheckpointException when the snapshot does not decode
     */
    public PipelineState restoreState() {
        try {
            return PlanJson.mapper().treeToValue(state, PipelineState.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CheckpointException("Checkpoint " + metadata.id() + " cannot be decoded: " + e.getMessage(), e);
        }
    }
}
