package com.planwright.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.planwright.core.state.PipelineState;
import com.planwright.core.state.PipelineStatus;
import com.planwright.core.state.PlanJson;
import com.planwright.core.state.ProcessingMetadata;

import java.util.Optional;

/**
 * Outcome of a pipeline run. Successful results carry the plan and verification
 * report; failures carry the error id and whether a checkpoint allows resuming.
 */
public record PipelineResult(
    boolean success,
    String projectId,
    PipelineStatus status,
    JsonNode plan,
    JsonNode verification,
    ProcessingMetadata processingMetadata,
    String error,
    String errorId,
    String stageFailed,
    boolean resumable
) {

    static PipelineResult success(PipelineState state, JsonNode plan, JsonNode verification) {
        return new PipelineResult(true, state.getProjectId(), state.getStatus(), plan, verification,
                state.getMetadata().copy(), null, null, null, false);
    }

    static PipelineResult failure(PipelineState state, String error, String errorId,
                                  String stageFailed, boolean resumable) {
        return new PipelineResult(false, state.getProjectId(), state.getStatus(), null, null,
                state.getMetadata().copy(), error, errorId, stageFailed, resumable);
    }

    static PipelineResult failure(String projectId, String error, String errorId, boolean resumable) {
        return new PipelineResult(false, projectId, null, null, null, null,
                error, errorId, null, resumable);
    }

    public <T> Optional<T> planAs(Class<T> type) {
        return decode(plan, type);
    }

    public <T> Optional<T> verificationAs(Class<T> type) {
        return decode(verification, type);
    }

    private static <T> Optional<T> decode(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(PlanJson.mapper().treeToValue(node, type));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot decode result as " + type.getSimpleName(), e);
        }
    }
}
