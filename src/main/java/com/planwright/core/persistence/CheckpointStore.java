package com.planwright.core.persistence;

import com.planwright.core.state.PipelineState;

import java.util.List;
import java.util.Optional;

/**
 * Append-only history of pipeline-state snapshots per project, with a pointer to the newest.
 * Implementations raise {@link CheckpointException} on I/O or decoding failures.
 */
public interface CheckpointStore {

    /**
     * Snapshots {@code state} as of {@code stageName} and makes it the project's latest checkpoint.
     */
    CheckpointInfo saveState(String projectId, PipelineState state, String stageName);

    Optional<PipelineState> loadLatestState(String projectId);

    Optional<Checkpoint> load(String projectId, String checkpointId);

    /**
     * All checkpoints of the project, newest first.
     */
    List<CheckpointInfo> listStates(String projectId);

    List<String> listProjectIds();
}
