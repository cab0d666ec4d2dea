package com.planwright.core.persistence;

import com.planwright.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read-side queries over the checkpoint store for the CLI and for resume decisions.
 */
@Service
public class CheckpointQueryService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointQueryService.class);

    private final CheckpointStore store;

    public CheckpointQueryService(CheckpointStore store) {
        this.store = store;
    }

    /**
     * True when a latest state exists and decodes. Read failures are logged and count as "no state".
     */
    public boolean hasResumableState(String projectId) {
        try {
            return store.loadLatestState(projectId).isPresent();
        } catch (CheckpointException e) {
            log.warn("Checkpoint of project {} is not readable: {}", projectId, e.getMessage());
            return false;
        }
    }

    public List<CheckpointInfo> listSavedStates(String projectId) {
        return store.listStates(projectId);
    }

    public Optional<PipelineState> getLatestState(String projectId) {
        return store.loadLatestState(projectId);
    }

    public List<String> listAllProjectIds() {
        return store.listProjectIds();
    }
}
