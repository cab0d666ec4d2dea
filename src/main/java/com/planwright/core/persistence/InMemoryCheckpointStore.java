package com.planwright.core.persistence;

import com.planwright.core.state.PipelineState;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Non-durable {@link CheckpointStore} for tests and throwaway runs. Snapshots are
 * kept as JSON trees so later changes to a state never leak into saved history.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Checkpoint>> checkpoints = new ConcurrentHashMap<>();

    public InMemoryCheckpointStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CheckpointInfo saveState(String projectId, PipelineState state, String stageName) {
        if (projectId == null || projectId.isBlank()) {
            throw new CheckpointException("Invalid project id: " + projectId);
        }
        CopyOnWriteArrayList<Checkpoint> history = checkpoints.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>());
        synchronized (history) {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            if (!history.isEmpty()) {
                Instant last = history.get(history.size() - 1).metadata().timestamp();
                if (!now.isAfter(last)) {
                    now = last.plus(1, ChronoUnit.MICROS);
                }
            }
            String id = stageName + "_" + history.size() + "_" + now.toEpochMilli();
            CheckpointInfo info = new CheckpointInfo(id, projectId, stageName, now, Checkpoint.FORMAT_VERSION);
            history.add(Checkpoint.of(info, state));
            return info;
        }
    }

    @Override
    public Optional<PipelineState> loadLatestState(String projectId) {
        List<Checkpoint> history = checkpoints.get(projectId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.get(history.size() - 1).restoreState());
    }

    @Override
    public Optional<Checkpoint> load(String projectId, String checkpointId) {
        List<Checkpoint> history = checkpoints.get(projectId);
        if (history == null) {
            return Optional.empty();
        }
        return history.stream().filter(c -> c.metadata().id().equals(checkpointId)).findFirst();
    }

    @Override
    public List<CheckpointInfo> listStates(String projectId) {
        List<Checkpoint> history = checkpoints.get(projectId);
        if (history == null) {
            return List.of();
        }
        List<CheckpointInfo> infos = new ArrayList<>();
        for (Checkpoint c : history) {
            infos.add(c.metadata());
        }
        infos.sort(Comparator.comparing(CheckpointInfo::timestamp).reversed());
        return infos;
    }

    @Override
    public List<String> listProjectIds() {
        return checkpoints.keySet().stream().sorted().toList();
    }
}
