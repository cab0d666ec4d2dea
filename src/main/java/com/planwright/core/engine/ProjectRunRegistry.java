package com.planwright.core.engine;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tracks active runs so that a project never has two runs at once within this JVM.
 */
public class ProjectRunRegistry {

    private final ConcurrentHashMap<String, RunHandle> active = new ConcurrentHashMap<>();

    /**
     * Claims the project for a new run, or returns empty when a run is already active.
     */
    public Optional<RunHandle> tryAcquire(String projectId) {
        RunHandle handle = new RunHandle(projectId);
        RunHandle existing = active.putIfAbsent(projectId, handle);
        return existing == null ? Optional.of(handle) : Optional.empty();
    }

    public void release(RunHandle handle) {
        active.remove(handle.projectId(), handle);
    }

    /**
     * Requests cancellation of the active run; it stops before its next stage.
     *
     * @return false when the project has no active run
     */
    public boolean cancel(String projectId) {
        RunHandle handle = active.get(projectId);
        if (handle == null) {
            return false;
        }
        handle.cancelRequested.set(true);
        return true;
    }

    public boolean isRunning(String projectId) {
        return active.containsKey(projectId);
    }

    public static final class RunHandle {
        private final String projectId;
        private final AtomicBoolean cancelRequested = new AtomicBoolean();

        RunHandle(String projectId) {
            this.projectId = projectId;
        }

        public String projectId() {
            return projectId;
        }

        public boolean isCancelRequested() {
            return cancelRequested.get();
        }
    }
}
