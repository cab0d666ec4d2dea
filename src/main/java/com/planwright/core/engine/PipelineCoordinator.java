package com.planwright.core.engine;

import com.planwright.core.events.EventBus;
import com.planwright.core.events.PipelineEvent;
import com.planwright.core.events.PipelineEventType;
import com.planwright.core.logging.MdcContext;
import com.planwright.core.metrics.PlanningMetrics;
import com.planwright.core.model.ProjectRequest;
import com.planwright.core.persistence.CheckpointException;
import com.planwright.core.persistence.CheckpointInfo;
import com.planwright.core.persistence.CheckpointStore;
import com.planwright.core.pipeline.Pipeline;
import com.planwright.core.pipeline.StageDefinition;
import com.planwright.core.reporting.ErrorReporter;
import com.planwright.core.reporting.EventLevel;
import com.planwright.core.retry.RetryExhaustedException;
import com.planwright.core.retry.RetryExecutor;
import com.planwright.core.state.ErrorLogEntry;
import com.planwright.core.state.PipelineState;
import com.planwright.core.state.PipelineStatus;
import com.planwright.core.state.ProcessingMetadata;
import com.planwright.core.state.StageTiming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the planning pipeline for a project, checkpointing after every stage
 * and resuming from the latest checkpoint after a failure.
 * <p>
 * Stages run strictly in declared order on the caller's thread. Each stage goes
 * through the {@link RetryExecutor}; an unrecoverable failure ends the run with a
 * {@code <stage>_failed} checkpoint so a later call can continue after the last
 * completed stage. The public entry points never throw: every outcome is a
 * {@link PipelineResult}.
 */
@Service
public class PipelineCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final Pipeline pipeline;
    private final RetryExecutor retryExecutor;
    private final CheckpointStore checkpointStore;
    private final ErrorReporter errorReporter;
    private final EventBus eventBus;
    private final PlanningMetrics metrics;
    private final Clock clock;
    private final ExecutorService runExecutor;
    private final ProjectRunRegistry runRegistry = new ProjectRunRegistry();

    public PipelineCoordinator(Pipeline pipeline, RetryExecutor retryExecutor, CheckpointStore checkpointStore,
                               ErrorReporter errorReporter, EventBus eventBus, PlanningMetrics metrics,
                               Clock clock, ExecutorService runExecutor) {
        this.pipeline = pipeline;
        this.retryExecutor = retryExecutor;
        this.checkpointStore = checkpointStore;
        this.errorReporter = errorReporter;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.runExecutor = runExecutor;
    }

    public PipelineResult processProject(ProjectRequest request) {
        return processProject(request, RunOptions.defaults());
    }

    /**
     * Plans a project. When {@code options.resume()} is set and the project (identified by
     * the request's id) has a checkpoint, the run continues after the last completed stage;
     * otherwise every stage runs from the start.
     */
    public PipelineResult processProject(ProjectRequest request, RunOptions options) {
        if (request == null) {
            IllegalArgumentException e = new IllegalArgumentException("Project request is required");
            String errorId = errorReporter.logError(e, "coordinator", Map.of());
            return PipelineResult.failure(null, e.getMessage(), errorId, false);
        }
        String projectId = resolveProjectId(request);
        if (!ProjectIds.isValid(projectId)) {
            return rejectProjectId(projectId);
        }
        Optional<ProjectRunRegistry.RunHandle> handle = runRegistry.tryAcquire(projectId);
        if (handle.isEmpty()) {
            return refuseConcurrentRun(projectId);
        }
        MdcContext.setProject(projectId);
        try {
            RunOptions effective = options != null ? options : RunOptions.defaults();
            if (effective.resume() && hasCheckpoint(projectId)) {
                log.info("Found saved state for project {}, resuming", projectId);
                return resume(projectId, handle.get());
            }
            log.info("Starting project {} ({})", projectId, request.projectName());
            PipelineState state = new PipelineState(projectId);
            state.markStarted(clock.instant());
            state.putValue(pipeline.seedSlot(), request.withId(projectId));
            publish(PipelineEventType.PROJECT_STARTED, projectId, null,
                    Map.of("projectName", String.valueOf(request.projectName())));
            errorReporter.recordEvent(EventLevel.INFO, "Project processing started",
                    Map.of("projectId", projectId, "stages", pipeline.size()));
            return runStages(state, 0, handle.get());
        } catch (RuntimeException e) {
            return unexpectedFailure(projectId, e);
        } finally {
            runRegistry.release(handle.get());
            MdcContext.clear();
        }
    }

    /**
     * Continues a project from its latest checkpoint.
     */
    public PipelineResult resumeProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            IllegalArgumentException e = new IllegalArgumentException("Project id is required to resume");
            String errorId = errorReporter.logError(e, "coordinator", Map.of());
            return PipelineResult.failure(projectId, e.getMessage(), errorId, false);
        }
        if (!ProjectIds.isValid(projectId)) {
            return rejectProjectId(projectId);
        }
        Optional<ProjectRunRegistry.RunHandle> handle = runRegistry.tryAcquire(projectId);
        if (handle.isEmpty()) {
            return refuseConcurrentRun(projectId);
        }
        MdcContext.setProject(projectId);
        try {
            return resume(projectId, handle.get());
        } catch (RuntimeException e) {
            return unexpectedFailure(projectId, e);
        } finally {
            runRegistry.release(handle.get());
            MdcContext.clear();
        }
    }

    public CompletableFuture<PipelineResult> processProjectAsync(ProjectRequest request, RunOptions options) {
        return CompletableFuture.supplyAsync(() -> processProject(request, options), runExecutor);
    }

    /**
     * Asks the active run of {@code projectId} to stop before its next stage.
     *
     * @return false when the project has no active run
     */
    public boolean cancel(String projectId) {
        boolean requested = runRegistry.cancel(projectId);
        if (requested) {
            log.info("Cancellation requested for project {}", projectId);
        }
        return requested;
    }

    public boolean isRunning(String projectId) {
        return runRegistry.isRunning(projectId);
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    // ── Run flow ─────────────────────────────────────────────────────

    private PipelineResult resume(String projectId, ProjectRunRegistry.RunHandle handle) {
        Optional<PipelineState> loaded;
        try {
            loaded = checkpointStore.loadLatestState(projectId);
        } catch (CheckpointException e) {
            String errorId = errorReporter.logError(e, "resume:" + projectId, Map.of("projectId", projectId));
            return PipelineResult.failure(projectId, "Failed to load saved state: " + e.getMessage(), errorId, false);
        }
        if (loaded.isEmpty()) {
            IllegalStateException e = new IllegalStateException("No saved state found for project " + projectId);
            String errorId = errorReporter.logError(e, "resume:" + projectId, Map.of("projectId", projectId));
            return PipelineResult.failure(projectId, e.getMessage(), errorId, false);
        }

        PipelineState state = loaded.get();
        ProcessingMetadata metadata = state.getMetadata();
        metadata.setResumeCount(metadata.getResumeCount() + 1);
        state.setStatus(PipelineStatus.RESUMING);
        metrics.recordResume();

        int startIndex = resumeIndex(state);
        String fromStage = startIndex < pipeline.size() ? pipeline.stage(startIndex).name() : "completed";
        log.info("Resuming project {} at stage {} (resume #{})", projectId, fromStage, metadata.getResumeCount());
        publish(PipelineEventType.PROJECT_RESUMED, projectId, fromStage, Map.of("resumeCount", metadata.getResumeCount()));
        errorReporter.recordEvent(EventLevel.INFO, "Resuming project",
                Map.of("projectId", projectId, "fromStage", fromStage, "resumeCount", metadata.getResumeCount()));

        state.setStatus(PipelineStatus.PROCESSING);
        metadata.setEndTime(null);
        return runStages(state, startIndex, handle);
    }

    private int resumeIndex(PipelineState state) {
        String last = state.getMetadata().getLastStageCompleted();
        if (last == null) {
            log.info("No stage of project {} completed before; restarting from the first stage", state.getProjectId());
            return 0;
        }
        int index = pipeline.indexOf(last);
        if (index < 0) {
            log.warn("Saved state of project {} names unknown stage '{}'; restarting from the first stage",
                    state.getProjectId(), last);
            publish(PipelineEventType.RESUME_FALLBACK, state.getProjectId(), null, Map.of("unknownStage", last));
            errorReporter.recordEvent(EventLevel.WARN, "Unknown stage in saved state",
                    Map.of("projectId", state.getProjectId(), "stage", last));
            return 0;
        }
        return index + 1;
    }

    private PipelineResult runStages(PipelineState state, int startIndex, ProjectRunRegistry.RunHandle handle) {
        for (int i = startIndex; i < pipeline.size(); i++) {
            StageDefinition<?> stage = pipeline.stage(i);
            if (handle.isCancelRequested()) {
                return cancelRun(state, stage.name());
            }
            Optional<PipelineResult> failure = runStage(state, stage, i);
            if (failure.isPresent()) {
                return failure.get();
            }
        }
        return completeRun(state);
    }

    private Optional<PipelineResult> runStage(PipelineState state, StageDefinition<?> stage, int index) {
        String projectId = state.getProjectId();
        MdcContext.setStage(projectId, stage.name());
        log.info("Stage {}/{}: {}", index + 1, pipeline.size(), stage.name());
        publish(PipelineEventType.STAGE_STARTED, projectId, stage.name(), Map.of("index", index));

        Instant started = clock.instant();
        AtomicInteger attempts = new AtomicInteger();
        try {
            Object output = retryExecutor.executeWithRetry(() -> {
                attempts.incrementAndGet();
                return stage.invoke(state);
            }, projectId + ":" + stage.name(), stage.retryPolicy());

            state.putValue(stage.outputSlot(), output);
        } catch (RuntimeException e) {
            Instant ended = clock.instant();
            long durationMs = Duration.between(started, ended).toMillis();
            state.getMetadata().recordTiming(stage.name(),
                    new StageTiming(started, ended, durationMs, attempts.get(), true));
            metrics.recordStageDuration(stage.name(), durationMs, false);
            return Optional.of(failRun(state, stage.name(), e));
        }

        Instant ended = clock.instant();
        long durationMs = Duration.between(started, ended).toMillis();
        state.getMetadata().setLastStageCompleted(stage.name());
        state.getMetadata().recordTiming(stage.name(),
                new StageTiming(started, ended, durationMs, attempts.get(), false));
        metrics.recordStageDuration(stage.name(), durationMs, true);
        metrics.recordStageAttempts(stage.name(), attempts.get());
        log.info("Stage {} completed in {}ms ({} attempt(s))", stage.name(), durationMs, attempts.get());

        saveCheckpoint(state, stage.name());
        publish(PipelineEventType.STAGE_COMPLETED, projectId, stage.name(),
                Map.of("durationMs", durationMs, "attempts", attempts.get()));
        errorReporter.recordEvent(EventLevel.INFO, "Stage completed",
                Map.of("projectId", projectId, "stage", stage.name(), "durationMs", durationMs));
        return Optional.empty();
    }

    private PipelineResult completeRun(PipelineState state) {
        String projectId = state.getProjectId();
        List<String> missing = new ArrayList<>();
        for (StageDefinition<?> stage : pipeline.stages()) {
            if (!state.hasValue(stage.outputSlot())) {
                missing.add(stage.outputSlot());
            }
        }
        if (!missing.isEmpty()) {
            String lastStage = pipeline.stage(pipeline.size() - 1).name();
            return failRun(state, lastStage,
                    new IllegalStateException("Run ended with empty output slots: " + missing));
        }

        state.markFinished(PipelineStatus.COMPLETED, clock.instant());
        saveCheckpoint(state, "completed");
        metrics.recordRunResult("completed");
        log.info("Project {} completed", projectId);
        publish(PipelineEventType.PROJECT_COMPLETED, projectId, null, Map.of());
        errorReporter.recordEvent(EventLevel.INFO, "Project processing completed", Map.of("projectId", projectId));
        return PipelineResult.success(state, state.rawValue(pipeline.resultSlot()),
                pipeline.verificationSlot() != null ? state.rawValue(pipeline.verificationSlot()) : null);
    }

    private PipelineResult failRun(PipelineState state, String stageName, Throwable error) {
        String projectId = state.getProjectId();
        Throwable cause = error instanceof RetryExhaustedException && error.getCause() != null
                ? error.getCause() : error;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("projectId", projectId);
        details.put("stage", stageName);
        if (error instanceof RetryExhaustedException rex) {
            details.put("retriesAttempted", rex.getRetriesAttempted());
            details.put("retryable", rex.isRetryable());
        }
        String errorId = errorReporter.logError(cause, projectId + ":" + stageName, details);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        Instant now = clock.instant();
        state.addError(new ErrorLogEntry(now, message, stageName, errorId));
        state.markFinished(PipelineStatus.FAILED, now);
        boolean saved = saveCheckpoint(state, stageName + "_failed");

        metrics.recordRunResult("failed");
        publish(PipelineEventType.PROJECT_FAILED, projectId, stageName, Map.of("error", message, "errorId", errorId));
        errorReporter.recordEvent(EventLevel.ERROR, "Project processing failed",
                Map.of("projectId", projectId, "stage", stageName, "errorId", errorId));
        return PipelineResult.failure(state, message, errorId, stageName, saved || hasCheckpoint(projectId));
    }

    private PipelineResult cancelRun(PipelineState state, String nextStage) {
        String projectId = state.getProjectId();
        CancellationException cancellation = new CancellationException("Run cancelled before stage " + nextStage);
        String errorId = errorReporter.logError(cancellation, projectId + ":" + nextStage,
                Map.of("projectId", projectId, "stage", nextStage));
        Instant now = clock.instant();
        state.addError(new ErrorLogEntry(now, cancellation.getMessage(), nextStage, errorId));
        state.markFinished(PipelineStatus.FAILED, now);
        boolean saved = saveCheckpoint(state, nextStage + "_cancelled");

        metrics.recordRunResult("cancelled");
        log.info("Project {} cancelled before stage {}", projectId, nextStage);
        publish(PipelineEventType.PROJECT_CANCELLED, projectId, nextStage, Map.of("errorId", errorId));
        return PipelineResult.failure(state, cancellation.getMessage(), errorId, nextStage,
                saved || hasCheckpoint(projectId));
    }

    private PipelineResult rejectProjectId(String projectId) {
        IllegalArgumentException e = new IllegalArgumentException("Invalid project id '" + projectId
                + "': use letters, digits, '.', '_' or '-'");
        String errorId = errorReporter.logError(e, "coordinator", Map.of("projectId", projectId));
        return PipelineResult.failure(projectId, e.getMessage(), errorId, false);
    }

    private PipelineResult refuseConcurrentRun(String projectId) {
        IllegalStateException e = new IllegalStateException("A run is already in progress for project " + projectId);
        String errorId = errorReporter.logError(e, "coordinator:" + projectId, Map.of("projectId", projectId));
        return PipelineResult.failure(projectId, e.getMessage(), errorId, false);
    }

    private PipelineResult unexpectedFailure(String projectId, RuntimeException e) {
        log.error("Unexpected failure while processing project {}", projectId, e);
        String errorId = errorReporter.logError(e, "coordinator:" + projectId, Map.of("projectId", projectId));
        return PipelineResult.failure(projectId, String.valueOf(e.getMessage()), errorId, hasCheckpoint(projectId));
    }

    // ── Helpers ──────────────────────────────────────────────────────

    /**
     * Saves a snapshot. A failed save is reported and the run carries on.
     */
    private boolean saveCheckpoint(PipelineState state, String label) {
        String projectId = state.getProjectId();
        try {
            CheckpointInfo info = checkpointStore.saveState(projectId, state, label);
            publish(PipelineEventType.CHECKPOINT_SAVED, projectId, label, Map.of("checkpointId", info.id()));
            return true;
        } catch (CheckpointException e) {
            errorReporter.logError(e, "checkpoint:" + projectId, Map.of("projectId", projectId, "label", label));
            log.warn("Could not save checkpoint '{}' for project {}: {}", label, projectId, e.getMessage());
            metrics.recordCheckpointFailure(label);
            return false;
        }
    }

    private boolean hasCheckpoint(String projectId) {
        try {
            return !checkpointStore.listStates(projectId).isEmpty();
        } catch (CheckpointException e) {
            log.warn("Could not list checkpoints of project {}: {}", projectId, e.getMessage());
            return false;
        }
    }

    private String resolveProjectId(ProjectRequest request) {
        if (request.id() != null && !request.id().isBlank()) {
            return request.id();
        }
        return ProjectIds.generate(request.projectName(), clock.millis());
    }

    private void publish(PipelineEventType type, String projectId, String stage, Map<String, Object> payload) {
        eventBus.publish(new PipelineEvent(type, projectId, stage, payload, clock.instant()));
    }
}
