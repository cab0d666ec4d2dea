package com.planwright.dispatch.cli;

import com.planwright.core.persistence.CheckpointInfo;
import com.planwright.core.persistence.CheckpointQueryService;
import com.planwright.core.state.PipelineState;
import com.planwright.core.state.PipelineStatus;
import com.planwright.core.state.ProcessingMetadata;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: planwright status &lt;project-id&gt;
 * <p>
 * Shows the latest checkpointed state of a project: status, progress through
 * the stages, logged errors and the saved checkpoints.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Check project status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    private final CheckpointQueryService queryService;

    public StatusCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var stateOpt = queryService.getLatestState(projectId);
        if (stateOpt.isEmpty()) {
            ConsoleOutput.error("Project not found: " + projectId);
            return;
        }

        PipelineState state = stateOpt.get();
        ProcessingMetadata metadata = state.getMetadata();

        System.out.println();
        System.out.println("PROJECT " + state.getProjectId());

        PipelineStatus status = state.getStatus();
        if (status == PipelineStatus.COMPLETED) {
            ConsoleOutput.success("Status: " + status);
        } else if (status == PipelineStatus.FAILED) {
            ConsoleOutput.error("Status: " + status);
        } else {
            ConsoleOutput.info("Status: " + status);
        }
        ConsoleOutput.info("Last stage completed: "
                + (metadata.getLastStageCompleted() != null ? metadata.getLastStageCompleted() : "-"));
        if (metadata.getResumeCount() > 0) {
            ConsoleOutput.info("Resumed: " + metadata.getResumeCount());
        }
        if (status == PipelineStatus.FAILED) {
            ConsoleOutput.info(queryService.hasResumableState(projectId)
                    ? "Resumable: planwright resume " + projectId
                    : "Not resumable");
        }

        var timings = metadata.getStageTimings();
        if (!timings.isEmpty()) {
            System.out.println();
            System.out.printf("  %-22s %s%n", "STAGE", "DURATION");
            System.out.println("  " + "-".repeat(36));
            timings.forEach((stage, timing) ->
                    System.out.printf("  %-22s %dms%n", stage, timing.durationMs()));
        }

        List<CheckpointInfo> checkpoints = queryService.listSavedStates(projectId);
        if (!checkpoints.isEmpty()) {
            System.out.println();
            System.out.printf("  %-26s %-24s %s%n", "CHECKPOINT", "LABEL", "SAVED");
            System.out.println("  " + "-".repeat(76));
            for (var cp : checkpoints) {
                System.out.printf("  %-26s %-24s %s%n",
                        ConsoleOutput.truncate(cp.id(), 26), cp.stageName(), cp.timestamp());
            }
        }

        var errors = state.getErrorLog();
        if (!errors.isEmpty()) {
            System.out.println();
            ConsoleOutput.error("Errors (" + errors.size() + "):");
            for (var e : errors) {
                ConsoleOutput.error("  [" + e.stage() + "] " + e.message() + " (" + e.errorId() + ")");
            }
        }
    }
}
