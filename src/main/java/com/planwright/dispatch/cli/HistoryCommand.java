package com.planwright.dispatch.cli;

import com.planwright.core.persistence.CheckpointQueryService;
import com.planwright.core.state.PipelineState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: planwright history
 * <p>
 * Lists every project with checkpoints as a table of
 * project id, status and last completed stage.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List planned projects")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final CheckpointQueryService queryService;

    public HistoryCommand(CheckpointQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> projectIds = queryService.listAllProjectIds();
        if (projectIds.isEmpty()) {
            ConsoleOutput.info("No projects found.");
            return;
        }

        List<String> display = projectIds.size() > limit
                ? projectIds.subList(projectIds.size() - limit, projectIds.size())
                : projectIds;

        ConsoleOutput.info("Projects (" + display.size() + " of " + projectIds.size() + "):");
        System.out.println();
        System.out.printf("  %-36s %-12s %-22s %s%n", "PROJECT ID", "STATUS", "LAST STAGE", "RESUMES");
        System.out.println("  " + "-".repeat(80));

        for (String projectId : display) {
            var stateOpt = queryService.getLatestState(projectId);
            if (stateOpt.isPresent()) {
                PipelineState state = stateOpt.get();
                String lastStage = state.getMetadata().getLastStageCompleted();
                System.out.printf("  %-36s %-12s %-22s %d%n", projectId, state.getStatus(),
                        lastStage != null ? lastStage : "-", state.getMetadata().getResumeCount());
            } else {
                System.out.printf("  %-36s %-12s %-22s %s%n", projectId, "UNKNOWN", "-", "-");
            }
        }
    }
}
