package com.planwright.dispatch.cli;

import com.planwright.core.engine.PipelineCoordinator;
import com.planwright.core.engine.PipelineResult;
import com.planwright.core.engine.ProjectIds;
import com.planwright.core.engine.RunOptions;
import com.planwright.core.events.EventBus;
import com.planwright.core.model.ProjectRequest;
import com.planwright.core.state.PlanJson;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright plan &lt;project-file&gt;
 * <p>
 * Reads a project description from JSON and runs it through the planning
 * pipeline. A project that already has checkpoints continues where it stopped
 * unless {@code --no-resume} is given. Without an explicit id the project id
 * comes from the project name and the file's modification time, so planning an
 * unchanged file again picks up the interrupted run.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan a project from a JSON project file")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project file (JSON)")
    private Path projectFile;

    @Option(names = {"--project-id", "-p"}, description = {
            "Project id used for checkpoints (overrides the file's id).",
            "Defaults to an id derived from the project name and the file's modification time,"
                    + " so re-running an unchanged file resumes it."})
    private String projectId;

    @Option(names = "--no-resume", description = "Ignore existing checkpoints and plan from the first stage")
    private boolean noResume;

    @Option(names = {"--output", "-o"}, description = "Write the plan and verification report to this JSON file")
    private Path output;

    @Option(names = {"--quiet", "-q"}, description = "Do not print stage progress")
    private boolean quiet;

    private final PipelineCoordinator coordinator;
    private final EventBus eventBus;

    public PlanCommand(PipelineCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ProjectRequest request;
        try {
            request = PlanJson.mapper().readValue(projectFile.toFile(), ProjectRequest.class);
            if (projectId != null && !projectId.isBlank()) {
                request = request.withId(projectId);
            } else if (request.id() == null || request.id().isBlank()) {
                long modified = Files.getLastModifiedTime(projectFile).toMillis();
                request = request.withId(ProjectIds.generate(request.projectName(), modified));
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read project file " + projectFile + ": " + e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Planning " + request.projectName() + " as " + request.id() + "...");
        PipelineResult result;
        try (EventBus.Subscription progress = quiet ? null
                : eventBus.subscribeToRun(request.id(), ConsoleOutput::event)) {
            result = coordinator.processProject(request, noResume ? RunOptions.fresh() : RunOptions.defaults());
        }
        return PlanResults.report(result, output);
    }
}
