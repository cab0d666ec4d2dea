package com.planwright.dispatch.cli;

import com.planwright.core.engine.PipelineCoordinator;
import com.planwright.core.engine.PipelineResult;
import com.planwright.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: planwright resume &lt;project-id&gt;
 * <p>
 * Continues a stored project from its latest checkpoint.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a project from its latest checkpoint")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project ID")
    private String projectId;

    @Option(names = {"--output", "-o"}, description = "Write the plan and verification report to this JSON file")
    private Path output;

    private final PipelineCoordinator coordinator;
    private final EventBus eventBus;

    public ResumeCommand(PipelineCoordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Resuming " + projectId + "...");

        PipelineResult result;
        try (EventBus.Subscription progress = eventBus.subscribeToRun(projectId, ConsoleOutput::event)) {
            result = coordinator.resumeProject(projectId);
        }
        return PlanResults.report(result, output);
    }
}
