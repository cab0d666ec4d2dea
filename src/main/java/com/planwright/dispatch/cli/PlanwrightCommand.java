package com.planwright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to plan, resume, status and history.
 */
@Command(
        name = "planwright",
        mixinStandardHelpOptions = true,
        version = "Planwright 0.1.0",
        description = "Resumable project planning: sprints, tasks, priorities and staffing from a project file",
        subcommands = {
                PlanCommand.class,
                ResumeCommand.class,
                StatusCommand.class,
                HistoryCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlanwrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
