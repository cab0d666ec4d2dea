package com.planwright.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments and
 * hands them to the matching subcommand.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PlanwrightCommand planwrightCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(PlanwrightCommand planwrightCommand, IFactory factory) {
        this.planwrightCommand = planwrightCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(planwrightCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
