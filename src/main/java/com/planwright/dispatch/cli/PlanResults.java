package com.planwright.dispatch.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.planwright.core.engine.PipelineResult;
import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.VerificationResult;
import com.planwright.core.state.PlanJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared rendering of a pipeline outcome for the plan and resume commands.
 */
final class PlanResults {

    private PlanResults() {
    }

    /**
     * Prints the result and, on success, writes the plan file when one was requested.
     *
     * @return the process exit code: 0 on success, 1 when planning failed, 2 when the output could not be written
     */
    static int report(PipelineResult result, Path output) {
        if (!result.success()) {
            ConsoleOutput.failure(result);
            ConsoleOutput.metadata(result.processingMetadata());
            return 1;
        }

        ConsoleOutput.success("Project " + result.projectId() + " planned");
        result.planAs(CompiledPlan.class).ifPresent(ConsoleOutput::plan);
        System.out.println();
        result.verificationAs(VerificationResult.class).ifPresent(ConsoleOutput::verification);
        ConsoleOutput.metadata(result.processingMetadata());

        if (output != null) {
            try {
                write(result, output);
            } catch (IOException e) {
                ConsoleOutput.error("Could not write " + output + ": " + e.getMessage());
                return 2;
            }
            ConsoleOutput.info("Plan written to " + output);
        }
        return 0;
    }

    static void write(PipelineResult result, Path output) throws IOException {
        ObjectNode root = PlanJson.mapper().createObjectNode();
        root.put("projectId", result.projectId());
        root.set("plan", result.plan());
        root.set("verification", result.verification());
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        PlanJson.mapper().writerWithDefaultPrettyPrinter().writeValue(output.toFile(), root);
    }
}
