package com.planwright.dispatch.cli;

import com.planwright.core.engine.PipelineResult;
import com.planwright.core.events.PipelineEvent;
import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.VerificationResult;
import com.planwright.core.state.ProcessingMetadata;
import picocli.CommandLine;

import java.time.Duration;

/**
 * ANSI-colored terminal output utilities for the Planwright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) PLANWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANWRIGHT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.type()) {
            case PROJECT_STARTED, PROJECT_RESUMED -> "@|fg(cyan) [PROJECT]|@";
            case STAGE_STARTED, STAGE_COMPLETED -> "@|fg(blue) [STAGE]|@";
            case CHECKPOINT_SAVED -> "@|fg(magenta) [CHECKPOINT]|@";
            case PROJECT_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case PROJECT_FAILED -> "@|fg(red),bold [FAILED]|@";
            case PROJECT_CANCELLED -> "@|fg(yellow),bold [CANCELLED]|@";
            case RESUME_FALLBACK -> "@|fg(yellow) [" + event.type().code() + "]|@";
        };
        String detail = event.stage() != null ? event.stage() : event.projectId();
        if (event.payload() != null && !event.payload().isEmpty()) {
            detail += " " + event.payload();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + detail));
    }

    public static void failure(PipelineResult result) {
        error("Planning failed" + (result.stageFailed() != null ? " in stage " + result.stageFailed() : "")
                + ": " + result.error());
        if (result.errorId() != null) {
            info("Error id: " + result.errorId());
        }
        if (result.resumable()) {
            info("Resume with: planwright resume " + result.projectId());
        }
    }

    public static void plan(CompiledPlan plan) {
        System.out.println();
        System.out.println("PROJECT " + plan.project().name());
        System.out.println("Timeline: " + plan.project().timeline()
                + " (" + plan.timeline().totalWeeks() + " weeks, team of " + plan.project().teamSize() + ")");

        if (!plan.sprints().isEmpty()) {
            System.out.println();
            System.out.printf("  %-4s %-24s %-9s %-10s %s%n", "#", "SPRINT", "WEEKS", "PLANNED", "CAPACITY");
            System.out.println("  " + "-".repeat(60));
            for (var s : plan.sprints()) {
                System.out.printf("  %-4d %-24s %-9s %-10s %s%n",
                        s.number(), truncate(s.name(), 24), s.startWeek() + "-" + s.endWeek(),
                        hours(s.plannedHours()), hours(s.capacityHours()));
            }
        }

        if (!plan.tasks().isEmpty()) {
            System.out.println();
            System.out.printf("  %-10s %-9s %-7s %-16s %s%n", "TASK", "PRIORITY", "HOURS", "ASSIGNEE", "TITLE");
            System.out.println("  " + "-".repeat(72));
            for (var t : plan.tasks()) {
                System.out.printf("  %-10s %-9s %-7s %-16s %s%n",
                        t.id(), t.priority(), hours(t.estimatedHours()),
                        truncate(t.assignee(), 16), truncate(t.title(), 30));
            }
        }

        if (!plan.timeline().criticalPath().isEmpty()) {
            System.out.println();
            info("Critical path: " + String.join(" -> ", plan.timeline().criticalPath()));
        }
        if (plan.resourceAllocation() != null) {
            var summary = plan.resourceAllocation();
            System.out.println();
            System.out.printf("  %-16s %-18s %-9s %-9s %s%n", "WORKER", "ROLE", "ASSIGNED", "AVAILABLE", "UTIL");
            System.out.println("  " + "-".repeat(64));
            for (var w : summary.workers()) {
                System.out.printf("  %-16s %-18s %-9s %-9s %d%%%n",
                        truncate(w.name(), 16), truncate(w.role(), 18),
                        hours(w.assignedHours()), hours(w.availableHours()), w.utilizationPercentage());
            }
            info(String.format("Workers over capacity: %d, under-used: %d",
                    summary.overallocatedWorkers(), summary.underallocatedWorkers()));
            for (var warning : summary.warnings()) {
                warn(warning.message());
            }
        }
    }

    public static void verification(VerificationResult verification) {
        if (verification.valid()) {
            success("Verification passed (" + verification.issues().size() + " warning"
                    + (verification.issues().size() != 1 ? "s" : "") + ")");
        } else {
            error("Verification found " + verification.errorCount() + " error"
                    + (verification.errorCount() != 1 ? "s" : ""));
        }
        for (var issue : verification.issues()) {
            String color = issue.severity() == VerificationResult.Severity.ERROR ? "fg(red)" : "fg(yellow)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|" + color + " " + issue.code() + "|@ " + issue.message()));
        }
    }

    public static void metadata(ProcessingMetadata metadata) {
        if (metadata == null) {
            return;
        }
        System.out.println("──────────────────────────────────");
        if (metadata.getStartTime() != null && metadata.getEndTime() != null) {
            info("Duration: " + formatDuration(
                    Duration.between(metadata.getStartTime(), metadata.getEndTime()).toMillis()));
        }
        if (metadata.getResumeCount() > 0) {
            info("Resumed " + metadata.getResumeCount() + " time" + (metadata.getResumeCount() != 1 ? "s" : ""));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }

    private static String hours(double h) {
        return h == Math.rint(h) ? String.format("%.0fh", h) : String.format("%.1fh", h);
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
