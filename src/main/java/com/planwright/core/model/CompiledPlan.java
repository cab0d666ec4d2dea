package com.planwright.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * The assembled project plan: the final artefact of a pipeline run.
 */
public record CompiledPlan(
    ProjectSummary project,
    ProjectOverview overview,
    List<SprintView> sprints,
    List<TaskView> tasks,
    List<Risk> risks,
    Timeline timeline,
    WorkloadSummary resourceAllocation,
    PlanMetadata metadata
) implements Serializable {

    public CompiledPlan {
        sprints = sprints == null ? List.of() : List.copyOf(sprints);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        risks = risks == null ? List.of() : List.copyOf(risks);
    }

    public record ProjectSummary(
        String name,
        String description,
        String timeline,
        int durationInDays,
        List<String> techStack,
        int teamSize,
        List<String> goals
    ) implements Serializable {}

    /**
     * @param plannedHours sum of estimated hours of the sprint's tasks
     * @param capacityHours team capacity for the sprint
     */
    public record SprintView(
        int number,
        String name,
        String goal,
        int startWeek,
        int endWeek,
        List<String> taskIds,
        double plannedHours,
        double capacityHours
    ) implements Serializable {}

    public record TaskView(
        String id,
        String title,
        String description,
        String category,
        double estimatedHours,
        Priority priority,
        String assignee,
        Integer sprintNumber,
        List<String> dependencies,
        boolean onCriticalPath,
        List<SubtaskView> subtasks
    ) implements Serializable {}

    public record SubtaskView(
        String id,
        String title,
        double estimatedHours,
        Priority priority,
        String assignee,
        List<String> dependencies
    ) implements Serializable {}

    public record Timeline(
        int totalWeeks,
        List<String> criticalPath,
        List<Milestone> milestones
    ) implements Serializable {}

    public record Milestone(
        String name,
        int week,
        int sprintNumber
    ) implements Serializable {}

    public record PlanMetadata(
        Instant generatedAt,
        String generator,
        int taskCount,
        int subtaskCount,
        double totalEstimatedHours
    ) implements Serializable {}
}
