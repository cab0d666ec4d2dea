package com.planwright.core.stages;

import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.CompiledPlan.Milestone;
import com.planwright.core.model.CompiledPlan.PlanMetadata;
import com.planwright.core.model.CompiledPlan.ProjectSummary;
import com.planwright.core.model.CompiledPlan.SprintView;
import com.planwright.core.model.CompiledPlan.SubtaskView;
import com.planwright.core.model.CompiledPlan.TaskView;
import com.planwright.core.model.CompiledPlan.Timeline;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.ResourceAnalysis;
import com.planwright.core.model.ResourceAnalysis.SprintCapacity;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import com.planwright.core.model.WorkerAssignments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles the outputs of all earlier stages into the final {@link CompiledPlan}.
 */
@Component
public class DataCompilationStage {

    public static final String NAME = "dataCompilation";
    static final String GENERATOR = "planwright";

    private static final Logger log = LoggerFactory.getLogger(DataCompilationStage.class);

    /** Everything the compiled plan is built from. */
    public record Input(
        ProjectDetails details,
        ProjectOverview overview,
        SprintPlan sprintPlan,
        ResourceAnalysis resourceAnalysis,
        List<Task> tasks,
        List<Subtask> subtasks,
        PriorityAssignments priorities,
        WorkerAssignments assignments
    ) {}

    private final Clock clock;

    public DataCompilationStage(Clock clock) {
        this.clock = clock;
    }

    public CompiledPlan apply(Input input) {
        ProjectDetails details = input.details();
        PriorityAssignments priorities = input.priorities();
        WorkerAssignments assignments = input.assignments();
        Set<String> onPath = new HashSet<>(priorities.criticalPath());

        Map<String, List<Subtask>> subtasksByParent = input.subtasks().stream()
                .collect(Collectors.groupingBy(Subtask::parentTaskId));

        List<TaskView> taskViews = new ArrayList<>();
        for (Task task : input.tasks()) {
            List<SubtaskView> subtaskViews = subtasksByParent.getOrDefault(task.id(), List.of()).stream()
                    .map(s -> new SubtaskView(s.id(), s.title(), s.estimatedHours(), priorities.priorityOf(s),
                            assignments.subtasks().get(s.id()), s.dependencies()))
                    .toList();
            taskViews.add(new TaskView(task.id(), task.title(), task.description(), task.category(),
                    task.estimatedHours(), priorities.priorityOf(task), assignments.tasks().get(task.id()),
                    task.sprintNumber(), task.dependencies(), onPath.contains(task.id()), subtaskViews));
        }

        Map<Integer, Double> capacity = input.resourceAnalysis().sprintCapacities().stream()
                .collect(Collectors.toMap(SprintCapacity::sprintNumber, SprintCapacity::capacityHours, (a, b) -> a));
        List<SprintView> sprintViews = new ArrayList<>();
        List<Milestone> milestones = new ArrayList<>();
        for (Sprint sprint : input.sprintPlan().sprints()) {
            List<Task> inSprint = input.tasks().stream()
                    .filter(t -> Objects.equals(t.sprintNumber(), sprint.number()))
                    .toList();
            sprintViews.add(new SprintView(sprint.number(), sprint.name(), sprint.goal(),
                    sprint.startWeek(), sprint.endWeek(),
                    inSprint.stream().map(Task::id).toList(),
                    inSprint.stream().mapToDouble(Task::estimatedHours).sum(),
                    capacity.getOrDefault(sprint.number(), 0.0)));
            milestones.add(new Milestone(sprint.name() + " complete", sprint.endWeek(), sprint.number()));
        }

        int totalWeeks = Math.max(details.timeline().weeks(),
                input.sprintPlan().sprints().stream().mapToInt(Sprint::endWeek).max().orElse(0));
        double totalHours = input.tasks().stream().mapToDouble(Task::estimatedHours).sum();

        CompiledPlan plan = new CompiledPlan(
                new ProjectSummary(details.projectName(), details.description(), details.timeline().original(),
                        details.timeline().durationInDays(), details.techStack(), details.teamMembers().size(),
                        details.goals()),
                input.overview(),
                sprintViews,
                taskViews,
                input.overview().risks(),
                new Timeline(totalWeeks, priorities.criticalPath(), milestones),
                assignments.workloadSummary(),
                new PlanMetadata(clock.instant(), GENERATOR, input.tasks().size(), input.subtasks().size(),
                        totalHours));
        log.info("Compiled plan '{}': {} sprint(s), {} task(s), {} subtask(s)", details.projectName(),
                sprintViews.size(), taskViews.size(), input.subtasks().size());
        return plan;
    }
}
