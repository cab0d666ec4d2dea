package com.planwright.core.stages;

import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.CompiledPlan.SprintView;
import com.planwright.core.model.CompiledPlan.SubtaskView;
import com.planwright.core.model.CompiledPlan.TaskView;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.VerificationResult;
import com.planwright.core.model.VerificationResult.Issue;
import com.planwright.core.model.VerificationResult.Severity;
import com.planwright.core.model.WorkerStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the compiled plan for internal consistency.
 * <p>
 * Errors: no sprints, no tasks, dependencies on unknown items, dependency
 * cycles, subtasks without a parent. Warnings: unassigned items, tasks
 * referencing a sprint that does not exist, overlapping sprints, sprints
 * planned beyond capacity, over-allocated workers, no identified risks.
 * The plan is valid when there are no errors.
 */
@Component
public class VerificationStage {

    public static final String NAME = "verification";

    private static final Logger log = LoggerFactory.getLogger(VerificationStage.class);

    /** The plan to check plus the raw subtasks, so orphans dropped from the plan are still seen. */
    public record Input(CompiledPlan plan, List<Subtask> subtasks) {}

    public VerificationResult apply(Input input) {
        CompiledPlan plan = input.plan();
        List<Issue> issues = new ArrayList<>();

        checkSprints(plan, issues);
        checkTasks(plan, issues);
        checkOrphans(plan, input.subtasks(), issues);
        checkCycles(plan, issues);
        checkAllocation(plan, issues);
        if (plan.risks().isEmpty()) {
            issues.add(warning("NO_RISKS", "No project risks were identified", null));
        }

        int subtaskCount = plan.tasks().stream().mapToInt(t -> t.subtasks().size()).sum();
        double totalHours = plan.tasks().stream().mapToDouble(TaskView::estimatedHours).sum();
        boolean valid = issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        VerificationResult result = new VerificationResult(valid, issues, plan.tasks().size(), subtaskCount, totalHours);
        if (valid) {
            log.info("Plan verified: {} warning(s)", issues.size());
        } else {
            log.warn("Plan verification found {} error(s) and {} warning(s)",
                    result.errorCount(), issues.size() - result.errorCount());
        }
        return result;
    }

    private static void checkSprints(CompiledPlan plan, List<Issue> issues) {
        if (plan.sprints().isEmpty()) {
            issues.add(error("NO_SPRINTS", "The plan has no sprints", null));
            return;
        }
        SprintView previous = null;
        for (SprintView sprint : plan.sprints()) {
            if (previous != null && sprint.startWeek() <= previous.endWeek()) {
                issues.add(warning("SPRINT_OVERLAP", "Sprint " + sprint.number() + " starts in week "
                        + sprint.startWeek() + " before sprint " + previous.number() + " ends", null));
            }
            if (sprint.capacityHours() > 0 && sprint.plannedHours() > sprint.capacityHours()) {
                issues.add(warning("SPRINT_OVER_CAPACITY", String.format(
                        "Sprint %d plans %.1f h against a capacity of %.1f h",
                        sprint.number(), sprint.plannedHours(), sprint.capacityHours()), null));
            }
            previous = sprint;
        }
    }

    private static void checkTasks(CompiledPlan plan, List<Issue> issues) {
        if (plan.tasks().isEmpty()) {
            issues.add(error("NO_TASKS", "The plan has no tasks", null));
            return;
        }
        Set<Integer> sprintNumbers = new HashSet<>();
        plan.sprints().forEach(s -> sprintNumbers.add(s.number()));
        Set<String> taskIds = new HashSet<>();
        plan.tasks().forEach(t -> taskIds.add(t.id()));

        for (TaskView task : plan.tasks()) {
            for (String dep : task.dependencies()) {
                if (!taskIds.contains(dep)) {
                    issues.add(error("UNKNOWN_DEPENDENCY",
                            "Task " + task.id() + " depends on unknown task " + dep, task.id()));
                }
            }
            if (task.sprintNumber() != null && !sprintNumbers.contains(task.sprintNumber())) {
                issues.add(warning("UNKNOWN_SPRINT",
                        "Task " + task.id() + " references missing sprint " + task.sprintNumber(), task.id()));
            }
            if (task.assignee() == null) {
                issues.add(warning("UNASSIGNED", "Task " + task.id() + " has no assignee", task.id()));
            }
            Set<String> siblings = new HashSet<>();
            task.subtasks().forEach(s -> siblings.add(s.id()));
            for (SubtaskView subtask : task.subtasks()) {
                for (String dep : subtask.dependencies()) {
                    if (!siblings.contains(dep)) {
                        issues.add(error("UNKNOWN_DEPENDENCY",
                                "Subtask " + subtask.id() + " depends on unknown subtask " + dep, subtask.id()));
                    }
                }
                if (subtask.assignee() == null) {
                    issues.add(warning("UNASSIGNED", "Subtask " + subtask.id() + " has no assignee", subtask.id()));
                }
            }
        }
    }

    private static void checkOrphans(CompiledPlan plan, List<Subtask> subtasks, List<Issue> issues) {
        Set<String> taskIds = new HashSet<>();
        plan.tasks().forEach(t -> taskIds.add(t.id()));
        for (Subtask subtask : subtasks) {
            if (!taskIds.contains(subtask.parentTaskId())) {
                issues.add(error("ORPHAN_SUBTASK", "Subtask " + subtask.id()
                        + " belongs to unknown task " + subtask.parentTaskId(), subtask.id()));
            }
        }
    }

    private static void checkCycles(CompiledPlan plan, List<Issue> issues) {
        Map<String, List<String>> edges = new HashMap<>();
        plan.tasks().forEach(t -> edges.put(t.id(), t.dependencies()));
        Set<String> done = new HashSet<>();
        for (TaskView task : plan.tasks()) {
            if (hasCycle(task.id(), edges, new HashSet<>(), done)) {
                issues.add(error("DEPENDENCY_CYCLE",
                        "Dependency chain of task " + task.id() + " contains a cycle", task.id()));
            }
        }
    }

    private static boolean hasCycle(String id, Map<String, List<String>> edges, Set<String> path, Set<String> done) {
        if (path.contains(id)) {
            return true;
        }
        if (done.contains(id) || !edges.containsKey(id)) {
            return false;
        }
        path.add(id);
        for (String dep : edges.get(id)) {
            if (hasCycle(dep, edges, path, done)) {
                path.remove(id);
                return true;
            }
        }
        path.remove(id);
        done.add(id);
        return false;
    }

    private static void checkAllocation(CompiledPlan plan, List<Issue> issues) {
        if (plan.resourceAllocation() == null) {
            return;
        }
        for (WorkerStats worker : plan.resourceAllocation().workers()) {
            if (worker.overallocated()) {
                issues.add(warning("OVERALLOCATED_WORKER", worker.name() + " is at "
                        + worker.utilizationPercentage() + "% of available hours", worker.workerId()));
            }
        }
    }

    private static Issue error(String code, String message, String itemId) {
        return new Issue(Severity.ERROR, code, message, itemId);
    }

    private static Issue warning(String code, String message, String itemId) {
        return new Issue(Severity.WARNING, code, message, itemId);
    }
}
