package com.planwright.core.stages;

import com.planwright.core.model.Priority;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives task priorities from the dependency graph.
 * <p>
 * A task scores 100 when it lies on the critical path (the chain of
 * dependencies with the most estimated hours), 10 per task that depends on
 * it, and {@code (10 - min(sprint, 10)) * 5} for early sprints. Scores of 100
 * and above are Critical, 70 High, 40 Medium and anything lower Low.
 * Subtasks take their parent's priority, one level higher when they depend on
 * other subtasks. Dependency cycles are tolerated: edges closing a cycle are
 * ignored when measuring paths.
 */
@Component
public class PriorityAssignmentStage {

    public static final String NAME = "priorityAssignment";

    private static final Logger log = LoggerFactory.getLogger(PriorityAssignmentStage.class);

    /** Inputs of priority assignment. */
    public record Input(List<Task> tasks, List<Subtask> subtasks) {}

    private record Graph(Map<String, List<String>> dependsOn, Map<String, List<String>> dependents) {}

    public PriorityAssignments apply(Input input) {
        List<Task> tasks = input.tasks();
        if (tasks.isEmpty()) {
            return PriorityAssignments.empty();
        }
        Graph graph = buildGraph(tasks);
        List<String> criticalPath = criticalPath(tasks, graph);
        Set<String> onPath = new HashSet<>(criticalPath);

        Map<String, Priority> taskPriorities = new LinkedHashMap<>();
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (Task task : tasks) {
            int score = 0;
            if (onPath.contains(task.id())) {
                score += 100;
            }
            score += graph.dependents().get(task.id()).size() * 10;
            if (task.sprintNumber() != null && task.sprintNumber() > 0) {
                score += (10 - Math.min(task.sprintNumber(), 10)) * 5;
            }
            scores.put(task.id(), score);
            taskPriorities.put(task.id(), fromScore(score));
        }

        Map<String, Priority> subtaskPriorities = new LinkedHashMap<>();
        for (Subtask subtask : input.subtasks()) {
            Priority priority = taskPriorities.getOrDefault(subtask.parentTaskId(), Priority.MEDIUM);
            if (!subtask.dependencies().isEmpty()) {
                priority = raise(priority);
            }
            subtaskPriorities.put(subtask.id(), priority);
        }

        log.info("Priorities assigned: critical path {} ({} task(s))", criticalPath, criticalPath.size());
        return new PriorityAssignments(taskPriorities, subtaskPriorities, criticalPath, scores);
    }

    static Priority fromScore(int score) {
        if (score >= 100) {
            return Priority.CRITICAL;
        }
        if (score >= 70) {
            return Priority.HIGH;
        }
        if (score >= 40) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    static Priority raise(Priority priority) {
        return switch (priority) {
            case LOW -> Priority.MEDIUM;
            case MEDIUM -> Priority.HIGH;
            case HIGH, CRITICAL -> Priority.CRITICAL;
        };
    }

    private static Graph buildGraph(List<Task> tasks) {
        Map<String, List<String>> dependsOn = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (Task task : tasks) {
            dependsOn.put(task.id(), new ArrayList<>());
            dependents.put(task.id(), new ArrayList<>());
        }
        for (Task task : tasks) {
            for (String dep : task.dependencies()) {
                if (dependsOn.containsKey(dep)) {
                    dependsOn.get(task.id()).add(dep);
                    dependents.get(dep).add(task.id());
                }
            }
        }
        return new Graph(dependsOn, dependents);
    }

    /**
     * Heaviest chain from a task with no dependencies to a task nothing depends on,
     * in execution order. Empty when every chain weighs zero hours.
     */
    private static List<String> criticalPath(List<Task> tasks, Graph graph) {
        Map<String, Double> hours = new HashMap<>();
        tasks.forEach(t -> hours.put(t.id(), t.estimatedHours()));
        Map<String, Double> best = new HashMap<>();
        Map<String, String> previous = new HashMap<>();
        Set<String> visiting = new HashSet<>();

        for (Task task : tasks) {
            longestEndingAt(task.id(), graph, hours, best, previous, visiting);
        }

        String end = null;
        double max = 0;
        for (Task task : tasks) {
            if (!graph.dependents().get(task.id()).isEmpty()) {
                continue;
            }
            double length = best.get(task.id());
            if (length > max) {
                max = length;
                end = task.id();
            }
        }
        if (end == null) {
            return List.of();
        }
        List<String> path = new ArrayList<>();
        for (String id = end; id != null; id = previous.get(id)) {
            path.add(id);
        }
        Collections.reverse(path);
        return path;
    }

    private static double longestEndingAt(String id, Graph graph, Map<String, Double> hours,
                                          Map<String, Double> best, Map<String, String> previous,
                                          Set<String> visiting) {
        Double known = best.get(id);
        if (known != null) {
            return known;
        }
        visiting.add(id);
        List<String> deps = graph.dependsOn().get(id);
        double result;
        if (deps.isEmpty()) {
            result = hours.get(id);
        } else {
            double longest = Double.NEGATIVE_INFINITY;
            String via = null;
            for (String dep : deps) {
                if (visiting.contains(dep)) {
                    continue;
                }
                double length = longestEndingAt(dep, graph, hours, best, previous, visiting);
                if (length > longest) {
                    longest = length;
                    via = dep;
                }
            }
            result = via == null ? Double.NEGATIVE_INFINITY : longest + hours.get(id);
            if (via != null) {
                previous.put(id, via);
            }
        }
        visiting.remove(id);
        best.put(id, result);
        return result;
    }
}
