package com.planwright.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of priority assignment.
 *
 * @param tasks        task id to priority
 * @param subtasks     subtask id to priority
 * @param criticalPath task ids on the longest dependency chain, in execution order
 * @param scores       task id to the raw score the priority was derived from
 */
public record PriorityAssignments(
    Map<String, Priority> tasks,
    Map<String, Priority> subtasks,
    List<String> criticalPath,
    Map<String, Integer> scores
) implements Serializable {

    public PriorityAssignments {
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        subtasks = subtasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subtasks));
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static PriorityAssignments empty() {
        return new PriorityAssignments(Map.of(), Map.of(), List.of(), Map.of());
    }

    /** Effective priority of a work item: the assigned one, else its own, else Medium. */
    public Priority priorityOf(WorkItem item) {
        Priority assigned = item instanceof Subtask ? subtasks.get(item.id()) : tasks.get(item.id());
        if (assigned != null) {
            return assigned;
        }
        return item.priority() != null ? item.priority() : Priority.MEDIUM;
    }
}
