package com.planwright.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the resource-assignment scheduler.
 *
 * @param tasks             task id to assignee name
 * @param subtasks          subtask id to assignee name
 * @param workloadSummary   per-worker utilisation and warnings
 * @param unassignedTasks   task ids no worker could take
 * @param unassignedSubtasks subtask ids no worker could take
 * @param reassignments     moves made while rebalancing
 */
public record WorkerAssignments(
    Map<String, String> tasks,
    Map<String, String> subtasks,
    WorkloadSummary workloadSummary,
    List<String> unassignedTasks,
    List<String> unassignedSubtasks,
    List<Reassignment> reassignments
) implements Serializable {

    public WorkerAssignments {
        tasks = tasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
        subtasks = subtasks == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(subtasks));
        unassignedTasks = unassignedTasks == null ? List.of() : List.copyOf(unassignedTasks);
        unassignedSubtasks = unassignedSubtasks == null ? List.of() : List.copyOf(unassignedSubtasks);
        reassignments = reassignments == null ? List.of() : List.copyOf(reassignments);
    }
}
