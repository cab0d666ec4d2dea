package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A move made by workload rebalancing.
 *
 * @param itemId           the task or subtask moved
 * @param itemType         "task" or "subtask"
 * @param fromWorkerId     previous assignee
 * @param toWorkerId       new assignee
 * @param hours            hours moved, including cascaded subtasks
 * @param score            candidate score that selected the new assignee
 * @param cascadedSubtasks subtasks that moved with a task
 */
public record Reassignment(
    String itemId,
    String itemType,
    String fromWorkerId,
    String toWorkerId,
    double hours,
    double score,
    List<String> cascadedSubtasks
) implements Serializable {

    public Reassignment {
        cascadedSubtasks = cascadedSubtasks == null ? List.of() : List.copyOf(cascadedSubtasks);
    }
}
