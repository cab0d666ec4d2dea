package com.planwright.core.model;

import java.io.Serializable;

/**
 * Non-fatal scheduling problem surfaced in the workload summary.
 *
 * @param itemId   the task or subtask concerned (nullable for team-level warnings)
 * @param itemType "task", "subtask" or "team"
 * @param message  description of the problem
 */
public record SchedulingWarning(
    String itemId,
    String itemType,
    String message
) implements Serializable {}
