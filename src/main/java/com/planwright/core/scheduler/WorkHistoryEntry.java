package com.planwright.core.scheduler;

import java.time.Instant;
import java.util.List;

/**
 * A change in a worker's load made during this scheduling run.
 *
 * @param itemId    task or subtask id
 * @param title     item title
 * @param action    "assigned" or "reassigned"
 * @param hours     hours added to or removed from the worker
 * @param skills    skills the item calls for
 * @param timestamp when the change was made
 */
public record WorkHistoryEntry(
    String itemId,
    String title,
    String action,
    double hours,
    List<String> skills,
    Instant timestamp
) {

    public WorkHistoryEntry {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
