package com.planwright.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Common view of tasks and subtasks for scoring and scheduling.
 */
public interface WorkItem {

    String id();

    String title();

    String description();

    String category();

    double estimatedHours();

    Priority priority();

    List<String> dependencies();

    /** Sprint the item is planned in, or {@code null} when unknown. */
    Integer sprintNumber();

    String requiredRole();

    /** Lower-cased title and description, scanned for skill and criticality keywords. */
    default String searchText() {
        return ((title() == null ? "" : title()) + " "
                + (description() == null ? "" : description())).toLowerCase(Locale.ROOT);
    }
}
