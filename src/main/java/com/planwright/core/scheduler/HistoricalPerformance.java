package com.planwright.core.scheduler;

import java.util.List;

/**
 * Summary of a member's rated project history.
 *
 * @param averageRating     mean performance rating, 1 to 5
 * @param completedProjects projects whose end date has passed
 * @param totalProjects     all projects in the history
 * @param recentProjects    names of up to three most recently started projects
 */
public record HistoricalPerformance(
    double averageRating,
    int completedProjects,
    int totalProjects,
    List<String> recentProjects
) {

    public HistoricalPerformance {
        recentProjects = recentProjects == null ? List.of() : List.copyOf(recentProjects);
    }
}
