package com.planwright.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Capacity picture of the team against the sprint plan.
 *
 * @param weeklyCapacityHours total effective weekly hours of the team
 * @param sprintCapacities    capacity per sprint
 * @param roleCoverage        role name to number of members holding it
 * @param skillGaps           tech-stack entries that no team member covers
 * @param feasible            false when the team has no capacity at all
 * @param warnings            human-readable observations
 */
public record ResourceAnalysis(
    double weeklyCapacityHours,
    List<SprintCapacity> sprintCapacities,
    Map<String, Integer> roleCoverage,
    List<String> skillGaps,
    boolean feasible,
    List<String> warnings
) implements Serializable {

    public ResourceAnalysis {
        sprintCapacities = sprintCapacities == null ? List.of() : List.copyOf(sprintCapacities);
        roleCoverage = roleCoverage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(roleCoverage));
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public record SprintCapacity(int sprintNumber, double capacityHours) implements Serializable {}
}
