package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param sprintLengthWeeks nominal sprint length in weeks
 * @param sprints           sprints ordered by number, numbered 1..n
 */
public record SprintPlan(
    int sprintLengthWeeks,
    List<Sprint> sprints
) implements Serializable {

    public SprintPlan {
        sprints = sprints == null ? List.of() : List.copyOf(sprints);
    }
}
