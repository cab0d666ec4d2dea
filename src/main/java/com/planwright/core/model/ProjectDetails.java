package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Validated and normalised project data produced by the initialisation stage.
 */
public record ProjectDetails(
    String projectName,
    String description,
    ProjectTimeline timeline,
    List<String> techStack,
    List<TeamMember> teamMembers,
    List<String> goals,
    List<String> constraints
) implements Serializable {

    public ProjectDetails {
        techStack = techStack == null ? List.of() : List.copyOf(techStack);
        teamMembers = teamMembers == null ? List.of() : List.copyOf(teamMembers);
        goals = goals == null ? List.of() : List.copyOf(goals);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
    }
}
