package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Raw project data supplied by the caller. Stored unchanged in the seed slot of
 * the pipeline state so the first stage can be re-run on resume.
 *
 * @param id                 optional caller-supplied project id; reused for checkpoints when present
 * @param projectName        required project name
 * @param projectDescription free-text description
 * @param projectTimeline    duration such as "3 months" or "12 weeks"
 * @param techStack          technologies the project will use
 * @param teamMembers        the people available to the project
 * @param goals              business or delivery goals
 * @param constraints        known constraints (budget, deadlines, compliance)
 */
public record ProjectRequest(
    String id,
    String projectName,
    String projectDescription,
    String projectTimeline,
    List<String> techStack,
    List<TeamMember> teamMembers,
    List<String> goals,
    List<String> constraints
) implements Serializable {

    public ProjectRequest withId(String newId) {
        return new ProjectRequest(newId, projectName, projectDescription, projectTimeline,
                techStack, teamMembers, goals, constraints);
    }
}
