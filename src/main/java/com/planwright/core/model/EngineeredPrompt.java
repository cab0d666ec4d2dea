package com.planwright.core.model;

import java.io.Serializable;

/**
 * Shared planning context handed to the generative stages.
 *
 * @param projectContext project name, description, timeline, tech stack and goals as prose
 * @param teamContext    one line per team member with role and skills
 * @param constraints    constraints section, empty when none were given
 */
public record EngineeredPrompt(
    String projectContext,
    String teamContext,
    String constraints
) implements Serializable {

    public String asText() {
        StringBuilder sb = new StringBuilder(projectContext);
        if (teamContext != null && !teamContext.isBlank()) {
            sb.append("\n\n").append(teamContext);
        }
        if (constraints != null && !constraints.isBlank()) {
            sb.append("\n\n").append(constraints);
        }
        return sb.toString();
    }
}
