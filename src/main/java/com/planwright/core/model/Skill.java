package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A skill held by a team member. Project files may list a skill as a bare
 * string ({@code "Java"}) or as an object with proficiency details.
 *
 * @param name     skill name, e.g. "Java" or "CI/CD"
 * @param level    proficiency label such as Beginner, Medium, High or Expert (nullable)
 * @param count    how many times the skill has been applied (nullable)
 * @param projects names of projects where the skill was applied
 */
public record Skill(
    @JsonProperty("name") String name,
    @JsonProperty("level") @JsonAlias("proficiency") String level,
    @JsonProperty("count") Integer count,
    @JsonProperty("projects") List<String> projects
) implements Serializable {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Skill {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Skill named(String name) {
        return new Skill(name, null, null, List.of());
    }

    public Skill withLevel(String newLevel) {
        return new Skill(name, newLevel, count, projects);
    }
}
