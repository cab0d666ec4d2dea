package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A person who can be assigned work.
 *
 * @param id           stable identifier; generated during project initialisation when absent
 * @param name         display name, used as the assignee label in plans
 * @param role         job role, e.g. "Backend Developer"
 * @param skills       declared skills; may be empty, in which case skills are inferred from the role
 * @param availability working-time model (nullable, meaning a full 40 hour week)
 */
public record TeamMember(
    String id,
    String name,
    String role,
    List<Skill> skills,
    Availability availability
) implements Serializable {

    public TeamMember {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public TeamMember withId(String newId) {
        return new TeamMember(newId, name, role, skills, availability);
    }

    public String label() {
        return name != null && !name.isBlank() ? name : id;
    }
}
