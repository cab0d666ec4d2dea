package com.planwright.core.scheduler;

import java.util.List;
import java.util.Optional;

/**
 * Scheduling view of a team member: declared or role-inferred skills plus the
 * member's top specialties.
 */
public record WorkerProfile(
    String id,
    String name,
    String role,
    List<SkillProfile> skills,
    List<String> specialties
) {

    public WorkerProfile {
        skills = skills == null ? List.of() : List.copyOf(skills);
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
    }

    public Optional<SkillProfile> skill(String skillName) {
        return skills.stream()
                .filter(s -> s.name().equalsIgnoreCase(skillName))
                .findFirst();
    }
}
