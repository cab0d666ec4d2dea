package com.planwright.core.scheduler;

import java.util.List;

/**
 * A member skill with its proficiency turned into a score.
 *
 * @param name             skill name as declared
 * @param level            proficiency label, "Medium" when none was given
 * @param proficiencyScore score in [0, 1]
 * @param count            times the skill has been applied
 * @param projects         projects where the skill was applied
 */
public record SkillProfile(
    String name,
    String level,
    double proficiencyScore,
    int count,
    List<String> projects
) {

    public SkillProfile {
        projects = projects == null ? List.of() : List.copyOf(projects);
    }
}
