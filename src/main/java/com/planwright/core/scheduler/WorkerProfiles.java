package com.planwright.core.scheduler;

import com.planwright.core.model.Skill;
import com.planwright.core.model.TeamMember;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link WorkerProfile}s from team members.
 * <p>
 * Members without declared skills get a skill set inferred from their role.
 * Skills without a proficiency label count as "Medium".
 */
public final class WorkerProfiles {

    static final String DEFAULT_LEVEL = "Medium";
    static final double DEFAULT_SCORE = 0.7;
    private static final int SPECIALTY_COUNT = 3;

    private static final Map<String, Double> LEVEL_SCORES = Map.of(
            "beginner", 0.3,
            "low", 0.4,
            "medium", 0.7,
            "intermediate", 0.7,
            "high", 0.9,
            "expert", 1.0
    );

    private static final Map<String, List<String>> ROLE_SKILLS = Map.of(
            "project manager", List.of("Planning", "Coordination", "Documentation", "Risk Management"),
            "frontend developer", List.of("JavaScript", "HTML", "CSS", "React", "UI/UX"),
            "backend developer", List.of("Node.js", "Database", "API", "Server Architecture"),
            "full stack developer", List.of("JavaScript", "HTML", "CSS", "React", "Node.js", "Database", "API"),
            "ui/ux designer", List.of("Design", "Wireframing", "Prototyping", "User Research"),
            "qa engineer", List.of("Testing", "Test Automation", "QA", "Bug Reporting"),
            "devops engineer", List.of("DevOps", "CI/CD", "Docker", "Kubernetes", "Cloud Services")
    );

    private WorkerProfiles() {}

    public static WorkerProfile of(TeamMember member) {
        List<SkillProfile> skills = new ArrayList<>();
        if (member.skills().isEmpty()) {
            for (String name : inferSkillsFromRole(member.role())) {
                skills.add(new SkillProfile(name, DEFAULT_LEVEL, DEFAULT_SCORE, 0, List.of()));
            }
        } else {
            for (Skill skill : member.skills()) {
                if (skill == null || skill.name() == null || skill.name().isBlank()) {
                    continue;
                }
                String level = skill.level() == null || skill.level().isBlank() ? DEFAULT_LEVEL : skill.level();
                skills.add(new SkillProfile(skill.name(), level, proficiencyScore(level),
                        skill.count() == null ? 0 : skill.count(), skill.projects()));
            }
        }
        return new WorkerProfile(member.id(), member.label(), member.role(), skills, specialties(skills));
    }

    public static List<String> inferSkillsFromRole(String role) {
        if (role == null) {
            return List.of("General");
        }
        return ROLE_SKILLS.getOrDefault(role.trim().toLowerCase(), List.of("General"));
    }

    /** Score for a proficiency label; unknown labels score as Medium. */
    public static double proficiencyScore(String level) {
        if (level == null) {
            return DEFAULT_SCORE;
        }
        return LEVEL_SCORES.getOrDefault(level.trim().toLowerCase(), DEFAULT_SCORE);
    }

    /** Top skills by proficiency; ties keep declaration order. */
    static List<String> specialties(List<SkillProfile> skills) {
        if (skills.isEmpty()) {
            return List.of("General");
        }
        return skills.stream()
                .sorted(Comparator.comparingDouble(SkillProfile::proficiencyScore).reversed())
                .limit(SPECIALTY_COUNT)
                .map(SkillProfile::name)
                .toList();
    }
}
