package com.planwright.core.scheduler;

import com.planwright.core.model.Task;
import com.planwright.core.model.WorkItem;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how well a worker fits a task or subtask.
 * <p>
 * The total is a weighted sum of skill match, role match, remaining
 * availability, workload balance, past performance and specialty overlap.
 * Skill names are compared case-insensitively by containment in either
 * direction, so "API" matches "REST API Design".
 */
public class MatchScorer {

    private record KeywordRule(String key, List<String> values) {}

    private static final List<KeywordRule> SKILL_KEYWORDS = List.of(
            new KeywordRule("frontend", List.of("JavaScript", "HTML", "CSS", "React", "UI/UX")),
            new KeywordRule("backend", List.of("Node.js", "Database", "API", "Server Architecture")),
            new KeywordRule("database", List.of("Database", "SQL", "NoSQL", "Data Modeling")),
            new KeywordRule("ui", List.of("UI/UX", "Design", "CSS")),
            new KeywordRule("ux", List.of("UI/UX", "User Research", "Design")),
            new KeywordRule("api", List.of("API", "REST", "GraphQL", "Backend")),
            new KeywordRule("test", List.of("Testing", "QA", "Test Automation")),
            new KeywordRule("devops", List.of("DevOps", "CI/CD", "Docker", "Kubernetes")),
            new KeywordRule("documentation", List.of("Documentation", "Technical Writing")),
            new KeywordRule("research", List.of("Research", "Analysis")),
            new KeywordRule("security", List.of("Security", "Authentication", "Authorization"))
    );

    // First matching role wins, so the order matters.
    private static final List<KeywordRule> ROLE_KEYWORDS = List.of(
            new KeywordRule("frontend developer",
                    List.of("frontend", "ui", "interface", "react", "angular", "vue", "javascript", "css", "html")),
            new KeywordRule("backend developer",
                    List.of("backend", "server", "api", "database", "node", "express", "django", "flask")),
            new KeywordRule("full stack developer",
                    List.of("full stack", "fullstack", "end-to-end", "frontend and backend")),
            new KeywordRule("ui/ux designer",
                    List.of("design", "ui/ux", "wireframe", "prototype", "user experience", "user interface")),
            new KeywordRule("devops engineer",
                    List.of("devops", "ci/cd", "docker", "kubernetes", "deployment", "pipeline")),
            new KeywordRule("qa engineer",
                    List.of("testing", "qa", "quality assurance", "test automation")),
            new KeywordRule("project manager",
                    List.of("management", "coordination", "planning", "schedule", "risk assessment"))
    );

    private static final List<String> CRITICAL_SKILLS = List.of(
            "security", "authentication", "encryption", "architecture", "devops", "ci/cd",
            "database", "backend", "api", "performance", "optimization", "testing");

    private static final double NEUTRAL = 0.5;
    private static final double SKILL_FLOOR = 0.3;
    private static final double CRITICAL_BOOST = 1.5;

    private final SchedulerProperties properties;

    public MatchScorer(SchedulerProperties properties) {
        this.properties = properties;
    }

    /**
     * Full weighted score of a worker for an item.
     */
    public MatchScore score(WorkItem item, WorkerLoad worker) {
        List<String> taskSkills = extractTaskSkills(item);
        String requiredRole = item.requiredRole() != null && !item.requiredRole().isBlank()
                ? item.requiredRole()
                : inferRequiredRole(item);
        WorkerProfile profile = worker.profile();

        double skill = skillMatch(taskSkills, profile);
        double role = roleMatch(requiredRole, profile.role());
        double availability = availabilityScore(worker);
        double workload = Math.max(0, 1 - (double) worker.taskIds().size() / properties.getWorkloadNormalizer());
        double history = historyScore(taskSkills, worker.historicalPerformance(), worker.workHistory());
        double specialty = specialtyMatch(taskSkills, profile.specialties());

        double total = skill * properties.getSkillWeight()
                + role * properties.getRoleWeight()
                + availability * properties.getAvailabilityWeight()
                + workload * properties.getWorkloadWeight()
                + history * properties.getHistoryWeight()
                + specialty * properties.getSpecialtyWeight();
        return new MatchScore(worker.id(), total, skill, role, availability, workload, history, specialty);
    }

    /**
     * Score used when choosing a rebalancing target: skill, specialty and availability only.
     */
    public double rebalanceScore(WorkItem item, WorkerLoad worker) {
        List<String> taskSkills = extractTaskSkills(item);
        return skillMatch(taskSkills, worker.profile()) * 0.6
                + specialtyMatch(taskSkills, worker.profile().specialties()) * 0.2
                + availabilityScore(worker) * 0.2;
    }

    /**
     * Skills an item calls for: its category, any declared skills, then skills
     * implied by keywords in the title and description. Duplicates are removed.
     */
    public List<String> extractTaskSkills(WorkItem item) {
        Set<String> skills = new LinkedHashSet<>();
        if (item.category() != null && !item.category().isBlank()) {
            skills.add(item.category());
        }
        if (item instanceof Task task) {
            skills.addAll(task.requiredSkills());
        }
        String text = item.searchText();
        for (KeywordRule rule : SKILL_KEYWORDS) {
            if (text.contains(rule.key())) {
                skills.addAll(rule.values());
            }
        }
        return new ArrayList<>(skills);
    }

    /** Role implied by the item's wording, or {@code null} when nothing matches. */
    public String inferRequiredRole(WorkItem item) {
        String text = item.searchText();
        for (KeywordRule rule : ROLE_KEYWORDS) {
            for (String keyword : rule.values()) {
                if (text.contains(keyword)) {
                    return rule.key();
                }
            }
        }
        return null;
    }

    public static boolean isCriticalSkill(String skill) {
        String lower = skill.toLowerCase();
        return CRITICAL_SKILLS.stream().anyMatch(lower::contains);
    }

    public double skillMatch(List<String> taskSkills, WorkerProfile profile) {
        if (taskSkills.isEmpty() || profile.skills().isEmpty()) {
            return NEUTRAL;
        }
        int criticalTotal = (int) taskSkills.stream()
                .filter(s -> s.toLowerCase().contains("critical") || isCriticalSkill(s))
                .count();
        int criticalMatched = 0;
        int matched = 0;
        double total = 0;

        for (String taskSkill : taskSkills) {
            SkillProfile memberSkill = findSkill(taskSkill, profile.skills());
            if (memberSkill == null) {
                continue;
            }
            matched++;
            boolean critical = isCriticalSkill(taskSkill);
            if (critical) {
                criticalMatched++;
            }
            double score = memberSkill.proficiencyScore();
            if (memberSkill.count() > 3) {
                score = Math.min(1.0, score + 0.2);
            }
            if (!memberSkill.projects().isEmpty()) {
                score = Math.min(1.0, score + 0.1);
            }
            if (critical) {
                score *= CRITICAL_BOOST;
            }
            total += score;
        }

        double result = SKILL_FLOOR;
        if (matched > 0) {
            result = Math.max(result, total / (taskSkills.size() * CRITICAL_BOOST));
        }
        if (criticalTotal > 0 && criticalMatched < criticalTotal) {
            double coverage = (double) criticalMatched / criticalTotal;
            result *= coverage * 0.5 + 0.5;
        }
        return Math.min(1.0, result);
    }

    public static double roleMatch(String requiredRole, String memberRole) {
        if (requiredRole != null && memberRole != null
                && memberRole.toLowerCase().contains(requiredRole.toLowerCase())) {
            return 1.0;
        }
        return NEUTRAL;
    }

    public double specialtyMatch(List<String> taskSkills, List<String> specialties) {
        if (taskSkills.isEmpty() || specialties.isEmpty()) {
            return NEUTRAL;
        }
        long matches = taskSkills.stream()
                .filter(skill -> specialties.stream().anyMatch(sp -> overlaps(sp, skill)))
                .count();
        if (matches > 0) {
            return Math.min(1.0, 0.7 + (double) matches / taskSkills.size() * 0.3);
        }
        return NEUTRAL;
    }

    public double historyScore(List<String> taskSkills, HistoricalPerformance performance,
                               List<WorkHistoryEntry> workHistory) {
        if (performance == null) {
            return NEUTRAL;
        }
        double score = 0.5 + performance.averageRating() / 10;
        if (performance.completedProjects() > 5) {
            score += 0.1;
        } else if (performance.completedProjects() > 2) {
            score += 0.05;
        }
        long similar = workHistory.stream()
                .filter(entry -> taskSkills.stream().anyMatch(entry.skills()::contains))
                .count();
        if (similar > 0) {
            score += Math.min(0.2, similar * 0.05);
        }
        return Math.min(1.0, score);
    }

    private static double availabilityScore(WorkerLoad worker) {
        if (worker.totalAvailableHours() <= 0) {
            return 0;
        }
        return worker.remainingHours() / worker.totalAvailableHours();
    }

    private static SkillProfile findSkill(String taskSkill, List<SkillProfile> skills) {
        for (SkillProfile skill : skills) {
            if (overlaps(skill.name(), taskSkill)) {
                return skill;
            }
        }
        return null;
    }

    private static boolean overlaps(String a, String b) {
        String x = a.toLowerCase();
        String y = b.toLowerCase();
        return x.contains(y) || y.contains(x);
    }
}
