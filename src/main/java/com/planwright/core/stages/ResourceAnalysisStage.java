package com.planwright.core.stages;

import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ResourceAnalysis;
import com.planwright.core.model.ResourceAnalysis.SprintCapacity;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import com.planwright.core.model.TeamMember;
import com.planwright.core.scheduler.AvailabilityCalculator;
import com.planwright.core.scheduler.SchedulerProperties;
import com.planwright.core.scheduler.SkillProfile;
import com.planwright.core.scheduler.WorkerProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Measures team capacity against the sprint plan: effective weekly hours,
 * hours per sprint, how many members hold each role, and which tech-stack
 * entries nobody on the team covers.
 */
@Component
public class ResourceAnalysisStage {

    public static final String NAME = "resourceAnalysis";

    private static final Logger log = LoggerFactory.getLogger(ResourceAnalysisStage.class);

    /** Inputs of resource analysis. */
    public record Input(ProjectDetails details, SprintPlan sprintPlan) {}

    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public ResourceAnalysisStage(SchedulerProperties schedulerProperties, Clock clock) {
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    public ResourceAnalysis apply(Input input) {
        AvailabilityCalculator calculator = new AvailabilityCalculator(
                LocalDate.now(clock), schedulerProperties.getDefaultWeeklyHours());
        List<String> warnings = new ArrayList<>();

        double weekly = 0;
        Map<String, Integer> roles = new LinkedHashMap<>();
        List<SkillProfile> teamSkills = new ArrayList<>();
        for (TeamMember member : input.details().teamMembers()) {
            double hours = calculator.calculate(member.availability()).hoursPerWeek();
            if (hours <= 0) {
                warnings.add(member.name() + " has no available hours this week");
            }
            weekly += hours;
            roles.merge(member.role(), 1, Integer::sum);
            teamSkills.addAll(WorkerProfiles.of(member).skills());
        }

        List<SprintCapacity> capacities = new ArrayList<>();
        for (Sprint sprint : input.sprintPlan().sprints()) {
            capacities.add(new SprintCapacity(sprint.number(), weekly * sprint.lengthInWeeks()));
        }

        List<String> gaps = new ArrayList<>();
        for (String tech : input.details().techStack()) {
            if (!covered(tech, teamSkills)) {
                gaps.add(tech);
            }
        }
        if (!gaps.isEmpty()) {
            warnings.add("No team member lists these technologies: " + String.join(", ", gaps));
        }

        boolean feasible = weekly > 0;
        if (!feasible) {
            warnings.add("The team has no available hours");
        }
        log.info("Resource analysis: {} h/week across {} role(s), {} skill gap(s)",
                weekly, roles.size(), gaps.size());
        return new ResourceAnalysis(weekly, capacities, roles, gaps, feasible, warnings);
    }

    private static boolean covered(String tech, List<SkillProfile> skills) {
        String t = tech.toLowerCase(Locale.ROOT);
        for (SkillProfile skill : skills) {
            String s = skill.name().toLowerCase(Locale.ROOT);
            if (s.contains(t) || t.contains(s)) {
                return true;
            }
        }
        return false;
    }
}
