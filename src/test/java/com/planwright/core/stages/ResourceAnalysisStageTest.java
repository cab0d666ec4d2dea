package com.planwright.core.stages;

import com.planwright.core.model.Availability;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectTimeline;
import com.planwright.core.model.ResourceAnalysis;
import com.planwright.core.model.Skill;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import com.planwright.core.model.TeamMember;
import com.planwright.core.scheduler.SchedulerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceAnalysisStageTest {

    private final ResourceAnalysisStage stage = new ResourceAnalysisStage(new SchedulerProperties(),
            Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC));

    private static final SprintPlan SPRINTS = new SprintPlan(2, List.of(
            new Sprint(1, "Sprint 1", null, 1, 2, null),
            new Sprint(2, "Sprint 2", null, 3, 3, null)));

    private static ProjectDetails details(List<String> techStack, List<TeamMember> team) {
        return new ProjectDetails("Atlas", "Portal", new ProjectTimeline("3 weeks", 3, "week", 21),
                techStack, team, List.of(), List.of());
    }

    @Test
    @DisplayName("capacity, roles and uncovered technologies are measured")
    void analyses() {
        List<TeamMember> team = List.of(
                new TeamMember("m1", "Alice", "Backend Developer", List.of(Skill.named("Java")), Availability.weekly(30)),
                new TeamMember("m2", "Bob", "Frontend Developer", List.of(), null),
                new TeamMember("m3", "Cara", "Frontend Developer", List.of(), Availability.weekly(10)));

        ResourceAnalysis analysis = stage.apply(new ResourceAnalysisStage.Input(
                details(List.of("Java", "React", "Rust"), team), SPRINTS));

        assertEquals(80.0, analysis.weeklyCapacityHours());
        assertEquals(160.0, analysis.sprintCapacities().get(0).capacityHours());
        assertEquals(80.0, analysis.sprintCapacities().get(1).capacityHours());
        assertEquals(Map.of("Backend Developer", 1, "Frontend Developer", 2), analysis.roleCoverage());
        assertEquals(List.of("Rust"), analysis.skillGaps());
        assertTrue(analysis.feasible());
        assertTrue(analysis.warnings().get(0).contains("Rust"));
    }

    @Test
    @DisplayName("a team with no hours is not feasible")
    void noHours() {
        List<TeamMember> team = List.of(new TeamMember("m1", "Alice", "Developer", List.of(), Availability.weekly(0)));

        ResourceAnalysis analysis = stage.apply(new ResourceAnalysisStage.Input(details(List.of(), team), SPRINTS));

        assertFalse(analysis.feasible());
        assertEquals(0.0, analysis.weeklyCapacityHours());
        assertEquals(2, analysis.warnings().size());
    }
}
