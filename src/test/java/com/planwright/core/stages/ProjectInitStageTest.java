package com.planwright.core.stages;

import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectRequest;
import com.planwright.core.model.ProjectTimeline;
import com.planwright.core.model.TeamMember;
import com.planwright.core.pipeline.StageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectInitStageTest {

    private final ProjectInitStage stage = new ProjectInitStage();

    private static ProjectRequest request(String name, String timeline, List<TeamMember> members) {
        return new ProjectRequest(null, name, null, timeline, List.of("Java", " "), members,
                Arrays.asList("Ship v1", null), null);
    }

    private static TeamMember member(String id, String name, String role) {
        return new TeamMember(id, name, role, List.of(), null);
    }

    @Test
    @DisplayName("a valid request is normalised into project details")
    void normalises() {
        ProjectDetails details = stage.apply(request(" Atlas ", "3 months",
                List.of(member(null, "Alice ", null), member("bob", "Bob", "QA Engineer"))));

        assertEquals("Atlas", details.projectName());
        assertEquals("Not specified", details.description());
        assertEquals(90, details.timeline().durationInDays());
        assertEquals(13, details.timeline().weeks());
        assertEquals(List.of("Java"), details.techStack());
        assertEquals(List.of("Ship v1"), details.goals());
        assertTrue(details.constraints().isEmpty());

        TeamMember first = details.teamMembers().get(0);
        assertEquals("member-1", first.id());
        assertEquals("Alice", first.name());
        assertEquals("Team Member", first.role());
        assertEquals("bob", details.teamMembers().get(1).id());
    }

    @Test
    @DisplayName("missing name and timeline are reported together")
    void missingFields() {
        StageException e = assertThrows(StageException.class,
                () -> stage.apply(request(" ", null, List.of(member(null, "Alice", "Dev")))));

        assertEquals(ProjectInitStage.NAME, e.getStage());
        assertTrue(e.getMessage().contains("projectName"));
        assertTrue(e.getMessage().contains("projectTimeline"));
    }

    @Test
    void nullRequest() {
        assertThrows(StageException.class, () -> stage.apply(null));
    }

    @Nested
    @DisplayName("team members")
    class TeamTests {

        @Test
        void emptyTeam() {
            StageException e = assertThrows(StageException.class,
                    () -> stage.apply(request("Atlas", "4 weeks", List.of())));
            assertTrue(e.getMessage().contains("non-empty"));
        }

        @Test
        void memberWithoutName() {
            StageException e = assertThrows(StageException.class,
                    () -> stage.apply(request("Atlas", "4 weeks", List.of(member("a", "Alice", "Dev"), member("b", "", "Dev")))));
            assertTrue(e.getMessage().contains("#2"));
        }

        @Test
        @DisplayName("a generated id may not clash with a declared one")
        void duplicateIds() {
            StageException e = assertThrows(StageException.class,
                    () -> stage.apply(request("Atlas", "4 weeks",
                            List.of(member(null, "Alice", "Dev"), member("member-1", "Bob", "Dev")))));
            assertTrue(e.getMessage().contains("member-1"));
        }
    }

    @Nested
    @DisplayName("timeline parsing")
    class TimelineTests {

        @Test
        void units() {
            assertEquals(10, ProjectInitStage.parseTimeline("10 days").durationInDays());
            assertEquals(14, ProjectInitStage.parseTimeline("2 Weeks").durationInDays());
            assertEquals(365, ProjectInitStage.parseTimeline("1 year").durationInDays());
            ProjectTimeline timeline = ProjectInitStage.parseTimeline(" 6 months ");
            assertEquals(6, timeline.amount());
            assertEquals("month", timeline.unit());
            assertEquals("6 months", timeline.original());
        }

        @Test
        @DisplayName("durations from one week to two years are accepted")
        void bounds() {
            assertEquals(7, ProjectInitStage.parseTimeline("7 days").durationInDays());
            assertEquals(730, ProjectInitStage.parseTimeline("2 years").durationInDays());
            assertThrows(StageException.class, () -> ProjectInitStage.parseTimeline("6 days"));
            assertThrows(StageException.class, () -> ProjectInitStage.parseTimeline("25 months"));
        }

        @Test
        void malformed() {
            StageException e = assertThrows(StageException.class, () -> ProjectInitStage.parseTimeline("soon"));
            assertTrue(e.getMessage().contains("Expected format"));
            assertThrows(StageException.class, () -> ProjectInitStage.parseTimeline("two weeks"));
            assertThrows(StageException.class, () -> ProjectInitStage.parseTimeline("99999999999 days"));
        }
    }
}
