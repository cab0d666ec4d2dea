package com.planwright.core.model;

import com.planwright.core.state.PlanJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("project file parsing")
    class ProjectFileTests {

        private static final String PROJECT = """
                {
                  "projectName": "Atlas",
                  "projectTimeline": "3 months",
                  "techStack": ["Java", "React"],
                  "teamMembers": [
                    {"name": "Alice", "role": "Backend Developer",
                     "skills": ["Java", {"name": "SQL", "proficiency": "Expert", "count": 4}],
                     "availability": 30},
                    {"name": "Bob", "role": "Frontend Developer", "availability": 22.5},
                    {"name": "Cara", "role": "QA Engineer",
                     "availability": {"baseHoursPerWeek": 32,
                                      "timeOff": [{"start": "2026-04-01", "end": "2026-04-05", "fullDay": true}],
                                      "schedule": {"friday": {"available": false}}}}
                  ],
                  "unknownField": true
                }
                """;

        @Test
        @DisplayName("skills and availability accept both short and full forms")
        void parsesShortAndFullForms() throws Exception {
            ProjectRequest request = PlanJson.mapper().readValue(PROJECT, ProjectRequest.class);

            assertEquals("Atlas", request.projectName());
            assertEquals(3, request.teamMembers().size());

            TeamMember alice = request.teamMembers().get(0);
            assertEquals(Skill.named("Java"), alice.skills().get(0));
            Skill sql = alice.skills().get(1);
            assertEquals("Expert", sql.level());
            assertEquals(4, sql.count());
            assertEquals(30.0, alice.availability().baseHoursPerWeek());

            assertEquals(22.5, request.teamMembers().get(1).availability().baseHoursPerWeek());

            Availability cara = request.teamMembers().get(2).availability();
            assertEquals(32.0, cara.baseHoursPerWeek());
            assertEquals(LocalDate.of(2026, 4, 1), cara.timeOff().get(0).start());
            assertFalse(cara.schedule().get("friday").available());
            assertTrue(cara.allocationChanges().isEmpty());
        }

        @Test
        @DisplayName("missing lists become empty lists")
        void defaults() throws Exception {
            TeamMember member = PlanJson.mapper().readValue("{\"name\":\"Dana\"}", TeamMember.class);

            assertTrue(member.skills().isEmpty());
            assertNull(member.availability());
            assertEquals("Dana", member.label());
        }
    }

    @Nested
    @DisplayName("Priority")
    class PriorityTests {

        @Test
        void parsesLabelsAndNames() {
            assertEquals(Priority.CRITICAL, Priority.from("Critical"));
            assertEquals(Priority.HIGH, Priority.from(" HIGH "));
            assertEquals(Priority.LOW, Priority.from("low"));
        }

        @Test
        @DisplayName("unknown or blank values fall back to Medium")
        void fallsBackToMedium() {
            assertEquals(Priority.MEDIUM, Priority.from("urgent-ish"));
            assertEquals(Priority.MEDIUM, Priority.from(""));
            assertEquals(Priority.MEDIUM, Priority.from(null));
        }

        @Test
        @DisplayName("serialises as its label")
        void serialisesLabel() throws Exception {
            assertEquals("\"Critical\"", PlanJson.mapper().writeValueAsString(Priority.CRITICAL));
            assertEquals(Priority.HIGH, PlanJson.mapper().readValue("\"High\"", Priority.class));
        }
    }

    @Test
    @DisplayName("effective priority prefers the assigned one")
    void priorityOf() {
        Task task = new Task("T1", "Schema", null, null, 8, Priority.LOW, null, null, null, null);
        Task unset = task.withId("T2").withPriority(null);

        PriorityAssignments assigned = new PriorityAssignments(Map.of("T1", Priority.HIGH), null, null, null);

        assertEquals(Priority.HIGH, assigned.priorityOf(task));
        assertEquals(Priority.MEDIUM, assigned.priorityOf(unset));
        assertEquals(Priority.LOW, PriorityAssignments.empty().priorityOf(task));
    }

    @Test
    @DisplayName("balance statistics use the population standard deviation")
    void balanceStats() {
        BalanceStats stats = BalanceStats.of(List.of(40.0, 4.0, 16.0));

        assertEquals(20.0, stats.mean(), 1e-9);
        assertEquals(Math.sqrt(224.0), stats.standardDeviation(), 1e-9);
        assertEquals(4.0, stats.min());
        assertEquals(40.0, stats.max());
        assertEquals(new BalanceStats(0, 0, 0, 0), BalanceStats.of(List.of()));
    }

    @Test
    void timelineWeeksRoundUp() {
        assertEquals(13, new ProjectTimeline("3 months", 3, "month", 90).weeks());
        assertEquals(1, new ProjectTimeline("7 days", 7, "day", 7).weeks());
    }

    @Test
    @DisplayName("work items expose lower-cased title and description for keyword scans")
    void searchText() {
        Task task = new Task("T1", "Core Ledger", "PostgreSQL schema", "database", 4, null, List.of(), 1, null, List.of());
        Subtask untitled = new Subtask("T1-1", "T1", null, null, null, 2, null, List.of(), null);

        assertEquals("core ledger postgresql schema", task.searchText());
        assertEquals(" ", untitled.searchText());
    }
}
