package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.ProjectTimeline;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SprintPlanningStageTest {

    private static Sprint sprint(int number, String name, int start, int end) {
        return new Sprint(number, name, "Goal " + number, start, end, List.of());
    }

    @Nested
    @DisplayName("normalising the model's sprints")
    class NormaliseTests {

        @Test
        @DisplayName("a reply without sprints falls back to two-week sprints")
        void fallback() {
            SprintPlan plan = SprintPlanningStage.normalise(new SprintPlan(3, List.of()), 5);

            assertEquals(2, plan.sprintLengthWeeks());
            assertEquals(3, plan.sprints().size());
            assertEquals(5, plan.sprints().get(2).startWeek());
            assertEquals(5, plan.sprints().get(2).endWeek());
            assertEquals("Sprint 3", plan.sprints().get(2).name());
            assertEquals(plan, SprintPlanningStage.normalise(null, 5));
        }

        @Test
        @DisplayName("inverted ranges are recomputed and sprints renumbered")
        void repairsRanges() {
            SprintPlan plan = SprintPlanningStage.normalise(new SprintPlan(2, List.of(
                    sprint(4, "Foundations", 1, 2),
                    sprint(9, " ", 5, 3),
                    sprint(2, "Polish", 5, 6))), 6);

            List<Sprint> sprints = plan.sprints();
            assertEquals(List.of(1, 2, 3), sprints.stream().map(Sprint::number).toList());
            assertEquals(3, sprints.get(1).startWeek());
            assertEquals(4, sprints.get(1).endWeek());
            assertEquals("Sprint 2", sprints.get(1).name());
            assertEquals(5, sprints.get(2).startWeek());
            assertEquals(6, sprints.get(2).endWeek());
        }

        @Test
        @DisplayName("a sprint running past the project end is cut to the sprint length")
        void clampsToProject() {
            SprintPlan plan = SprintPlanningStage.normalise(new SprintPlan(0, List.of(sprint(1, "All", 1, 10))), 6);

            assertEquals(2, plan.sprintLengthWeeks());
            assertEquals(2, plan.sprints().get(0).endWeek());
        }

        @Test
        @DisplayName("overlapping sprints are pushed back")
        void overlapping() {
            SprintPlan plan = SprintPlanningStage.normalise(new SprintPlan(2, List.of(
                    sprint(1, "A", 1, 2), sprint(2, "B", 2, 3))), 8);

            assertEquals(3, plan.sprints().get(1).startWeek());
            assertEquals(4, plan.sprints().get(1).endWeek());
        }
    }

    @Test
    @DisplayName("the project length and overview are sent to the model")
    void promptsWithProjectLength() {
        LlmService llm = mock(LlmService.class);
        when(llm.structuredCall(anyString(), anyString(), eq(SprintPlan.class), eq(SprintPlanningStage.TEMPERATURE)))
                .thenReturn(new SprintPlan(2, List.of(sprint(1, "Kickoff", 1, 2), sprint(2, "Build", 3, 4))));
        SprintPlanningStage stage = new SprintPlanningStage(llm);

        ProjectDetails details = new ProjectDetails("Atlas", "Portal",
                new ProjectTimeline("4 weeks", 4, "week", 28), List.of(), List.of(), List.of(), List.of());
        SprintPlan plan = stage.apply(new SprintPlanningStage.Input(details,
                new EngineeredPrompt("PROJECT: Atlas", null, null),
                new ProjectOverview("A booking portal", null, null, List.of("Search"), null)));

        assertEquals(2, plan.sprints().size());
        verify(llm).structuredCall(anyString(), contains("PROJECT LENGTH: 4 weeks"), eq(SprintPlan.class),
                eq(SprintPlanningStage.TEMPERATURE));
        verify(llm).structuredCall(anyString(), contains("KEY FEATURES: Search"), eq(SprintPlan.class),
                eq(SprintPlanningStage.TEMPERATURE));
    }
}
