package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the model to split the project timeline into sprints.
 * <p>
 * Sprints are renumbered 1..n in the order returned. Week ranges that are
 * missing, inverted or past the end of the project are recomputed from the
 * sprint length. An empty reply falls back to back-to-back sprints of the
 * default length.
 */
@Component
public class SprintPlanningStage {

    public static final String NAME = "sprintPlanning";
    static final double TEMPERATURE = 0.4;
    static final int DEFAULT_SPRINT_WEEKS = 2;

    private static final Logger log = LoggerFactory.getLogger(SprintPlanningStage.class);

    private static final String SYSTEM_PROMPT = """
            You are an agile delivery lead planning sprints for a software project.
            Split the project timeline into consecutive sprints of equal length
            (usually two weeks). For every sprint give:
            - number: 1-based sequence number
            - name: a short name
            - goal: what the sprint must deliver
            - startWeek and endWeek: 1-based project weeks covered, inclusive
            - focus: the features or themes worked on
            Sprints must not overlap and must fit inside the project timeline.
            Set sprintLengthWeeks to the length you chose.

            Respond with valid JSON matching the schema provided.
            """;

    /** Inputs of sprint planning. */
    public record Input(ProjectDetails details, EngineeredPrompt prompt, ProjectOverview overview) {}

    private final LlmService llmService;

    public SprintPlanningStage(LlmService llmService) {
        this.llmService = llmService;
    }

    public SprintPlan apply(Input input) {
        int totalWeeks = input.details().timeline().weeks();
        String userPrompt = input.prompt().asText()
                + "\n\nPROJECT LENGTH: " + totalWeeks + " weeks"
                + "\n\nOVERVIEW: " + input.overview().summary()
                + (input.overview().keyFeatures().isEmpty() ? ""
                        : "\nKEY FEATURES: " + String.join(", ", input.overview().keyFeatures()));

        SprintPlan generated = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, SprintPlan.class, TEMPERATURE);
        SprintPlan plan = normalise(generated, totalWeeks);
        log.info("Sprint plan: {} sprint(s) of {} week(s) over {} weeks",
                plan.sprints().size(), plan.sprintLengthWeeks(), totalWeeks);
        return plan;
    }

    static SprintPlan normalise(SprintPlan generated, int totalWeeks) {
        int length = generated != null && generated.sprintLengthWeeks() > 0
                ? generated.sprintLengthWeeks()
                : DEFAULT_SPRINT_WEEKS;
        if (generated == null || generated.sprints().isEmpty()) {
            log.warn("No sprints generated, falling back to {}-week sprints", DEFAULT_SPRINT_WEEKS);
            return defaultPlan(totalWeeks);
        }

        List<Sprint> sprints = new ArrayList<>();
        int nextStart = 1;
        for (Sprint s : generated.sprints()) {
            int number = sprints.size() + 1;
            int start = s.startWeek();
            int end = s.endWeek();
            if (start < nextStart || end < start || end > Math.max(totalWeeks, nextStart)) {
                start = nextStart;
                end = Math.min(start + length - 1, Math.max(totalWeeks, start));
            }
            String name = s.name() == null || s.name().isBlank() ? "Sprint " + number : s.name();
            sprints.add(new Sprint(number, name, s.goal(), start, end, s.focus()));
            nextStart = end + 1;
        }
        return new SprintPlan(length, sprints);
    }

    static SprintPlan defaultPlan(int totalWeeks) {
        List<Sprint> sprints = new ArrayList<>();
        int start = 1;
        while (start <= totalWeeks) {
            int number = sprints.size() + 1;
            int end = Math.min(start + DEFAULT_SPRINT_WEEKS - 1, totalWeeks);
            sprints.add(new Sprint(number, "Sprint " + number, null, start, end, List.of()));
            start = end + 1;
        }
        return new SprintPlan(DEFAULT_SPRINT_WEEKS, sprints);
    }
}
