package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.ResourceAnalysis;
import com.planwright.core.model.Sprint;
import com.planwright.core.model.SprintPlan;
import com.planwright.core.model.Task;
import com.planwright.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Asks the model for the project's tasks and cleans up the reply.
 * <p>
 * Tasks are renumbered {@code TASK-001}, {@code TASK-002}, ... in the order
 * returned; dependencies are rewritten to the new ids, and references to
 * unknown tasks or to the task itself are dropped. Negative estimates become
 * zero and sprint numbers outside the plan are cleared.
 */
@Component
public class TaskGenerationStage {

    public static final String NAME = "taskGeneration";
    static final double TEMPERATURE = 0.5;

    private static final Logger log = LoggerFactory.getLogger(TaskGenerationStage.class);

    private static final String SYSTEM_PROMPT = """
            You are a technical project manager breaking a software project into tasks.
            For each sprint, list the tasks needed to reach its goal. Each task needs:
            - id: a short identifier such as "T1", used only to express dependencies
            - title and description
            - category: one of frontend, backend, database, api, design, testing,
              devops, documentation, research, security, management
            - estimatedHours: realistic effort in hours
            - dependencies: ids of tasks that must be finished first
            - sprintNumber: the sprint the task belongs to
            - requiredRole: the team role best suited to the task
            - requiredSkills: the main skills the task calls for
            Keep tasks between 4 and 40 hours and do not create circular dependencies.

            Respond with valid JSON matching the schema provided.
            """;

    /** Inputs of task generation. */
    public record Input(EngineeredPrompt prompt, ProjectOverview overview, SprintPlan sprintPlan,
                        ResourceAnalysis resourceAnalysis) {}

    /** Task as proposed by the model, before ids are normalised. */
    public record TaskDraft(
        String id,
        String title,
        String description,
        String category,
        Double estimatedHours,
        List<String> dependencies,
        Integer sprintNumber,
        String requiredRole,
        List<String> requiredSkills
    ) {}

    public record GeneratedTasks(List<TaskDraft> tasks) {}

    private final LlmService llmService;

    public TaskGenerationStage(LlmService llmService) {
        this.llmService = llmService;
    }

    public List<Task> apply(Input input) {
        GeneratedTasks generated = llmService.structuredCall(SYSTEM_PROMPT, buildUserPrompt(input),
                GeneratedTasks.class, TEMPERATURE);
        List<Task> tasks = normalise(generated == null ? null : generated.tasks(), input.sprintPlan());
        if (tasks.isEmpty()) {
            throw new StageException(NAME, "Model returned no usable tasks");
        }
        log.info("Generated {} task(s), {} h in total", tasks.size(),
                tasks.stream().mapToDouble(Task::estimatedHours).sum());
        return tasks;
    }

    static List<Task> normalise(List<TaskDraft> drafts, SprintPlan sprintPlan) {
        if (drafts == null) {
            return List.of();
        }
        Set<Integer> sprintNumbers = sprintPlan.sprints().stream().map(Sprint::number).collect(Collectors.toSet());
        List<TaskDraft> usable = drafts.stream()
                .filter(d -> d != null && d.title() != null && !d.title().isBlank())
                .toList();

        Map<String, String> idMap = new HashMap<>();
        for (int i = 0; i < usable.size(); i++) {
            String newId = String.format("TASK-%03d", i + 1);
            TaskDraft d = usable.get(i);
            if (d.id() != null && !d.id().isBlank()) {
                idMap.putIfAbsent(d.id().trim(), newId);
            }
            idMap.putIfAbsent(newId, newId);
        }

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < usable.size(); i++) {
            TaskDraft d = usable.get(i);
            String id = String.format("TASK-%03d", i + 1);
            Set<String> deps = new LinkedHashSet<>();
            if (d.dependencies() != null) {
                for (String dep : d.dependencies()) {
                    String mapped = dep == null ? null : idMap.get(dep.trim());
                    if (mapped == null) {
                        log.debug("Dropping unknown dependency '{}' of {}", dep, id);
                    } else if (!mapped.equals(id)) {
                        deps.add(mapped);
                    }
                }
            }
            double hours = d.estimatedHours() == null ? 0 : Math.max(0, d.estimatedHours());
            Integer sprint = d.sprintNumber() != null && sprintNumbers.contains(d.sprintNumber())
                    ? d.sprintNumber() : null;
            tasks.add(new Task(id, d.title().trim(), d.description(), d.category(), hours, null,
                    new ArrayList<>(deps), sprint, d.requiredRole(), d.requiredSkills()));
        }
        return tasks;
    }

    private static String buildUserPrompt(Input input) {
        StringBuilder sb = new StringBuilder(input.prompt().asText());
        sb.append("\n\nOVERVIEW: ").append(input.overview().summary());
        sb.append("\n\nSPRINTS:");
        for (Sprint sprint : input.sprintPlan().sprints()) {
            sb.append("\n- Sprint ").append(sprint.number()).append(" (weeks ")
                    .append(sprint.startWeek()).append('-').append(sprint.endWeek()).append("): ")
                    .append(sprint.name());
            if (sprint.goal() != null) {
                sb.append(" - ").append(sprint.goal());
            }
        }
        sb.append("\n\nTEAM CAPACITY: ")
                .append(String.format("%.0f", input.resourceAnalysis().weeklyCapacityHours()))
                .append(" hours per week");
        return sb.toString();
    }
}
