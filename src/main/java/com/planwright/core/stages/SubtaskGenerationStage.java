package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Asks the model to break tasks into subtasks.
 * <p>
 * Subtasks whose parent is not a known task are dropped. The rest are
 * numbered per parent ({@code TASK-001-S1}, {@code TASK-001-S2}, ...); their
 * dependencies may only point at siblings. Category and role default to the
 * parent's.
 */
@Component
public class SubtaskGenerationStage {

    public static final String NAME = "subtaskGeneration";
    static final double TEMPERATURE = 0.5;

    private static final Logger log = LoggerFactory.getLogger(SubtaskGenerationStage.class);

    private static final String SYSTEM_PROMPT = """
            You are a senior engineer breaking tasks into concrete subtasks.
            For each task listed, propose two to five subtasks. Each subtask needs:
            - id: a short identifier such as "S1", used only to express dependencies
            - parentTaskId: the id of the task it belongs to, exactly as listed
            - title and description
            - estimatedHours: effort in hours; the subtasks of a task should add up
              to roughly the task's estimate
            - dependencies: ids of sibling subtasks that must be finished first
            - requiredRole: the team role best suited to the subtask

            Respond with valid JSON matching the schema provided.
            """;

    /** Inputs of subtask generation. */
    public record Input(EngineeredPrompt prompt, List<Task> tasks) {}

    public record SubtaskDraft(
        String id,
        String parentTaskId,
        String title,
        String description,
        String category,
        Double estimatedHours,
        List<String> dependencies,
        String requiredRole
    ) {}

    public record GeneratedSubtasks(List<SubtaskDraft> subtasks) {}

    private final LlmService llmService;

    public SubtaskGenerationStage(LlmService llmService) {
        this.llmService = llmService;
    }

    public List<Subtask> apply(Input input) {
        StringBuilder prompt = new StringBuilder(input.prompt().projectContext()).append("\n\nTASKS:");
        for (Task task : input.tasks()) {
            prompt.append("\n- ").append(task.id()).append(": ").append(task.title())
                    .append(" (").append(task.estimatedHours()).append(" h)");
            if (task.description() != null) {
                prompt.append(" - ").append(task.description());
            }
        }
        GeneratedSubtasks generated = llmService.structuredCall(SYSTEM_PROMPT, prompt.toString(),
                GeneratedSubtasks.class, TEMPERATURE);
        List<Subtask> subtasks = normalise(generated == null ? null : generated.subtasks(), input.tasks());
        log.info("Generated {} subtask(s) for {} task(s)", subtasks.size(), input.tasks().size());
        return subtasks;
    }

    static List<Subtask> normalise(List<SubtaskDraft> drafts, List<Task> tasks) {
        if (drafts == null) {
            return List.of();
        }
        Map<String, Task> parents = new LinkedHashMap<>();
        tasks.forEach(t -> parents.put(t.id(), t));

        Map<String, List<SubtaskDraft>> byParent = new LinkedHashMap<>();
        int orphans = 0;
        for (SubtaskDraft d : drafts) {
            if (d == null || d.title() == null || d.title().isBlank()) {
                continue;
            }
            String parentId = d.parentTaskId() == null ? null : d.parentTaskId().trim();
            if (parentId == null || !parents.containsKey(parentId)) {
                orphans++;
                continue;
            }
            byParent.computeIfAbsent(parentId, k -> new ArrayList<>()).add(d);
        }
        if (orphans > 0) {
            log.warn("Dropped {} subtask(s) without a known parent task", orphans);
        }

        List<Subtask> result = new ArrayList<>();
        for (Task parent : tasks) {
            List<SubtaskDraft> siblings = byParent.getOrDefault(parent.id(), List.of());
            Map<String, String> idMap = new HashMap<>();
            for (int i = 0; i < siblings.size(); i++) {
                String newId = parent.id() + "-S" + (i + 1);
                String draftId = siblings.get(i).id();
                if (draftId != null && !draftId.isBlank()) {
                    idMap.putIfAbsent(draftId.trim(), newId);
                }
                idMap.putIfAbsent(newId, newId);
            }
            for (int i = 0; i < siblings.size(); i++) {
                SubtaskDraft d = siblings.get(i);
                String id = parent.id() + "-S" + (i + 1);
                Set<String> deps = new LinkedHashSet<>();
                if (d.dependencies() != null) {
                    for (String dep : d.dependencies()) {
                        String mapped = dep == null ? null : idMap.get(dep.trim());
                        if (mapped != null && !mapped.equals(id)) {
                            deps.add(mapped);
                        }
                    }
                }
                double hours = d.estimatedHours() == null ? 0 : Math.max(0, d.estimatedHours());
                result.add(new Subtask(id, parent.id(), d.title().trim(), d.description(),
                        d.category() != null ? d.category() : parent.category(),
                        hours, null, new ArrayList<>(deps),
                        d.requiredRole() != null ? d.requiredRole() : parent.requiredRole()));
            }
        }
        return result;
    }
}
