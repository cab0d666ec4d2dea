package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import com.planwright.core.stages.SubtaskGenerationStage.GeneratedSubtasks;
import com.planwright.core.stages.SubtaskGenerationStage.SubtaskDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SubtaskGenerationStageTest {

    private static final List<Task> TASKS = List.of(
            new Task("TASK-001", "Schema", "Tables", "database", 8, null, List.of(), 1, "Backend Developer", List.of()),
            new Task("TASK-002", "Screens", null, "frontend", 12, null, List.of(), 1, "Frontend Developer", List.of()));

    private static SubtaskDraft draft(String id, String parent, String title, List<String> deps) {
        return new SubtaskDraft(id, parent, title, null, null, 4.0, deps, null);
    }

    @Test
    @DisplayName("subtasks are numbered per parent and orphans are dropped")
    void normalises() {
        List<Subtask> subtasks = SubtaskGenerationStage.normalise(List.of(
                draft("S1", "TASK-002", "Login page", null),
                draft("S1", "TASK-001", "Users table", null),
                draft("S2", "TASK-001", "Indexes", List.of("S1", "S2", "S5")),
                draft("S1", "TASK-999", "Stray", null),
                draft("S3", " TASK-001 ", "", null)), TASKS);

        assertEquals(List.of("TASK-001-S1", "TASK-001-S2", "TASK-002-S1"),
                subtasks.stream().map(Subtask::id).toList());
        Subtask indexes = subtasks.get(1);
        assertEquals("TASK-001", indexes.parentTaskId());
        assertEquals(List.of("TASK-001-S1"), indexes.dependencies());
        assertEquals("database", indexes.category());
        assertEquals("Backend Developer", indexes.requiredRole());
        assertEquals("Frontend Developer", subtasks.get(2).requiredRole());
        assertNull(indexes.sprintNumber());
    }

    @Test
    @DisplayName("negative or missing estimates become zero")
    void hours() {
        List<Subtask> subtasks = SubtaskGenerationStage.normalise(List.of(
                new SubtaskDraft("S1", "TASK-001", "A", null, "qa", -2.0, null, "QA Engineer"),
                new SubtaskDraft("S2", "TASK-001", "B", null, null, null, null, null)), TASKS);

        assertEquals(0.0, subtasks.get(0).estimatedHours());
        assertEquals("qa", subtasks.get(0).category());
        assertEquals("QA Engineer", subtasks.get(0).requiredRole());
        assertEquals(0.0, subtasks.get(1).estimatedHours());
    }

    @Test
    void listsTasksInPrompt() {
        LlmService llm = mock(LlmService.class);
        when(llm.structuredCall(anyString(), anyString(), eq(GeneratedSubtasks.class), anyDouble()))
                .thenReturn(new GeneratedSubtasks(null));
        SubtaskGenerationStage stage = new SubtaskGenerationStage(llm);

        List<Subtask> subtasks = stage.apply(new SubtaskGenerationStage.Input(
                new EngineeredPrompt("PROJECT: Atlas", null, null), TASKS));

        assertTrue(subtasks.isEmpty());
        verify(llm).structuredCall(anyString(), contains("- TASK-001: Schema (8.0 h) - Tables"),
                eq(GeneratedSubtasks.class), eq(SubtaskGenerationStage.TEMPERATURE));
    }
}
