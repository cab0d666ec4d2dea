package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A unit of planned work.
 *
 * @param id             unique identifier, "TASK-001" style
 * @param title          short name
 * @param description    what has to be done
 * @param category       area such as "backend", "frontend", "testing"
 * @param estimatedHours effort estimate, never negative
 * @param priority       priority label; null until priorities are assigned
 * @param dependencies   ids of tasks that must finish first
 * @param sprintNumber   sprint the task belongs to (nullable)
 * @param requiredRole   role best suited to the task (nullable)
 * @param requiredSkills skills the task calls for (may be empty)
 */
public record Task(
    String id,
    String title,
    String description,
    String category,
    double estimatedHours,
    Priority priority,
    List<String> dependencies,
    Integer sprintNumber,
    String requiredRole,
    List<String> requiredSkills
) implements WorkItem, Serializable {

    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        requiredSkills = requiredSkills == null ? List.of() : List.copyOf(requiredSkills);
    }

    public Task withId(String newId) {
        return new Task(newId, title, description, category, estimatedHours, priority,
                dependencies, sprintNumber, requiredRole, requiredSkills);
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, title, description, category, estimatedHours, priority,
                newDependencies, sprintNumber, requiredRole, requiredSkills);
    }

    public Task withEstimatedHours(double hours) {
        return new Task(id, title, description, category, hours, priority,
                dependencies, sprintNumber, requiredRole, requiredSkills);
    }

    public Task withPriority(Priority newPriority) {
        return new Task(id, title, description, category, estimatedHours, newPriority,
                dependencies, sprintNumber, requiredRole, requiredSkills);
    }
}
