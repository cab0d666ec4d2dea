package com.planwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A finer-grained piece of a {@link Task}.
 *
 * @param id             unique identifier, "TASK-001-S1" style
 * @param parentTaskId   id of the owning task
 * @param title          short name
 * @param description    what has to be done
 * @param category       area, usually inherited from the parent
 * @param estimatedHours effort estimate, never negative
 * @param priority       priority label; null until priorities are assigned
 * @param dependencies   ids of sibling subtasks that must finish first
 * @param requiredRole   role best suited to the subtask (nullable)
 */
public record Subtask(
    String id,
    String parentTaskId,
    String title,
    String description,
    String category,
    double estimatedHours,
    Priority priority,
    List<String> dependencies,
    String requiredRole
) implements WorkItem, Serializable {

    public Subtask {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    @Override
    public Integer sprintNumber() {
        return null;
    }

    public Subtask withId(String newId) {
        return new Subtask(newId, parentTaskId, title, description, category, estimatedHours,
                priority, dependencies, requiredRole);
    }

    public Subtask withParent(String newParentId) {
        return new Subtask(id, newParentId, title, description, category, estimatedHours,
                priority, dependencies, requiredRole);
    }

    public Subtask withEstimatedHours(double hours) {
        return new Subtask(id, parentTaskId, title, description, category, hours,
                priority, dependencies, requiredRole);
    }

    public Subtask withDependencies(List<String> newDependencies) {
        return new Subtask(id, parentTaskId, title, description, category, estimatedHours,
                priority, newDependencies, requiredRole);
    }
}
