package com.planwright.core.stages;

import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import com.planwright.core.model.WorkerAssignments;
import com.planwright.core.scheduler.ResourceAssignmentScheduler;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class WorkerAssignmentStage {

    public static final String NAME = "workerAssignment";

    /** Inputs of worker assignment. */
    public record Input(ProjectDetails details, List<Task> tasks, List<Subtask> subtasks,
                        PriorityAssignments priorities) {}

    private final ResourceAssignmentScheduler scheduler;

    public WorkerAssignmentStage(ResourceAssignmentScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public WorkerAssignments apply(Input input) {
        return scheduler.assign(input.tasks(), input.subtasks(), input.priorities(),
                input.details().teamMembers());
    }
}
