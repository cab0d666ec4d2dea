package com.planwright.core.pipeline;

import com.fasterxml.jackson.core.type.TypeReference;
import com.planwright.core.model.CompiledPlan;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.PriorityAssignments;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.model.ProjectRequest;
import com.planwright.core.model.ResourceAnalysis;
import com.planwright.core.model.SprintPlan;
import com.planwright.core.model.Subtask;
import com.planwright.core.model.Task;
import com.planwright.core.model.WorkerAssignments;
import com.planwright.core.stages.DataCompilationStage;
import com.planwright.core.stages.PriorityAssignmentStage;
import com.planwright.core.stages.ProjectInitStage;
import com.planwright.core.stages.ProjectOverviewStage;
import com.planwright.core.stages.PromptEngineeringStage;
import com.planwright.core.stages.ResourceAnalysisStage;
import com.planwright.core.stages.SprintPlanningStage;
import com.planwright.core.stages.SubtaskGenerationStage;
import com.planwright.core.stages.TaskGenerationStage;
import com.planwright.core.stages.VerificationStage;
import com.planwright.core.stages.WorkerAssignmentStage;
import com.planwright.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the eleven planning stages into the {@link Pipeline} run by the coordinator:
 * <pre>
 *   projectRequest -> projectInit -> promptEngineering -> projectOverview
 *     -> sprintPlanning -> resourceAnalysis -> taskGeneration -> subtaskGeneration
 *     -> priorityAssignment -> workerAssignment -> dataCompilation -> verification
 * </pre>
 * Each stage reads earlier outputs from the state by slot name. A missing
 * input means the state is inconsistent, which fails the stage without retry.
 */
@Configuration
public class PlanningPipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PlanningPipelineConfig.class);

    public static final String SEED_SLOT = "projectRequest";
    public static final String DETAILS = "projectDetails";
    public static final String PROMPT = "engineeredPrompt";
    public static final String OVERVIEW = "projectOverview";
    public static final String SPRINTS = "sprintPlan";
    public static final String RESOURCES = "resourceAnalysis";
    public static final String TASKS = "tasks";
    public static final String SUBTASKS = "subtasks";
    public static final String PRIORITIES = "priorities";
    public static final String ASSIGNMENTS = "assignments";
    public static final String COMPILED = "compiledData";
    public static final String VERIFICATION = "verificationResult";

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Subtask>> SUBTASK_LIST = new TypeReference<>() {};

    @Bean
    public Pipeline planningPipeline(ProjectInitStage projectInit,
                                     PromptEngineeringStage promptEngineering,
                                     ProjectOverviewStage projectOverview,
                                     SprintPlanningStage sprintPlanning,
                                     ResourceAnalysisStage resourceAnalysis,
                                     TaskGenerationStage taskGeneration,
                                     SubtaskGenerationStage subtaskGeneration,
                                     PriorityAssignmentStage priorityAssignment,
                                     WorkerAssignmentStage workerAssignment,
                                     DataCompilationStage dataCompilation,
                                     VerificationStage verification) {
        List<StageDefinition<?>> stages = List.of(
                StageDefinition.of(ProjectInitStage.NAME, DETAILS,
                        s -> require(s, SEED_SLOT, ProjectRequest.class, ProjectInitStage.NAME),
                        projectInit::apply),
                StageDefinition.of(PromptEngineeringStage.NAME, PROMPT,
                        s -> require(s, DETAILS, ProjectDetails.class, PromptEngineeringStage.NAME),
                        promptEngineering::apply),
                StageDefinition.of(ProjectOverviewStage.NAME, OVERVIEW,
                        s -> require(s, PROMPT, EngineeredPrompt.class, ProjectOverviewStage.NAME),
                        projectOverview::apply),
                StageDefinition.of(SprintPlanningStage.NAME, SPRINTS,
                        s -> new SprintPlanningStage.Input(
                                require(s, DETAILS, ProjectDetails.class, SprintPlanningStage.NAME),
                                require(s, PROMPT, EngineeredPrompt.class, SprintPlanningStage.NAME),
                                require(s, OVERVIEW, ProjectOverview.class, SprintPlanningStage.NAME)),
                        sprintPlanning::apply),
                StageDefinition.of(ResourceAnalysisStage.NAME, RESOURCES,
                        s -> new ResourceAnalysisStage.Input(
                                require(s, DETAILS, ProjectDetails.class, ResourceAnalysisStage.NAME),
                                require(s, SPRINTS, SprintPlan.class, ResourceAnalysisStage.NAME)),
                        resourceAnalysis::apply),
                StageDefinition.of(TaskGenerationStage.NAME, TASKS,
                        s -> new TaskGenerationStage.Input(
                                require(s, PROMPT, EngineeredPrompt.class, TaskGenerationStage.NAME),
                                require(s, OVERVIEW, ProjectOverview.class, TaskGenerationStage.NAME),
                                require(s, SPRINTS, SprintPlan.class, TaskGenerationStage.NAME),
                                require(s, RESOURCES, ResourceAnalysis.class, TaskGenerationStage.NAME)),
                        taskGeneration::apply),
                StageDefinition.of(SubtaskGenerationStage.NAME, SUBTASKS,
                        s -> new SubtaskGenerationStage.Input(
                                require(s, PROMPT, EngineeredPrompt.class, SubtaskGenerationStage.NAME),
                                require(s, TASKS, TASK_LIST, SubtaskGenerationStage.NAME)),
                        subtaskGeneration::apply),
                StageDefinition.of(PriorityAssignmentStage.NAME, PRIORITIES,
                        s -> new PriorityAssignmentStage.Input(
                                require(s, TASKS, TASK_LIST, PriorityAssignmentStage.NAME),
                                require(s, SUBTASKS, SUBTASK_LIST, PriorityAssignmentStage.NAME)),
                        priorityAssignment::apply),
                StageDefinition.of(WorkerAssignmentStage.NAME, ASSIGNMENTS,
                        s -> new WorkerAssignmentStage.Input(
                                require(s, DETAILS, ProjectDetails.class, WorkerAssignmentStage.NAME),
                                require(s, TASKS, TASK_LIST, WorkerAssignmentStage.NAME),
                                require(s, SUBTASKS, SUBTASK_LIST, WorkerAssignmentStage.NAME),
                                require(s, PRIORITIES, PriorityAssignments.class, WorkerAssignmentStage.NAME)),
                        workerAssignment::apply),
                StageDefinition.of(DataCompilationStage.NAME, COMPILED,
                        s -> new DataCompilationStage.Input(
                                require(s, DETAILS, ProjectDetails.class, DataCompilationStage.NAME),
                                require(s, OVERVIEW, ProjectOverview.class, DataCompilationStage.NAME),
                                require(s, SPRINTS, SprintPlan.class, DataCompilationStage.NAME),
                                require(s, RESOURCES, ResourceAnalysis.class, DataCompilationStage.NAME),
                                require(s, TASKS, TASK_LIST, DataCompilationStage.NAME),
                                require(s, SUBTASKS, SUBTASK_LIST, DataCompilationStage.NAME),
                                require(s, PRIORITIES, PriorityAssignments.class, DataCompilationStage.NAME),
                                require(s, ASSIGNMENTS, WorkerAssignments.class, DataCompilationStage.NAME)),
                        dataCompilation::apply),
                StageDefinition.of(VerificationStage.NAME, VERIFICATION,
                        s -> new VerificationStage.Input(
                                require(s, COMPILED, CompiledPlan.class, VerificationStage.NAME),
                                require(s, SUBTASKS, SUBTASK_LIST, VerificationStage.NAME)),
                        verification::apply)
        );
        log.info("Planning pipeline built with {} stages", stages.size());
        return new Pipeline(stages, SEED_SLOT, COMPILED, VERIFICATION);
    }

    private static <T> T require(PipelineState state, String slot, Class<T> type, String stage) {
        return state.value(slot, type)
                .orElseThrow(() -> new StageException(stage, "Missing input '" + slot + "' for stage " + stage));
    }

    private static <T> T require(PipelineState state, String slot, TypeReference<T> type, String stage) {
        return state.value(slot, type)
                .orElseThrow(() -> new StageException(stage, "Missing input '" + slot + "' for stage " + stage));
    }
}
