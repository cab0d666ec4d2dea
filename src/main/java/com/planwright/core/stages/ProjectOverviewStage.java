package com.planwright.core.stages;

import com.planwright.core.llm.LlmService;
import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.ProjectOverview;
import com.planwright.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the model for a high-level overview: summary, objectives, scope, key features and risks.
 */
@Component
public class ProjectOverviewStage {

    public static final String NAME = "projectOverview";
    static final double TEMPERATURE = 0.5;

    private static final Logger log = LoggerFactory.getLogger(ProjectOverviewStage.class);

    private static final String SYSTEM_PROMPT = """
            You are an experienced technical project manager.
            Given a software project's context and team, write a concise project overview:
            - summary: two or three sentences describing what will be built and for whom
            - objectives: measurable objectives
            - scope: concrete deliverables that are in scope
            - keyFeatures: the headline features
            - risks: the main delivery risks, each with an impact (High, Medium or Low)
              and a practical mitigation

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public ProjectOverviewStage(LlmService llmService) {
        this.llmService = llmService;
    }

    public ProjectOverview apply(EngineeredPrompt prompt) {
        ProjectOverview overview = llmService.structuredCall(SYSTEM_PROMPT, prompt.asText(),
                ProjectOverview.class, TEMPERATURE);
        if (overview == null || overview.summary() == null || overview.summary().isBlank()) {
            throw new StageException(NAME, "Model returned an overview without a summary");
        }
        log.info("Overview: {} objective(s), {} feature(s), {} risk(s)",
                overview.objectives().size(), overview.keyFeatures().size(), overview.risks().size());
        return overview;
    }
}
