package com.planwright.core.stages;

import com.planwright.core.model.EngineeredPrompt;
import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.Skill;
import com.planwright.core.model.TeamMember;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Renders the project details into the shared context text that the
 * generative stages put in front of their own instructions. Deterministic.
 */
@Component
public class PromptEngineeringStage {

    public static final String NAME = "promptEngineering";

    public EngineeredPrompt apply(ProjectDetails details) {
        StringBuilder project = new StringBuilder();
        project.append("PROJECT: ").append(details.projectName()).append('\n');
        project.append("DESCRIPTION: ").append(details.description()).append('\n');
        project.append("TIMELINE: ").append(details.timeline().original())
                .append(" (").append(details.timeline().durationInDays()).append(" days, ")
                .append(details.timeline().weeks()).append(" weeks)").append('\n');
        project.append("TECH STACK: ")
                .append(details.techStack().isEmpty() ? "Not specified" : String.join(", ", details.techStack()));
        if (!details.goals().isEmpty()) {
            project.append("\nGOALS:");
            details.goals().forEach(g -> project.append("\n- ").append(g));
        }

        StringBuilder team = new StringBuilder("TEAM (").append(details.teamMembers().size()).append(" members):");
        for (TeamMember member : details.teamMembers()) {
            team.append("\n- ").append(member.name()).append(" [").append(member.id()).append("]: ")
                    .append(member.role());
            if (!member.skills().isEmpty()) {
                team.append("; skills: ").append(member.skills().stream()
                        .map(PromptEngineeringStage::describe)
                        .collect(Collectors.joining(", ")));
            }
        }

        String constraints = "";
        if (!details.constraints().isEmpty()) {
            constraints = "CONSTRAINTS:" + details.constraints().stream()
                    .map(c -> "\n- " + c)
                    .collect(Collectors.joining());
        }
        return new EngineeredPrompt(project.toString(), team.toString(), constraints);
    }

    private static String describe(Skill skill) {
        return skill.level() == null ? skill.name() : skill.name() + " (" + skill.level() + ")";
    }
}
