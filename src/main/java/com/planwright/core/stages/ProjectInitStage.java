package com.planwright.core.stages;

import com.planwright.core.model.ProjectDetails;
import com.planwright.core.model.ProjectRequest;
import com.planwright.core.model.ProjectTimeline;
import com.planwright.core.model.TeamMember;
import com.planwright.core.pipeline.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the caller's project data and normalises it into {@link ProjectDetails}.
 * <p>
 * The project name and timeline are required. The timeline must read
 * "N day|week|month|year[s]" and come to between 7 and 730 days. Team members
 * need a name; members without an id get {@code member-N} from their position.
 * Any violation is a {@link StageException}, which is never retried.
 */
@Component
public class ProjectInitStage {

    public static final String NAME = "projectInit";

    private static final Logger log = LoggerFactory.getLogger(ProjectInitStage.class);

    private static final Pattern TIMELINE = Pattern.compile("^(\\d+)\\s*(day|week|month|year)s?$",
            Pattern.CASE_INSENSITIVE);
    private static final int MIN_DAYS = 7;
    private static final int MAX_DAYS = 730;

    public ProjectDetails apply(ProjectRequest request) {
        if (request == null) {
            throw new StageException(NAME, "No project data supplied");
        }
        List<String> missing = new ArrayList<>();
        if (isBlank(request.projectName())) {
            missing.add("projectName");
        }
        if (isBlank(request.projectTimeline())) {
            missing.add("projectTimeline");
        }
        if (!missing.isEmpty()) {
            throw new StageException(NAME, "Missing required project information: " + String.join(", ", missing));
        }
        if (request.teamMembers() == null || request.teamMembers().isEmpty()) {
            throw new StageException(NAME, "Team members must be a non-empty list");
        }

        ProjectTimeline timeline = parseTimeline(request.projectTimeline());
        List<TeamMember> members = normaliseMembers(request.teamMembers());

        log.info("Project '{}' initialised: {} days, {} team member(s)",
                request.projectName(), timeline.durationInDays(), members.size());

        return new ProjectDetails(
                request.projectName().trim(),
                isBlank(request.projectDescription()) ? "Not specified" : request.projectDescription().trim(),
                timeline,
                withoutBlanks(request.techStack()),
                members,
                withoutBlanks(request.goals()),
                withoutBlanks(request.constraints()));
    }

    static ProjectTimeline parseTimeline(String text) {
        Matcher m = TIMELINE.matcher(text.trim());
        if (!m.matches()) {
            throw new StageException(NAME, "Invalid project timeline format: \"" + text
                    + "\". Expected format: \"X days/weeks/months/years\"");
        }
        int amount;
        try {
            amount = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new StageException(NAME, "Project timeline is out of range: " + text, e);
        }
        String unit = m.group(2).toLowerCase(Locale.ROOT);
        long days = switch (unit) {
            case "day" -> amount;
            case "week" -> amount * 7L;
            case "month" -> amount * 30L;
            default -> amount * 365L;
        };
        if (days < MIN_DAYS) {
            throw new StageException(NAME, "Project duration too short: " + text
                    + ". Minimum duration is 1 week.");
        }
        if (days > MAX_DAYS) {
            throw new StageException(NAME, "Project duration too long: " + text
                    + ". Maximum duration is 2 years.");
        }
        return new ProjectTimeline(text.trim(), amount, unit, (int) days);
    }

    private static List<TeamMember> normaliseMembers(List<TeamMember> members) {
        List<TeamMember> result = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < members.size(); i++) {
            TeamMember member = members.get(i);
            if (member == null || isBlank(member.name())) {
                throw new StageException(NAME, "Team member #" + (i + 1) + " has no name");
            }
            String id = isBlank(member.id()) ? "member-" + (i + 1) : member.id().trim();
            if (!ids.add(id)) {
                throw new StageException(NAME, "Duplicate team member id: " + id);
            }
            String role = isBlank(member.role()) ? "Team Member" : member.role().trim();
            result.add(new TeamMember(id, member.name().trim(), role, member.skills(), member.availability()));
        }
        return result;
    }

    private static List<String> withoutBlanks(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> !isBlank(v)).map(String::trim).toList();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
