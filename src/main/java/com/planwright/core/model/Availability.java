package com.planwright.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working-time model of a team member. A project file may give a plain number
 * of weekly hours instead of the full object.
 *
 * @param baseHoursPerWeek  contracted weekly hours (nullable, defaults to 40)
 * @param timeOff           planned absences
 * @param allocationChanges dated changes to the share of time given to this project
 * @param schedule          per-day overrides keyed by lower-case day name ("monday")
 * @param projectHistory    past projects with performance ratings
 */
public record Availability(
    @JsonProperty("baseHoursPerWeek") Double baseHoursPerWeek,
    @JsonProperty("timeOff") List<TimeOffPeriod> timeOff,
    @JsonProperty("allocationChanges") List<AllocationChange> allocationChanges,
    @JsonProperty("schedule") Map<String, DaySchedule> schedule,
    @JsonProperty("projectHistory") List<ProjectHistoryEntry> projectHistory
) implements Serializable {

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Availability {
        timeOff = timeOff == null ? List.of() : List.copyOf(timeOff);
        allocationChanges = allocationChanges == null ? List.of() : List.copyOf(allocationChanges);
        schedule = schedule == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schedule));
        projectHistory = projectHistory == null ? List.of() : List.copyOf(projectHistory);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Availability weekly(double hoursPerWeek) {
        return new Availability(hoursPerWeek, null, null, null, null);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Availability weekly(int hoursPerWeek) {
        return weekly((double) hoursPerWeek);
    }

    /**
     * A period away from the project, inclusive on both ends.
     */
    public record TimeOffPeriod(
        java.time.LocalDate start,
        java.time.LocalDate end,
        Boolean fullDay
    ) implements Serializable {}

    /**
     * From {@code effectiveDate} on, only {@code allocationPercentage} of the base hours go to this project.
     */
    public record AllocationChange(
        java.time.LocalDate effectiveDate,
        Double allocationPercentage
    ) implements Serializable {}

    public record DaySchedule(
        Boolean available,
        Double hours
    ) implements Serializable {}

    /**
     * @param performanceRating rating from 1 (poor) to 5 (excellent), nullable
     */
    public record ProjectHistoryEntry(
        String projectName,
        java.time.LocalDate startDate,
        java.time.LocalDate endDate,
        Double performanceRating
    ) implements Serializable {}
}
