package com.planwright.core.scheduler;

import com.planwright.core.model.Availability;
import com.planwright.core.model.Availability.AllocationChange;
import com.planwright.core.model.Availability.DaySchedule;
import com.planwright.core.model.Availability.ProjectHistoryEntry;
import com.planwright.core.model.Availability.TimeOffPeriod;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a member's {@link Availability} into effective weekly hours for a given date.
 * <p>
 * Rules are applied in order: an active full-day time-off period zeroes the
 * week, the latest allocation change effective on or before the date scales
 * the base hours, and the date's day-of-week schedule entry overrides both
 * (unavailable gives zero, a daily hour figure is multiplied by five).
 */
public class AvailabilityCalculator {

    private static final int WORK_DAYS = 5;
    private static final int RECENT_PROJECTS = 3;

    private final LocalDate today;
    private final double defaultWeeklyHours;

    public AvailabilityCalculator(LocalDate today, double defaultWeeklyHours) {
        this.today = Objects.requireNonNull(today, "today");
        this.defaultWeeklyHours = defaultWeeklyHours;
    }

    public EffectiveAvailability calculate(Availability availability) {
        if (availability == null) {
            return new EffectiveAvailability(defaultWeeklyHours, 100, null);
        }
        double hours = availability.baseHoursPerWeek() != null
                ? availability.baseHoursPerWeek()
                : defaultWeeklyHours;
        double allocation = 100;

        boolean fullDayOff = availability.timeOff().stream()
                .filter(this::isActive)
                .anyMatch(p -> Boolean.TRUE.equals(p.fullDay()));
        if (fullDayOff) {
            hours = 0;
        }

        AllocationChange latest = availability.allocationChanges().stream()
                .filter(c -> c.effectiveDate() != null && !c.effectiveDate().isAfter(today))
                .filter(c -> c.allocationPercentage() != null)
                .max(Comparator.comparing(AllocationChange::effectiveDate))
                .orElse(null);
        if (latest != null) {
            allocation = latest.allocationPercentage();
            hours = hours * allocation / 100;
        }

        DaySchedule day = scheduleFor(availability.schedule());
        if (day != null) {
            if (!Boolean.TRUE.equals(day.available())) {
                hours = 0;
            } else if (day.hours() != null) {
                hours = day.hours() * WORK_DAYS;
            }
        }

        return new EffectiveAvailability(Math.max(0, hours), allocation,
                historicalPerformance(availability.projectHistory()));
    }

    /**
     * Aggregates rated projects. Returns {@code null} when no entry carries a rating.
     */
    public HistoricalPerformance historicalPerformance(List<ProjectHistoryEntry> history) {
        if (history == null || history.isEmpty()) {
            return null;
        }
        List<Double> ratings = history.stream()
                .map(ProjectHistoryEntry::performanceRating)
                .filter(Objects::nonNull)
                .toList();
        if (ratings.isEmpty()) {
            return null;
        }
        double average = ratings.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        int completed = (int) history.stream()
                .filter(p -> p.endDate() != null && p.endDate().isBefore(today))
                .count();
        List<String> recent = history.stream()
                .sorted(Comparator.comparing(ProjectHistoryEntry::startDate,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(RECENT_PROJECTS)
                .map(ProjectHistoryEntry::projectName)
                .toList();
        return new HistoricalPerformance(average, completed, history.size(), recent);
    }

    private boolean isActive(TimeOffPeriod period) {
        return period.start() != null && period.end() != null
                && !today.isBefore(period.start()) && !today.isAfter(period.end());
    }

    private DaySchedule scheduleFor(Map<String, DaySchedule> schedule) {
        String dayName = today.getDayOfWeek().name();
        for (Map.Entry<String, DaySchedule> entry : schedule.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(dayName)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
