package com.gridplanner.core.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * A validated, time-bounded unit of work to be placed on the calendar grid.
 * 
 * @param id unique identifier (e.g., "T-001")
 * @param name display name; a name containing "MILESTONE" flags a milestone
 * @param category category key looked up in the category catalog
 * @param description free-form description
 * @param startDate first day of the task
 * @param endDate last day of the task (inclusive, never before startDate)
 * @param priority higher value = more prominent
 * @param status status label supplied by the data source
 * @param assignee person responsible
 */
public record Task(
    String id,
    String name,
    String category,
    String description,
    LocalDate startDate,
    LocalDate endDate,
    int priority,
    String status,
    String assignee
) {

    /** Elapsed days between start and end; 0 for a single-day task. */
    public long durationDays() {
        return ChronoUnit.DAYS.between(startDate, endDate);
    }

    /** Number of calendar days the task covers, counting both ends. */
    public long spanDays() {
        return durationDays() + 1;
    }

    /** True when both tasks share at least one calendar day. */
    public boolean overlaps(Task other) {
        return !startDate.isAfter(other.endDate) && !other.startDate.isAfter(endDate);
    }

    public boolean isMilestone() {
        return name != null && name.toUpperCase(Locale.ROOT).contains("MILESTONE");
    }
}
