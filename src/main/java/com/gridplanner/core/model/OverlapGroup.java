package com.gridplanner.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Overlaps detected inside one {@link TaskGroup}, with the group's aggregate severity.
 */
public record OverlapGroup(
    String groupId,
    List<Task> tasks,
    List<Overlap> overlaps,
    LocalDate startDate,
    LocalDate endDate,
    OverlapSeverity maxSeverity,
    int conflictCount,
    String resolution
) {
}
