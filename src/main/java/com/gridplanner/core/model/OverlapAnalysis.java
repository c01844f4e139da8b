package com.gridplanner.core.model;

import java.util.List;

/**
 * Result of overlap detection across all task groups of a layout run.
 */
public record OverlapAnalysis(
    int totalTasks,
    int overlappingTasks,
    List<OverlapGroup> groups,
    int totalOverlaps,
    int criticalOverlaps,
    int highOverlaps,
    int mediumOverlaps,
    int lowOverlaps,
    String summary
) {

    public List<Overlap> allOverlaps() {
        return groups.stream().flatMap(g -> g.overlaps().stream()).toList();
    }

    public List<Overlap> overlapsBySeverity(OverlapSeverity severity) {
        return allOverlaps().stream().filter(o -> o.severity() == severity).toList();
    }

    public List<Overlap> overlapsByType(OverlapType type) {
        return allOverlaps().stream().filter(o -> o.type() == type).toList();
    }

    public boolean hasCriticalOverlaps() {
        return criticalOverlaps > 0;
    }
}
