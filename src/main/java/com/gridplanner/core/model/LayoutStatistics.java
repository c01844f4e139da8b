package com.gridplanner.core.model;

/**
 * Aggregate geometry and quality figures for one layout run.
 */
public record LayoutStatistics(
    int totalTasks,
    int processedBars,
    int groupCount,
    int conflictsResolved,
    int residualCollisions,
    int overflowCount,
    int monthBoundaryCount,
    double averageBarHeight,
    double maxBarHeight,
    double averageBarWidth,
    double maxBarWidth,
    double averageStackHeight,
    double spaceEfficiency,
    double alignmentScore,
    double spacingScore,
    double visualBalance,
    double gridUtilization
) {
}
