package com.gridplanner.core.model;

import java.time.YearMonth;
import java.util.List;

/**
 * Everything one layout run produces for the renderer.
 *
 * @param taskBars        positioned bars, already split at month boundaries
 * @param groups          temporal groups with their row assignments
 * @param overlapAnalysis classified overlaps and conflict summaries
 * @param statistics      aggregate geometry figures
 * @param recommendations advisory messages for degraded layouts
 * @param layoutIssues    bars outside the calendar or sharing a row with another bar
 */
public record LayoutResult(
    List<TaskBar> taskBars,
    List<TaskGroup> groups,
    OverlapAnalysis overlapAnalysis,
    LayoutStatistics statistics,
    List<String> recommendations,
    List<String> layoutIssues
) {

    public List<TaskBar> barsForTask(String taskId) {
        return taskBars.stream().filter(b -> b.taskId().equals(taskId)).toList();
    }

    public List<TaskBar> barsForMonth(YearMonth month) {
        return taskBars.stream().filter(b -> b.month().equals(month)).toList();
    }

    public List<Overlap> conflicts() {
        return overlapAnalysis.allOverlaps();
    }
}
