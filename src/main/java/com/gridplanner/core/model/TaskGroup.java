package com.gridplanner.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A maximal cluster of tasks whose date ranges overlap transitively.
 *
 * @param groupId       stable identifier within one layout run (e.g. "group_0")
 * @param tasks         member tasks in row-assignment order
 * @param startDate     earliest member start
 * @param endDate       latest member end
 * @param requiredRows  rows needed by the greedy assignment, capped at max rows per day
 * @param rowAssignments task ID to assigned row index
 * @param overflowCount tasks that found no free row under the cap and were put on row 0
 */
public record TaskGroup(
    String groupId,
    List<Task> tasks,
    LocalDate startDate,
    LocalDate endDate,
    int requiredRows,
    Map<String, Integer> rowAssignments,
    int overflowCount
) {

    public int rowOf(String taskId) {
        return rowAssignments.getOrDefault(taskId, 0);
    }

    public int size() {
        return tasks.size();
    }
}
