package com.gridplanner.core.grouping;

import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskGroup;
import com.gridplanner.core.model.TaskScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions tasks into transitively overlapping groups and assigns each task a row.
 * <p>
 * Grouping seeds a group with the earliest ungrouped task and keeps absorbing any remaining
 * task that overlaps a member until a full scan absorbs nothing. Rows are assigned greedily:
 * each task takes the first row whose last task ended before it starts. When every row is busy
 * and the row cap is reached, the task is placed on row 0 and counted as overflow.
 */
@Service
public class TemporalGrouper {

    private static final Logger log = LoggerFactory.getLogger(TemporalGrouper.class);

    /** Start date ascending, longer tasks first on equal starts. */
    static final Comparator<Task> SEED_ORDER = Comparator.comparing(Task::startDate)
            .thenComparing(Comparator.comparingLong(Task::durationDays).reversed())
            .thenComparing(Task::id);

    /**
     * Groups the tasks and assigns rows.
     *
     * @param tasks         tasks to lay out
     * @param maxRowsPerDay row cap per group
     * @param scores        prominence per task ID; higher prominence claims upper rows on equal starts
     * @return groups in order of their earliest start
     */
    public List<TaskGroup> group(List<Task> tasks, int maxRowsPerDay, Map<String, TaskScore> scores) {
        List<List<Task>> clusters = cluster(tasks);
        var groups = new ArrayList<TaskGroup>(clusters.size());
        for (int i = 0; i < clusters.size(); i++) {
            groups.add(assignRows("group_" + i, clusters.get(i), maxRowsPerDay, scores));
        }
        log.debug("Grouped {} tasks into {} groups", tasks.size(), groups.size());
        return groups;
    }

    List<List<Task>> cluster(List<Task> tasks) {
        var sorted = new ArrayList<>(tasks);
        sorted.sort(SEED_ORDER);

        var clusters = new ArrayList<List<Task>>();
        Set<String> used = new HashSet<>();
        for (Task seed : sorted) {
            if (used.contains(seed.id())) continue;

            var members = new ArrayList<Task>();
            members.add(seed);
            used.add(seed.id());

            boolean absorbed = true;
            while (absorbed) {
                absorbed = false;
                for (Task candidate : sorted) {
                    if (used.contains(candidate.id())) continue;
                    if (overlapsAny(members, candidate)) {
                        members.add(candidate);
                        used.add(candidate.id());
                        absorbed = true;
                    }
                }
            }
            clusters.add(members);
        }
        return clusters;
    }

    private boolean overlapsAny(List<Task> members, Task candidate) {
        for (Task member : members) {
            if (member.overlaps(candidate)) {
                return true;
            }
        }
        return false;
    }

    TaskGroup assignRows(String groupId, List<Task> members, int maxRowsPerDay, Map<String, TaskScore> scores) {
        var ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparing(Task::startDate)
                .thenComparing(Comparator.comparingDouble((Task t) -> prominence(scores, t)).reversed())
                .thenComparing((Task t) -> isMilestone(scores, t), Comparator.reverseOrder())
                .thenComparing(Comparator.comparingInt(Task::priority).reversed())
                .thenComparing(Task::id));

        var rowEnds = new ArrayList<LocalDate>();
        var rows = new LinkedHashMap<String, Integer>();
        int overflow = 0;
        LocalDate groupStart = ordered.get(0).startDate();
        LocalDate groupEnd = ordered.get(0).endDate();

        for (Task task : ordered) {
            int row = firstFreeRow(rowEnds, task.startDate());
            if (row < 0) {
                if (rowEnds.size() < maxRowsPerDay) {
                    rowEnds.add(task.endDate());
                    row = rowEnds.size() - 1;
                } else {
                    row = 0;
                    overflow++;
                    if (task.endDate().isAfter(rowEnds.get(0))) {
                        rowEnds.set(0, task.endDate());
                    }
                    log.debug("  {} exceeds {} rows in {}, reusing row 0", task.id(), maxRowsPerDay, groupId);
                }
            } else {
                rowEnds.set(row, task.endDate());
            }
            rows.put(task.id(), row);

            if (task.startDate().isBefore(groupStart)) groupStart = task.startDate();
            if (task.endDate().isAfter(groupEnd)) groupEnd = task.endDate();
        }

        return new TaskGroup(groupId, List.copyOf(ordered), groupStart, groupEnd,
                Math.max(1, rowEnds.size()), Map.copyOf(rows), overflow);
    }

    /** First row whose last task ends strictly before {@code start}, or -1. */
    private int firstFreeRow(List<LocalDate> rowEnds, LocalDate start) {
        for (int i = 0; i < rowEnds.size(); i++) {
            if (rowEnds.get(i).isBefore(start)) {
                return i;
            }
        }
        return -1;
    }

    private static double prominence(Map<String, TaskScore> scores, Task task) {
        TaskScore score = scores.get(task.id());
        return score != null ? score.prominenceScore() : 0.0;
    }

    private static boolean isMilestone(Map<String, TaskScore> scores, Task task) {
        TaskScore score = scores.get(task.id());
        return score != null ? score.milestone() : task.isMilestone();
    }
}
