package com.gridplanner.core.overlap;

import com.gridplanner.core.model.Overlap;
import com.gridplanner.core.model.OverlapAnalysis;
import com.gridplanner.core.model.OverlapGroup;
import com.gridplanner.core.model.OverlapSeverity;
import com.gridplanner.core.model.OverlapType;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Classifies every overlapping pair of tasks inside each temporal group.
 * <p>
 * A task occupies the half-open span {@code [start 00:00, end+1 00:00)}. A pair only produces an
 * {@link Overlap} when the shared span is at least the configured precision; with a zero
 * precision, tasks that merely touch are reported as {@link OverlapType#ADJACENT}.
 */
@Service
public class OverlapDetector {

    private static final Logger log = LoggerFactory.getLogger(OverlapDetector.class);

    private static final Comparator<Overlap> SEVERITY_ORDER =
            Comparator.comparing(Overlap::severity).reversed()
                    .thenComparing(Comparator.comparingInt(Overlap::priority).reversed())
                    .thenComparing(Overlap::task1Id)
                    .thenComparing(Overlap::task2Id);

    /**
     * Analyzes all groups of a layout run.
     *
     * @param groups    temporal groups
     * @param precision minimum shared time for an overlap to count
     */
    public OverlapAnalysis analyze(List<TaskGroup> groups, Duration precision) {
        var overlapGroups = new ArrayList<OverlapGroup>(groups.size());
        int totalTasks = 0;
        for (TaskGroup group : groups) {
            totalTasks += group.size();
            overlapGroups.add(analyzeGroup(group, precision));
        }

        Set<String> involved = new HashSet<>();
        int total = 0, critical = 0, high = 0, medium = 0, low = 0;
        for (OverlapGroup group : overlapGroups) {
            for (Overlap overlap : group.overlaps()) {
                involved.add(overlap.task1Id());
                involved.add(overlap.task2Id());
                total++;
                switch (overlap.severity()) {
                    case CRITICAL -> critical++;
                    case HIGH -> high++;
                    case MEDIUM -> medium++;
                    case LOW -> low++;
                    default -> { }
                }
            }
        }

        String summary = summarize(totalTasks, involved.size(), overlapGroups.size(), total, critical, high, medium, low);
        log.debug("Overlap analysis: {} overlaps across {} groups", total, overlapGroups.size());
        return new OverlapAnalysis(totalTasks, involved.size(), List.copyOf(overlapGroups), total,
                critical, high, medium, low, summary);
    }

    OverlapGroup analyzeGroup(TaskGroup group, Duration precision) {
        var overlaps = new ArrayList<Overlap>();
        List<Task> tasks = group.tasks();
        for (int i = 0; i < tasks.size(); i++) {
            for (int j = i + 1; j < tasks.size(); j++) {
                analyzePair(tasks.get(i), tasks.get(j), precision).ifPresent(overlaps::add);
            }
        }
        overlaps.sort(SEVERITY_ORDER);

        OverlapSeverity max = OverlapSeverity.NONE;
        for (Overlap overlap : overlaps) {
            if (overlap.severity().isMoreSevereThan(max)) {
                max = overlap.severity();
            }
        }
        return new OverlapGroup(group.groupId(), group.tasks(), List.copyOf(overlaps),
                group.startDate(), group.endDate(), max, overlaps.size(), resolutionFor(overlaps));
    }

    /**
     * Classifies the intersection of two tasks.
     *
     * @return the overlap, or empty when the tasks neither share enough time nor touch
     */
    public Optional<Overlap> analyzePair(Task task1, Task task2, Duration precision) {
        LocalDate sharedStart = max(task1.startDate(), task2.startDate());
        LocalDate sharedEnd = min(task1.endDate(), task2.endDate());
        boolean intersects = !sharedStart.isAfter(sharedEnd);
        boolean touching = task1.endDate().plusDays(1).equals(task2.startDate())
                || task2.endDate().plusDays(1).equals(task1.startDate());
        if (!intersects && !touching) {
            return Optional.empty();
        }

        int overlapDays = intersects ? (int) ChronoUnit.DAYS.between(sharedStart, sharedEnd) + 1 : 0;
        Duration duration = Duration.ofDays(overlapDays);
        if (duration.compareTo(precision) < 0) {
            return Optional.empty();
        }

        OverlapType type = classify(task1, task2, intersects);
        OverlapSeverity severity = severityOf(type, task1, task2, overlapDays);
        int priority = Math.max(task1.priority(), task2.priority());

        LocalDate start = intersects ? sharedStart : max(task1.startDate(), task2.startDate());
        LocalDate end = intersects ? sharedEnd : min(task1.endDate(), task2.endDate());
        return Optional.of(new Overlap(task1.id(), task2.id(), type, severity, start, end, duration, overlapDays,
                reasonFor(task1, task2, type, severity), hintFor(type, severity), priority));
    }

    OverlapType classify(Task task1, Task task2, boolean intersects) {
        if (task1.startDate().equals(task2.startDate()) && task1.endDate().equals(task2.endDate())) {
            return OverlapType.IDENTICAL;
        }
        if (contains(task1, task2) || contains(task2, task1)) {
            return OverlapType.NESTED;
        }
        if (!intersects) {
            return OverlapType.ADJACENT;
        }
        return OverlapType.PARTIAL;
    }

    OverlapSeverity severityOf(OverlapType type, Task task1, Task task2, int overlapDays) {
        return switch (type) {
            case IDENTICAL -> OverlapSeverity.CRITICAL;
            case NESTED, COMPLETE -> OverlapSeverity.HIGH;
            case PARTIAL -> {
                double ratio = (double) overlapDays / Math.min(task1.spanDays(), task2.spanDays());
                if (ratio >= 0.8) yield OverlapSeverity.HIGH;
                if (ratio >= 0.5) yield OverlapSeverity.MEDIUM;
                yield OverlapSeverity.LOW;
            }
            case ADJACENT -> OverlapSeverity.LOW;
            case NONE -> OverlapSeverity.NONE;
        };
    }

    private String reasonFor(Task task1, Task task2, OverlapType type, OverlapSeverity severity) {
        String reason = switch (type) {
            case IDENTICAL -> "Tasks %s and %s have identical schedules".formatted(task1.id(), task2.id());
            case NESTED -> {
                Task inner = contains(task1, task2) ? task2 : task1;
                Task outer = inner == task1 ? task2 : task1;
                yield "Task %s is completely contained within task %s".formatted(inner.id(), outer.id());
            }
            case COMPLETE -> "Tasks %s and %s have complete schedule overlap".formatted(task1.id(), task2.id());
            case PARTIAL -> "Tasks %s and %s have partial schedule overlap".formatted(task1.id(), task2.id());
            case ADJACENT -> "Tasks %s and %s are adjacent in schedule".formatted(task1.id(), task2.id());
            case NONE -> "Tasks %s and %s do not overlap".formatted(task1.id(), task2.id());
        };
        return switch (severity) {
            case CRITICAL -> reason + " (CRITICAL)";
            case HIGH -> reason + " (HIGH)";
            default -> reason;
        };
    }

    private String hintFor(OverlapType type, OverlapSeverity severity) {
        String hint = switch (type) {
            case IDENTICAL -> "Consider merging tasks or adjusting one task's schedule";
            case NESTED -> "Consider making the nested task a subtask or adjusting schedules";
            case COMPLETE -> "Tasks cannot run simultaneously - reschedule one task";
            case PARTIAL -> "Consider adjusting start/end dates to reduce overlap";
            case ADJACENT -> "Consider adding buffer time between tasks";
            case NONE -> "Review task schedules for potential conflicts";
        };
        return switch (severity) {
            case CRITICAL -> "URGENT: " + hint;
            case HIGH -> "Important: " + hint;
            default -> hint;
        };
    }

    private String resolutionFor(List<Overlap> overlaps) {
        if (overlaps.isEmpty()) {
            return "No conflicts detected";
        }
        long critical = overlaps.stream().filter(o -> o.severity() == OverlapSeverity.CRITICAL).count();
        long high = overlaps.stream().filter(o -> o.severity() == OverlapSeverity.HIGH).count();
        if (critical > 0) {
            return "URGENT: %d critical conflicts require immediate attention".formatted(critical);
        }
        if (high > 0) {
            return "Important: %d high-priority conflicts need resolution".formatted(high);
        }
        return "Moderate: %d conflicts can be addressed during planning".formatted(overlaps.size());
    }

    private String summarize(int totalTasks, int overlappingTasks, int groupCount,
                             int total, int critical, int high, int medium, int low) {
        if (total == 0) {
            return "No task overlaps detected in %d tasks".formatted(totalTasks);
        }
        var sb = new StringBuilder("Detected %d overlaps affecting %d tasks".formatted(total, overlappingTasks));
        if (critical > 0) sb.append("; ").append(critical).append(" critical");
        if (high > 0) sb.append("; ").append(high).append(" high");
        if (medium > 0) sb.append("; ").append(medium).append(" medium");
        if (low > 0) sb.append("; ").append(low).append(" low");
        sb.append("; ").append(groupCount).append(" groups");
        return sb.toString();
    }

    private static boolean contains(Task outer, Task inner) {
        return !outer.startDate().isAfter(inner.startDate()) && !outer.endDate().isBefore(inner.endDate());
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
