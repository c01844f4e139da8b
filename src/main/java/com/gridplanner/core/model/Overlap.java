package com.gridplanner.core.model;

import java.time.Duration;
import java.time.LocalDate;

/**
 * A classified temporal intersection between two tasks.
 *
 * @param task1Id        first task of the pair
 * @param task2Id        second task of the pair
 * @param type           intersection shape
 * @param severity       how serious the conflict is
 * @param startDate      first shared day (for ADJACENT: the day the later task starts)
 * @param endDate        last shared day (for ADJACENT: the day the earlier task ends)
 * @param duration       length of the shared time span
 * @param overlapDays    number of shared calendar days
 * @param conflictReason human-readable explanation
 * @param resolutionHint suggested fix
 * @param priority       the higher of the two task priorities
 */
public record Overlap(
    String task1Id,
    String task2Id,
    OverlapType type,
    OverlapSeverity severity,
    LocalDate startDate,
    LocalDate endDate,
    Duration duration,
    int overlapDays,
    String conflictReason,
    String resolutionHint,
    int priority
) {

    public boolean involves(String taskId) {
        return task1Id.equals(taskId) || task2Id.equals(taskId);
    }
}
