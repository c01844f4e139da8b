package com.gridplanner.core.model;

/**
 * Prominence scores of one task, used for stacking order and collision wins.
 *
 * @param taskId          scored task
 * @param band            urgency band after the reference-date adjustment
 * @param baseWeight      weight derived from the task priority, in [0,1]
 * @param visualWeight    base weight adjusted for duration, category and milestone status, in [0,1]
 * @param prominenceScore visual weight scaled by urgency and milestone bonus, in [0,1]
 * @param milestone       whether the task counts as a milestone
 */
public record TaskScore(
    String taskId,
    UrgencyBand band,
    double baseWeight,
    double visualWeight,
    double prominenceScore,
    boolean milestone
) {
}
