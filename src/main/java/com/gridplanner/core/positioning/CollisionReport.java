package com.gridplanner.core.positioning;

import com.gridplanner.core.model.TaskBar;

import java.util.List;

/**
 * Outcome of one collision-resolution pass.
 *
 * @param bars          bars in resolution order (prominence descending)
 * @param resolvedCount colliding pairs that were separated
 * @param residualCount colliding pairs left after the pass
 */
public record CollisionReport(
    List<TaskBar> bars,
    int resolvedCount,
    int residualCount
) {
}
