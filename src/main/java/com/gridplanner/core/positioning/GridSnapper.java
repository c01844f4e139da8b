package com.gridplanner.core.positioning;

import com.gridplanner.core.model.TaskBar;

/**
 * Rounds bar geometry to the grid resolution.
 */
public final class GridSnapper {

    private GridSnapper() {}

    public static double snap(double value, double resolution) {
        return Math.round(value / resolution) * resolution;
    }

    /** Snaps position and size; sizes never collapse below one resolution step. */
    public static TaskBar snap(TaskBar bar, double resolution) {
        return bar.withGeometry(
                snap(bar.x(), resolution),
                snap(bar.y(), resolution),
                Math.max(resolution, snap(bar.width(), resolution)),
                Math.max(resolution, snap(bar.height(), resolution)));
    }

    /** Distance from {@code value} to the nearest grid line. */
    public static double offGrid(double value, double resolution) {
        double remainder = Math.abs(value % resolution);
        return Math.min(remainder, resolution - remainder);
    }
}
