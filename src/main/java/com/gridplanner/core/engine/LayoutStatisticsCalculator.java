package com.gridplanner.core.engine;

import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.LayoutStatistics;
import com.gridplanner.core.model.TaskBar;
import com.gridplanner.core.model.TaskGroup;
import com.gridplanner.core.positioning.GridSnapper;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate geometry and quality figures over the final bars of a layout run.
 * <p>
 * The available area is the calendar width (including month gaps) times one day height.
 */
@Component
public class LayoutStatisticsCalculator {

    /**
     * Inputs that the bars alone do not carry.
     *
     * @param totalTasks         tasks submitted to the run
     * @param conflictsResolved  pairs moved by the collision pass
     * @param residualCollisions pairs still colliding after it
     * @param monthBoundaryCount tasks split at a month boundary
     */
    public record RunCounts(int totalTasks, int conflictsResolved, int residualCollisions, int monthBoundaryCount) {
    }

    public LayoutStatistics calculate(List<TaskBar> bars, List<TaskGroup> groups, RunCounts counts,
                                      GridConfig config) {
        double availableWidth = config.availableWidth();
        double availableHeight = config.availableHeight();

        double totalHeight = 0, maxHeight = 0, totalWidth = 0, maxWidth = 0, usedArea = 0;
        for (TaskBar bar : bars) {
            totalHeight += bar.height();
            totalWidth += bar.width();
            maxHeight = Math.max(maxHeight, bar.height());
            maxWidth = Math.max(maxWidth, bar.width());
            usedArea += bar.width() * bar.height();
        }
        int n = bars.size();

        double stackHeight = 0;
        int overflow = 0;
        for (TaskGroup group : groups) {
            stackHeight += group.requiredRows() * config.rowHeight();
            overflow += group.overflowCount();
        }

        return new LayoutStatistics(
                counts.totalTasks(),
                n,
                groups.size(),
                counts.conflictsResolved(),
                counts.residualCollisions(),
                overflow,
                counts.monthBoundaryCount(),
                n == 0 ? 0.0 : totalHeight / n,
                maxHeight,
                n == 0 ? 0.0 : totalWidth / n,
                maxWidth,
                groups.isEmpty() ? 0.0 : stackHeight / groups.size(),
                Math.min(1.0, usedArea / (availableWidth * availableHeight)),
                alignmentScore(bars, config),
                spacingScore(bars, config),
                visualBalance(bars, availableWidth, availableHeight),
                gridUtilization(bars, availableWidth, availableHeight, config.gridResolution()));
    }

    /** Fraction of bars whose x and y both lie within tolerance of a grid line. */
    double alignmentScore(List<TaskBar> bars, GridConfig config) {
        if (bars.isEmpty()) {
            return 1.0;
        }
        int aligned = 0;
        for (TaskBar bar : bars) {
            if (GridSnapper.offGrid(bar.x(), config.gridResolution()) <= config.alignmentTolerance()
                    && GridSnapper.offGrid(bar.y(), config.gridResolution()) <= config.alignmentTolerance()) {
                aligned++;
            }
        }
        return (double) aligned / bars.size();
    }

    /**
     * Fraction of horizontally overlapping pairs whose vertical gap lies within the configured
     * spacing range; 1.0 when no bars overlap horizontally.
     */
    double spacingScore(List<TaskBar> bars, GridConfig config) {
        int pairs = 0, within = 0;
        for (int i = 0; i < bars.size(); i++) {
            for (int j = i + 1; j < bars.size(); j++) {
                TaskBar a = bars.get(i);
                TaskBar b = bars.get(j);
                if (!(a.x() < b.right() && b.x() < a.right())) {
                    continue;
                }
                pairs++;
                TaskBar upper = a.y() <= b.y() ? a : b;
                TaskBar lower = upper == a ? b : a;
                double gap = lower.y() - upper.bottom();
                if (gap >= config.minTaskSpacing() && gap <= config.maxTaskSpacing()) {
                    within++;
                }
            }
        }
        return pairs == 0 ? 1.0 : (double) within / pairs;
    }

    /** 1 minus the distance of the weight-centred centroid from the grid centre, over the half diagonal. */
    double visualBalance(List<TaskBar> bars, double width, double height) {
        double weightSum = 0, cx = 0, cy = 0;
        for (TaskBar bar : bars) {
            double w = bar.visualWeight();
            weightSum += w;
            cx += (bar.x() + bar.width() / 2) * w;
            cy += (bar.y() + bar.height() / 2) * w;
        }
        if (weightSum <= 0) {
            return 1.0;
        }
        cx /= weightSum;
        cy /= weightSum;
        double dx = cx - width / 2;
        double dy = cy - height / 2;
        double halfDiagonal = Math.sqrt(width * width + height * height) / 2;
        double balance = 1.0 - Math.sqrt(dx * dx + dy * dy) / halfDiagonal;
        return Math.max(0.0, Math.min(1.0, balance));
    }

    /** Fraction of resolution-sized cells of the available area touched by at least one bar. */
    double gridUtilization(List<TaskBar> bars, double width, double height, double resolution) {
        long columns = (long) Math.ceil(width / resolution);
        long rows = (long) Math.ceil(height / resolution);
        if (columns <= 0 || rows <= 0) {
            return 0.0;
        }
        Set<Long> occupied = new HashSet<>();
        for (TaskBar bar : bars) {
            long c0 = (long) Math.floor(Math.max(0.0, bar.x()) / resolution);
            long c1 = (long) Math.ceil(Math.min(width, bar.right()) / resolution);
            long r0 = (long) Math.floor(Math.max(0.0, bar.y()) / resolution);
            long r1 = (long) Math.ceil(Math.min(height, bar.bottom()) / resolution);
            for (long c = c0; c < c1; c++) {
                for (long r = r0; r < r1; r++) {
                    occupied.add(c * rows + r);
                }
            }
        }
        return (double) occupied.size() / (columns * rows);
    }
}
