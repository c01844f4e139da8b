package com.gridplanner.core.positioning;

import com.gridplanner.core.model.TaskBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Single-pass, prominence-ordered collision nudge.
 * <p>
 * Bars are ordered by prominence, then milestones ahead of other tasks, then priority. For each
 * pair {@code (i, j)} with {@code i} ahead of {@code j}, a collision moves bar {@code j} directly
 * below bar {@code i} plus the buffer.
 * A moved bar can land on a bar already visited, so dense clusters may keep residual collisions;
 * these are counted, not resolved further.
 */
@Service
public class CollisionResolver {

    private static final Logger log = LoggerFactory.getLogger(CollisionResolver.class);

    static final Comparator<TaskBar> RESOLUTION_ORDER =
            Comparator.comparingDouble(TaskBar::prominenceScore).reversed()
                    .thenComparing(TaskBar::milestone, Comparator.reverseOrder())
                    .thenComparing(Comparator.comparingInt(TaskBar::priority).reversed())
                    .thenComparing(TaskBar::taskId)
                    .thenComparing(TaskBar::startDate);

    public CollisionReport resolve(List<TaskBar> bars, double buffer) {
        var ordered = new ArrayList<>(bars);
        ordered.sort(RESOLUTION_ORDER);

        int resolved = 0;
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                TaskBar winner = ordered.get(i);
                TaskBar loser = ordered.get(j);
                if (collides(winner, loser, buffer)) {
                    double newY = winner.bottom() + buffer;
                    log.debug("Collision {} / {}: moving {} to y={}", winner.taskId(), loser.taskId(),
                            loser.taskId(), newY);
                    ordered.set(j, loser.withY(newY));
                    resolved++;
                }
            }
        }

        int residual = countCollisions(ordered, buffer);
        if (residual > 0) {
            log.debug("{} collisions remain after a single pass", residual);
        }
        return new CollisionReport(List.copyOf(ordered), resolved, residual);
    }

    /**
     * Bounding boxes intersect horizontally and come within {@code buffer} of each other vertically.
     */
    public static boolean collides(TaskBar a, TaskBar b, double buffer) {
        boolean horizontal = a.x() < b.right() && b.x() < a.right();
        boolean vertical = a.y() < b.bottom() + buffer && b.y() < a.bottom() + buffer;
        return horizontal && vertical;
    }

    public static int countCollisions(List<TaskBar> bars, double buffer) {
        int count = 0;
        for (int i = 0; i < bars.size(); i++) {
            for (int j = i + 1; j < bars.size(); j++) {
                if (collides(bars.get(i), bars.get(j), buffer)) {
                    count++;
                }
            }
        }
        return count;
    }
}
