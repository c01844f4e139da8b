package com.gridplanner.core.positioning;

import com.gridplanner.core.config.CategoryCatalog;
import com.gridplanner.core.model.CategoryStyle;
import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskBar;
import com.gridplanner.core.model.TaskGroup;
import com.gridplanner.core.model.TaskScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Maps grouped tasks to grid coordinates.
 * <p>
 * X follows the elapsed days since the calendar start, Y follows the alignment anchor plus the
 * assigned row. Spacing rules then push bars on later rows down until the required gap to every
 * horizontally overlapping bar on an earlier row is met, and the result is optionally snapped.
 */
@Service
public class SpatialPositioner {

    private static final Logger log = LoggerFactory.getLogger(SpatialPositioner.class);

    static final double DEFAULT_OPACITY = 0.9;
    static final double MIN_HEIGHT_FACTOR = 0.5;
    static final double MAX_HEIGHT_FACTOR = 0.8;

    private final CategoryCatalog categories;

    public SpatialPositioner(CategoryCatalog categories) {
        this.categories = categories;
    }

    public List<TaskBar> position(List<TaskGroup> groups, Map<String, TaskScore> scores, GridConfig config) {
        return position(groups, scores, config, PositioningRules.defaults(config));
    }

    public List<TaskBar> position(List<TaskGroup> groups, Map<String, TaskScore> scores, GridConfig config,
                                  PositioningRules rules) {
        var bars = new ArrayList<TaskBar>();
        for (TaskGroup group : groups) {
            List<Task> tasks = group.tasks();
            for (int i = 0; i < tasks.size(); i++) {
                Task task = tasks.get(i);
                bars.add(initialBar(task, group.rowOf(task.id()), i, scoreOf(scores, task), config, rules));
            }
        }

        List<TaskBar> spaced = applySpacing(bars, config, rules);
        if (!config.snapToGrid()) {
            return spaced;
        }
        var snapped = new ArrayList<TaskBar>(spaced.size());
        for (TaskBar bar : spaced) {
            snapped.add(GridSnapper.snap(bar, config.gridResolution()));
        }
        return snapped;
    }

    TaskBar initialBar(Task task, int row, int stackIndex, TaskScore score, GridConfig config,
                       PositioningRules rules) {
        CategoryStyle category = categories.lookup(task.category());
        AlignmentRule alignment = rules.alignmentFor(task.priority(), score.milestone());

        double x = config.xFor(task.startDate());
        double width = config.widthFor(task.startDate(), task.endDate());
        double height = heightFor(score.visualWeight(), config.rowHeight());
        double y = alignment.anchorFraction() * config.dayHeight() + row * config.rowHeight();

        // covers the whole task; month slices get their own flags from the segmenter
        boolean crossesMonth = !YearMonth.from(task.startDate()).equals(YearMonth.from(task.endDate()));
        return new TaskBar(task.id(), task.startDate(), task.endDate(), x, y, width, height, row, stackIndex,
                category.color(), DEFAULT_OPACITY, category.weight(), task.priority(),
                score.visualWeight(), score.prominenceScore(), score.milestone(), false, true, true, crossesMonth);
    }

    static double heightFor(double visualWeight, double rowHeight) {
        double height = rowHeight * visualWeight;
        return Math.max(MIN_HEIGHT_FACTOR * rowHeight, Math.min(MAX_HEIGHT_FACTOR * rowHeight, height));
    }

    /**
     * Processes bars row by row; each bar is pushed below every already placed, horizontally
     * overlapping bar on an earlier row plus the spacing the rules demand for that pair.
     */
    List<TaskBar> applySpacing(List<TaskBar> bars, GridConfig config, PositioningRules rules) {
        var order = new ArrayList<Integer>(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingInt((Integer i) -> bars.get(i).row())
                .thenComparingDouble(i -> bars.get(i).x())
                .thenComparing(i -> bars.get(i).taskId()));

        var result = new ArrayList<>(bars);
        var placed = new ArrayList<TaskBar>(bars.size());
        for (int index : order) {
            TaskBar bar = bars.get(index);
            double y = bar.y();
            for (TaskBar above : placed) {
                if (above.row() >= bar.row() || !overlapsHorizontally(above, bar)) {
                    continue;
                }
                double spacing = rules.spacingFor(above.priority(), above.milestone(),
                        bar.priority(), bar.milestone(), config);
                double minY = above.bottom() + spacing;
                if (y < minY) {
                    log.debug("Spacing moves {} from y={} to y={} below {}", bar.taskId(), y, minY, above.taskId());
                    y = minY;
                }
            }
            TaskBar spaced = y == bar.y() ? bar : bar.withY(y);
            placed.add(spaced);
            result.set(index, spaced);
        }
        return result;
    }

    static boolean overlapsHorizontally(TaskBar a, TaskBar b) {
        return a.x() < b.right() && b.x() < a.right();
    }

    private static TaskScore scoreOf(Map<String, TaskScore> scores, Task task) {
        TaskScore score = scores.get(task.id());
        if (score == null) {
            throw new IllegalStateException("No score computed for task " + task.id());
        }
        return score;
    }
}
