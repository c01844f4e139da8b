package com.gridplanner.core.engine;

import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.TaskBar;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports bars outside the calendar area and bars sharing a row with an overlapping bar.
 * Findings are advisory; they never fail a layout run.
 */
@Component
public class LayoutValidator {

    public List<String> validate(List<TaskBar> bars, GridConfig config) {
        var issues = new ArrayList<String>();
        double width = config.availableWidth();
        for (TaskBar bar : bars) {
            if (bar.x() < 0 || bar.right() > width) {
                issues.add("Task %s (%s to %s) extends beyond the calendar range"
                        .formatted(bar.taskId(), bar.startDate(), bar.endDate()));
            }
            if (bar.y() < 0) {
                issues.add("Task %s has a negative vertical position %.1f".formatted(bar.taskId(), bar.y()));
            }
        }
        for (int i = 0; i < bars.size(); i++) {
            for (int j = i + 1; j < bars.size(); j++) {
                TaskBar a = bars.get(i);
                TaskBar b = bars.get(j);
                if (a.row() == b.row() && !a.taskId().equals(b.taskId())
                        && a.x() < b.right() && b.x() < a.right()) {
                    issues.add("Tasks %s and %s share row %d over the same days"
                            .formatted(a.taskId(), b.taskId(), a.row()));
                }
            }
        }
        return issues;
    }
}
