package com.gridplanner.core.boundary;

import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.TaskBar;
import com.gridplanner.core.positioning.GridSnapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits bars that cross a calendar-month boundary into one segment per month.
 * <p>
 * Each segment keeps the bar's row and vertical geometry, narrows the date span to its month and
 * recomputes X and width from that span. The segment holding the task's first day is the start,
 * the one holding its last day is the end, and every later segment is a continuation.
 */
@Service
public class MonthBoundarySegmenter {

    private static final Logger log = LoggerFactory.getLogger(MonthBoundarySegmenter.class);

    /**
     * Segments every bar and keeps the month slices the calendar shows. A task lying entirely
     * outside the calendar keeps all its slices so the layout validator can report it.
     */
    public List<TaskBar> segmentAll(List<TaskBar> bars, GridConfig config) {
        var result = new ArrayList<TaskBar>(bars.size());
        for (TaskBar bar : bars) {
            List<TaskBar> segments = segment(bar, config);
            List<TaskBar> visible = segments.stream()
                    .filter(s -> withinCalendar(s, config))
                    .toList();
            if (visible.isEmpty() || visible.size() == segments.size()) {
                result.addAll(segments);
            } else {
                log.debug("Dropped {} month segments of {} outside the calendar",
                        segments.size() - visible.size(), bar.taskId());
                result.addAll(visible);
            }
        }
        return result;
    }

    /**
     * @return the bar itself when it lies within one month, otherwise its month segments in date order
     */
    public List<TaskBar> segment(TaskBar bar, GridConfig config) {
        if (!bar.spansMultipleMonths()) {
            return List.of(bar);
        }

        YearMonth first = YearMonth.from(bar.startDate());
        YearMonth last = YearMonth.from(bar.endDate());
        var segments = new ArrayList<TaskBar>();
        for (YearMonth month = first; !month.isAfter(last); month = month.plusMonths(1)) {
            LocalDate start = month.equals(first) ? bar.startDate() : month.atDay(1);
            LocalDate end = month.equals(last) ? bar.endDate() : month.atEndOfMonth();
            double x = config.xFor(start);
            double width = config.widthFor(start, end);
            if (config.snapToGrid()) {
                x = GridSnapper.snap(x, config.gridResolution());
                width = Math.max(config.gridResolution(), GridSnapper.snap(width, config.gridResolution()));
            }

            boolean isFirst = month.equals(first);
            boolean isLast = month.equals(last);
            segments.add(bar.segment(start, end, x, width,
                    !isFirst || bar.isContinuation(),
                    isFirst && bar.isStart(),
                    isLast && bar.isEnd()));
        }
        log.debug("Split {} into {} month segments", bar.taskId(), segments.size());
        return segments;
    }

    static boolean withinCalendar(TaskBar segment, GridConfig config) {
        return !segment.endDate().isBefore(config.calendarStart()) && !segment.startDate().isAfter(config.calendarEnd());
    }
}
