package com.gridplanner.core.model;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Positioned visual representation of a task, or of one month segment of a task.
 * Coordinates are grid units measured from the top-left corner of the calendar.
 *
 * @param taskId               owning task
 * @param startDate            first day covered by this bar
 * @param endDate              last day covered by this bar (inclusive)
 * @param x                    left edge
 * @param y                    top edge
 * @param width                horizontal extent
 * @param height               vertical extent
 * @param row                  row assigned within the task group
 * @param stackIndex           position of the bar in the group's stacking order
 * @param color                display color from the category catalog
 * @param opacity              0..1
 * @param zIndex               draw order, higher on top
 * @param priority             task priority
 * @param visualWeight         task visual weight
 * @param prominenceScore      task prominence score
 * @param milestone            the owning task is a milestone
 * @param isContinuation       continues a segment drawn in an earlier month
 * @param isStart              contains the first day of the task
 * @param isEnd                contains the last day of the task
 * @param crossesMonthBoundary the owning task spans more than one calendar month
 */
public record TaskBar(
    String taskId,
    LocalDate startDate,
    LocalDate endDate,
    double x,
    double y,
    double width,
    double height,
    int row,
    int stackIndex,
    String color,
    double opacity,
    int zIndex,
    int priority,
    double visualWeight,
    double prominenceScore,
    boolean milestone,
    boolean isContinuation,
    boolean isStart,
    boolean isEnd,
    boolean crossesMonthBoundary
) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public YearMonth month() {
        return YearMonth.from(startDate);
    }

    /** True when the date span lies in more than one calendar month. */
    public boolean spansMultipleMonths() {
        return !YearMonth.from(startDate).equals(YearMonth.from(endDate));
    }

    public TaskBar withY(double newY) {
        return new TaskBar(taskId, startDate, endDate, x, newY, width, height, row, stackIndex, color,
                opacity, zIndex, priority, visualWeight, prominenceScore, milestone,
                isContinuation, isStart, isEnd, crossesMonthBoundary);
    }

    public TaskBar withGeometry(double newX, double newY, double newWidth, double newHeight) {
        return new TaskBar(taskId, startDate, endDate, newX, newY, newWidth, newHeight, row, stackIndex, color,
                opacity, zIndex, priority, visualWeight, prominenceScore, milestone,
                isContinuation, isStart, isEnd, crossesMonthBoundary);
    }

    /** A month slice of this bar with its own span, horizontal geometry and start/end flags. */
    public TaskBar segment(LocalDate segmentStart, LocalDate segmentEnd, double segmentX, double segmentWidth,
                           boolean continuation, boolean start, boolean end) {
        return new TaskBar(taskId, segmentStart, segmentEnd, segmentX, y, segmentWidth, height, row, stackIndex,
                color, opacity, zIndex, priority, visualWeight, prominenceScore, milestone,
                continuation, start, end, true);
    }
}
