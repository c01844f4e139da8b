package com.gridplanner.core.model;

import com.gridplanner.core.config.InvalidGridConfigException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable grid configuration for one layout run. Never mutated by the layout core.
 *
 * @param calendarStart         first day shown on the grid
 * @param calendarEnd           last day shown on the grid (inclusive)
 * @param dayWidth              width of one day column
 * @param dayHeight             height of one day cell
 * @param rowHeight             height of one stacking row
 * @param maxRowsPerDay         row cap for stacking; overflow reuses row 0
 * @param overlapThreshold      minimum shared time for two tasks to count as overlapping
 * @param monthBoundaryGap      horizontal gap inserted at each month boundary
 * @param minTaskSpacing        smallest vertical gap enforced between stacked bars
 * @param maxTaskSpacing        largest vertical gap a spacing rule may demand
 * @param snapToGrid            round coordinates to {@code gridResolution}
 * @param gridResolution        snapping and utilization cell size
 * @param alignmentTolerance    distance from a grid line still counted as aligned
 * @param collisionBuffer       extra vertical clearance required between bars
 * @param highPriorityThreshold priority at or above which a task is treated as high priority
 * @param urgencyWindowDays     tasks starting within this many days of the reference date are more urgent
 */
public record GridConfig(
    LocalDate calendarStart,
    LocalDate calendarEnd,
    double dayWidth,
    double dayHeight,
    double rowHeight,
    int maxRowsPerDay,
    Duration overlapThreshold,
    double monthBoundaryGap,
    double minTaskSpacing,
    double maxTaskSpacing,
    boolean snapToGrid,
    double gridResolution,
    double alignmentTolerance,
    double collisionBuffer,
    int highPriorityThreshold,
    int urgencyWindowDays
) {

    public static Builder builder(LocalDate calendarStart, LocalDate calendarEnd) {
        return new Builder(calendarStart, calendarEnd);
    }

    /**
     * Checks the configuration before any layout work begins.
     *
     * @throws InvalidGridConfigException listing every violated constraint
     */
    public GridConfig validate() {
        var errors = new ArrayList<String>();
        if (calendarStart == null || calendarEnd == null) {
            errors.add("calendar start and end are required");
        } else if (calendarEnd.isBefore(calendarStart)) {
            errors.add("calendar end " + calendarEnd + " is before calendar start " + calendarStart);
        }
        requirePositive(errors, "dayWidth", dayWidth);
        requirePositive(errors, "dayHeight", dayHeight);
        requirePositive(errors, "rowHeight", rowHeight);
        requirePositive(errors, "gridResolution", gridResolution);
        if (maxRowsPerDay <= 0) {
            errors.add("maxRowsPerDay must be positive but was " + maxRowsPerDay);
        }
        if (overlapThreshold == null || overlapThreshold.isNegative()) {
            errors.add("overlapThreshold must be zero or positive");
        }
        requireNonNegative(errors, "monthBoundaryGap", monthBoundaryGap);
        requireNonNegative(errors, "minTaskSpacing", minTaskSpacing);
        requireNonNegative(errors, "maxTaskSpacing", maxTaskSpacing);
        requireNonNegative(errors, "alignmentTolerance", alignmentTolerance);
        requireNonNegative(errors, "collisionBuffer", collisionBuffer);
        if (minTaskSpacing > maxTaskSpacing) {
            errors.add("minTaskSpacing " + minTaskSpacing + " exceeds maxTaskSpacing " + maxTaskSpacing);
        }
        if (urgencyWindowDays < 0) {
            errors.add("urgencyWindowDays must not be negative but was " + urgencyWindowDays);
        }
        if (!errors.isEmpty()) {
            throw new InvalidGridConfigException(errors);
        }
        return this;
    }

    /** Same grid restricted to another calendar range, e.g. a single month. */
    public GridConfig withCalendar(LocalDate start, LocalDate end) {
        return new GridConfig(start, end, dayWidth, dayHeight, rowHeight, maxRowsPerDay, overlapThreshold,
                monthBoundaryGap, minTaskSpacing, maxTaskSpacing, snapToGrid, gridResolution,
                alignmentTolerance, collisionBuffer, highPriorityThreshold, urgencyWindowDays);
    }

    /** Days from calendar start to {@code date}; negative before the start. */
    public long daysFromStart(LocalDate date) {
        return ChronoUnit.DAYS.between(calendarStart, date);
    }

    /** Whole months from the calendar's first month to the month of {@code date}. */
    public long monthIndex(LocalDate date) {
        return ChronoUnit.MONTHS.between(YearMonth.from(calendarStart), YearMonth.from(date));
    }

    /** Left edge of the column for {@code date}. */
    public double xFor(LocalDate date) {
        return daysFromStart(date) * dayWidth + monthIndex(date) * monthBoundaryGap;
    }

    /** Horizontal extent of an inclusive date span. */
    public double widthFor(LocalDate start, LocalDate end) {
        return (ChronoUnit.DAYS.between(start, end) + 1) * dayWidth;
    }

    public long calendarDays() {
        return ChronoUnit.DAYS.between(calendarStart, calendarEnd) + 1;
    }

    public double availableWidth() {
        return xFor(calendarEnd) + dayWidth;
    }

    public double availableHeight() {
        return dayHeight;
    }

    private static void requirePositive(List<String> errors, String name, double value) {
        if (!(value > 0)) {
            errors.add(name + " must be positive but was " + value);
        }
    }

    private static void requireNonNegative(List<String> errors, String name, double value) {
        if (!(value >= 0)) {
            errors.add(name + " must not be negative but was " + value);
        }
    }

    public static final class Builder {
        private final LocalDate calendarStart;
        private final LocalDate calendarEnd;
        private double dayWidth = 20.0;
        private double dayHeight = 60.0;
        private double rowHeight = 12.0;
        private int maxRowsPerDay = 3;
        private Duration overlapThreshold = Duration.ofHours(1);
        private double monthBoundaryGap = 0.0;
        private double minTaskSpacing = 1.0;
        private double maxTaskSpacing = 10.0;
        private boolean snapToGrid = true;
        private double gridResolution = 1.0;
        private double alignmentTolerance = 0.5;
        private double collisionBuffer = 1.0;
        private int highPriorityThreshold = 4;
        private int urgencyWindowDays = 7;

        private Builder(LocalDate calendarStart, LocalDate calendarEnd) {
            this.calendarStart = calendarStart;
            this.calendarEnd = calendarEnd;
        }

        public Builder dayWidth(double dayWidth) { this.dayWidth = dayWidth; return this; }
        public Builder dayHeight(double dayHeight) { this.dayHeight = dayHeight; return this; }
        public Builder rowHeight(double rowHeight) { this.rowHeight = rowHeight; return this; }
        public Builder maxRowsPerDay(int maxRowsPerDay) { this.maxRowsPerDay = maxRowsPerDay; return this; }
        public Builder overlapThreshold(Duration overlapThreshold) { this.overlapThreshold = overlapThreshold; return this; }
        public Builder monthBoundaryGap(double monthBoundaryGap) { this.monthBoundaryGap = monthBoundaryGap; return this; }
        public Builder minTaskSpacing(double minTaskSpacing) { this.minTaskSpacing = minTaskSpacing; return this; }
        public Builder maxTaskSpacing(double maxTaskSpacing) { this.maxTaskSpacing = maxTaskSpacing; return this; }
        public Builder snapToGrid(boolean snapToGrid) { this.snapToGrid = snapToGrid; return this; }
        public Builder gridResolution(double gridResolution) { this.gridResolution = gridResolution; return this; }
        public Builder alignmentTolerance(double alignmentTolerance) { this.alignmentTolerance = alignmentTolerance; return this; }
        public Builder collisionBuffer(double collisionBuffer) { this.collisionBuffer = collisionBuffer; return this; }
        public Builder highPriorityThreshold(int highPriorityThreshold) { this.highPriorityThreshold = highPriorityThreshold; return this; }
        public Builder urgencyWindowDays(int urgencyWindowDays) { this.urgencyWindowDays = urgencyWindowDays; return this; }

        public GridConfig build() {
            return new GridConfig(calendarStart, calendarEnd, dayWidth, dayHeight, rowHeight, maxRowsPerDay,
                    overlapThreshold, monthBoundaryGap, minTaskSpacing, maxTaskSpacing, snapToGrid,
                    gridResolution, alignmentTolerance, collisionBuffer, highPriorityThreshold, urgencyWindowDays);
        }
    }
}
