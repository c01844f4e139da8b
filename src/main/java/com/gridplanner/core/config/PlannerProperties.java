package com.gridplanner.core.config;

import com.gridplanner.core.model.CategoryStyle;
import com.gridplanner.core.model.GridConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private Grid grid = new Grid();
    private List<Category> categories = new ArrayList<>();

    /**
     * Builds the immutable grid configuration for one calendar range.
     * Validation is left to the layout run so that CLI overrides are checked too.
     */
    public GridConfig toGridConfig(LocalDate calendarStart, LocalDate calendarEnd) {
        return GridConfig.builder(calendarStart, calendarEnd)
                .dayWidth(grid.dayWidth)
                .dayHeight(grid.dayHeight)
                .rowHeight(grid.rowHeight)
                .maxRowsPerDay(grid.maxRowsPerDay)
                .overlapThreshold(grid.overlapThreshold)
                .monthBoundaryGap(grid.monthBoundaryGap)
                .minTaskSpacing(grid.minTaskSpacing)
                .maxTaskSpacing(grid.maxTaskSpacing)
                .snapToGrid(grid.snapToGrid)
                .gridResolution(grid.gridResolution)
                .alignmentTolerance(grid.alignmentTolerance)
                .collisionBuffer(grid.collisionBuffer)
                .highPriorityThreshold(grid.highPriorityThreshold)
                .urgencyWindowDays(grid.urgencyWindowDays)
                .build();
    }

    /** Configured categories, or the built-in set when none are configured. */
    public CategoryCatalog toCategoryCatalog() {
        if (categories.isEmpty()) {
            return CategoryCatalog.defaults();
        }
        return CategoryCatalog.of(categories.stream()
                .map(c -> new CategoryStyle(c.name, c.displayName.isBlank() ? c.name : c.displayName,
                        c.color, c.weight, c.milestone))
                .toList());
    }

    public Grid getGrid() { return grid; }
    public void setGrid(Grid grid) { this.grid = grid; }
    public List<Category> getCategories() { return categories; }
    public void setCategories(List<Category> categories) { this.categories = categories; }

    public static class Grid {
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

        public double getDayWidth() { return dayWidth; }
        public void setDayWidth(double dayWidth) { this.dayWidth = dayWidth; }
        public double getDayHeight() { return dayHeight; }
        public void setDayHeight(double dayHeight) { this.dayHeight = dayHeight; }
        public double getRowHeight() { return rowHeight; }
        public void setRowHeight(double rowHeight) { this.rowHeight = rowHeight; }
        public int getMaxRowsPerDay() { return maxRowsPerDay; }
        public void setMaxRowsPerDay(int maxRowsPerDay) { this.maxRowsPerDay = maxRowsPerDay; }
        public Duration getOverlapThreshold() { return overlapThreshold; }
        public void setOverlapThreshold(Duration overlapThreshold) { this.overlapThreshold = overlapThreshold; }
        public double getMonthBoundaryGap() { return monthBoundaryGap; }
        public void setMonthBoundaryGap(double monthBoundaryGap) { this.monthBoundaryGap = monthBoundaryGap; }
        public double getMinTaskSpacing() { return minTaskSpacing; }
        public void setMinTaskSpacing(double minTaskSpacing) { this.minTaskSpacing = minTaskSpacing; }
        public double getMaxTaskSpacing() { return maxTaskSpacing; }
        public void setMaxTaskSpacing(double maxTaskSpacing) { this.maxTaskSpacing = maxTaskSpacing; }
        public boolean isSnapToGrid() { return snapToGrid; }
        public void setSnapToGrid(boolean snapToGrid) { this.snapToGrid = snapToGrid; }
        public double getGridResolution() { return gridResolution; }
        public void setGridResolution(double gridResolution) { this.gridResolution = gridResolution; }
        public double getAlignmentTolerance() { return alignmentTolerance; }
        public void setAlignmentTolerance(double alignmentTolerance) { this.alignmentTolerance = alignmentTolerance; }
        public double getCollisionBuffer() { return collisionBuffer; }
        public void setCollisionBuffer(double collisionBuffer) { this.collisionBuffer = collisionBuffer; }
        public int getHighPriorityThreshold() { return highPriorityThreshold; }
        public void setHighPriorityThreshold(int highPriorityThreshold) { this.highPriorityThreshold = highPriorityThreshold; }
        public int getUrgencyWindowDays() { return urgencyWindowDays; }
        public void setUrgencyWindowDays(int urgencyWindowDays) { this.urgencyWindowDays = urgencyWindowDays; }
    }

    public static class Category {
        private String name = "";
        private String displayName = "";
        private String color = CategoryCatalog.DEFAULT_COLOR;
        private int weight = CategoryCatalog.NEUTRAL_WEIGHT;
        private boolean milestone = false;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }
        public String getColor() { return color; }
        public void setColor(String color) { this.color = color; }
        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }
        public boolean isMilestone() { return milestone; }
        public void setMilestone(boolean milestone) { this.milestone = milestone; }
    }
}
