package com.gridplanner.core.engine;

import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.TaskBar;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutValidatorTest {

    private LayoutValidator validator;
    private GridConfig config;

    @BeforeEach
    void setUp() {
        validator = new LayoutValidator();
        config = GridConfig.builder(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)).build();
    }

    private TaskBar bar(String id, double x, double y, double width, int row) {
        return new TaskBar(id, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), x, y, width, 8, row, 0,
                "#CCCCCC", 0.9, 5, 3, 0.5, 0.3, false, false, true, true, false);
    }

    @Test
    @DisplayName("bars inside the calendar on separate rows are valid")
    void valid() {
        assertTrue(validator.validate(List.of(bar("A", 0, 12, 40, 0), bar("B", 20, 24, 40, 1)), config).isEmpty());
    }

    @Test
    @DisplayName("bars beyond either calendar edge are reported")
    void outOfBounds() {
        List<String> issues = validator.validate(List.of(bar("EARLY", -40, 12, 60, 0), bar("LATE", 600, 12, 60, 1)), config);
        assertEquals(2, issues.size());
        assertTrue(issues.get(0).startsWith("Task EARLY"));
        assertTrue(issues.get(1).contains("beyond the calendar range"));
    }

    @Test
    @DisplayName("overlapping bars on one row are reported")
    void sharedRow() {
        List<String> issues = validator.validate(List.of(bar("A", 0, 12, 40, 0), bar("B", 20, 30, 40, 0)), config);
        assertEquals(List.of("Tasks A and B share row 0 over the same days"), issues);
    }

    @Test
    @DisplayName("segments of the same task may touch on one row")
    void sameTaskSegments() {
        assertTrue(validator.validate(List.of(bar("A", 0, 12, 40, 0), bar("A", 40, 12, 40, 0)), config).isEmpty());
    }
}
