package com.gridplanner.core.model;

import com.gridplanner.core.config.InvalidGridConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static Task task(String id, String name, String start, String end) {
        return new Task(id, name, "RESEARCH", "", LocalDate.parse(start), LocalDate.parse(end), 3, "Planned", "Sam");
    }

    @Nested
    @DisplayName("Task")
    class TaskTests {

        @Test
        @DisplayName("single-day task has zero duration and a span of one day")
        void singleDay() {
            Task t = task("T1", "Review", "2024-01-05", "2024-01-05");
            assertEquals(0, t.durationDays());
            assertEquals(1, t.spanDays());
        }

        @Test
        @DisplayName("overlap is inclusive of shared end and start days")
        void inclusiveOverlap() {
            Task a = task("A", "A", "2024-01-01", "2024-01-05");
            Task b = task("B", "B", "2024-01-05", "2024-01-09");
            Task c = task("C", "C", "2024-01-06", "2024-01-09");
            assertTrue(a.overlaps(b));
            assertTrue(b.overlaps(a));
            assertFalse(a.overlaps(c));
        }

        @Test
        @DisplayName("milestone flag is read from the name, case-insensitively")
        void milestoneName() {
            assertTrue(task("M", "Milestone: defense", "2024-01-01", "2024-01-01").isMilestone());
            assertTrue(task("M", "PHASE 1 MILESTONE", "2024-01-01", "2024-01-01").isMilestone());
            assertFalse(task("M", "Lab work", "2024-01-01", "2024-01-01").isMilestone());
            assertFalse(task("M", null, "2024-01-01", "2024-01-01").isMilestone());
        }
    }

    @Nested
    @DisplayName("GridConfig")
    class GridConfigTests {

        private final LocalDate jan1 = LocalDate.of(2024, 1, 1);

        @Test
        @DisplayName("default configuration validates")
        void defaultsValidate() {
            GridConfig config = GridConfig.builder(jan1, LocalDate.of(2024, 12, 31)).build();
            assertSame(config, config.validate());
            assertEquals(Duration.ofHours(1), config.overlapThreshold());
            assertEquals(3, config.maxRowsPerDay());
        }

        @Test
        @DisplayName("every violation is reported at once")
        void collectsViolations() {
            GridConfig config = GridConfig.builder(jan1, LocalDate.of(2024, 1, 31))
                    .dayWidth(0)
                    .maxRowsPerDay(0)
                    .build();
            var ex = assertThrows(InvalidGridConfigException.class, config::validate);
            assertEquals(2, ex.getViolations().size());
            assertTrue(ex.getMessage().contains("dayWidth"));
            assertTrue(ex.getMessage().contains("maxRowsPerDay"));
        }

        @Test
        @DisplayName("end before start is rejected")
        void endBeforeStart() {
            GridConfig config = GridConfig.builder(LocalDate.of(2024, 2, 1), jan1).build();
            var ex = assertThrows(InvalidGridConfigException.class, config::validate);
            assertTrue(ex.getViolations().get(0).contains("before calendar start"));
        }

        @Test
        @DisplayName("min spacing above max spacing and negative buffer are rejected")
        void spacingAndBuffer() {
            GridConfig config = GridConfig.builder(jan1, jan1)
                    .minTaskSpacing(5)
                    .maxTaskSpacing(2)
                    .collisionBuffer(-1)
                    .build();
            var ex = assertThrows(InvalidGridConfigException.class, config::validate);
            assertEquals(2, ex.getViolations().size());
        }

        @Test
        @DisplayName("x adds one month gap per month boundary crossed")
        void xWithMonthGap() {
            GridConfig config = GridConfig.builder(jan1, LocalDate.of(2024, 3, 31))
                    .monthBoundaryGap(5)
                    .build();
            assertEquals(0.0, config.xFor(jan1));
            assertEquals(40.0, config.xFor(LocalDate.of(2024, 1, 3)));
            assertEquals(31 * 20.0 + 5, config.xFor(LocalDate.of(2024, 2, 1)));
            assertEquals(60 * 20.0 + 10, config.xFor(LocalDate.of(2024, 3, 1)));
        }

        @Test
        @DisplayName("width covers both end days")
        void inclusiveWidth() {
            GridConfig config = GridConfig.builder(jan1, LocalDate.of(2024, 1, 31)).build();
            assertEquals(20.0, config.widthFor(jan1, jan1));
            assertEquals(100.0, config.widthFor(jan1, LocalDate.of(2024, 1, 5)));
            assertEquals(31, config.calendarDays());
            assertEquals(620.0, config.availableWidth());
            assertEquals(60.0, config.availableHeight());
        }

        @Test
        @DisplayName("withCalendar keeps every other setting")
        void withCalendar() {
            GridConfig config = GridConfig.builder(jan1, LocalDate.of(2024, 12, 31)).rowHeight(15).build();
            GridConfig feb = config.withCalendar(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 29));
            assertEquals(LocalDate.of(2024, 2, 1), feb.calendarStart());
            assertEquals(15.0, feb.rowHeight());
            assertEquals(0.0, feb.xFor(LocalDate.of(2024, 2, 1)));
        }
    }

    @Nested
    @DisplayName("TaskBar and UrgencyBand")
    class BarAndBandTests {

        private TaskBar bar(String start, String end) {
            return new TaskBar("T1", LocalDate.parse(start), LocalDate.parse(end), 10, 20, 40, 8, 1, 0,
                    "#50E3C2", 0.9, 6, 3, 0.6, 0.36, false, false, true, true, false);
        }

        @Test
        @DisplayName("right and bottom edges")
        void edges() {
            TaskBar b = bar("2024-01-01", "2024-01-02");
            assertEquals(50.0, b.right());
            assertEquals(28.0, b.bottom());
            assertEquals(YearMonth.of(2024, 1), b.month());
            assertFalse(b.spansMultipleMonths());
        }

        @Test
        @DisplayName("segment marks the month crossing and keeps vertical geometry")
        void segment() {
            TaskBar b = bar("2024-01-30", "2024-02-02");
            TaskBar seg = b.segment(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 2), 100, 40, true, false, true);
            assertTrue(b.spansMultipleMonths());
            assertTrue(seg.crossesMonthBoundary());
            assertTrue(seg.isContinuation());
            assertFalse(seg.isStart());
            assertEquals(20.0, seg.y());
            assertEquals(8.0, seg.height());
        }

        @Test
        @DisplayName("urgency band follows priority and saturates when raised")
        void bands() {
            assertEquals(UrgencyBand.CRITICAL, UrgencyBand.fromPriority(7));
            assertEquals(UrgencyBand.HIGH, UrgencyBand.fromPriority(4));
            assertEquals(UrgencyBand.MINIMAL, UrgencyBand.fromPriority(0));
            assertEquals(UrgencyBand.HIGH, UrgencyBand.MEDIUM.raise());
            assertEquals(UrgencyBand.CRITICAL, UrgencyBand.CRITICAL.raise());
        }

        @Test
        @DisplayName("severity ordering")
        void severityOrder() {
            assertTrue(OverlapSeverity.CRITICAL.isMoreSevereThan(OverlapSeverity.HIGH));
            assertFalse(OverlapSeverity.LOW.isMoreSevereThan(OverlapSeverity.MEDIUM));
            assertFalse(OverlapSeverity.LOW.isMoreSevereThan(OverlapSeverity.LOW));
        }

        @Test
        @DisplayName("layout result filters bars by task and month")
        void resultViews() {
            TaskBar jan = bar("2024-01-30", "2024-01-31");
            TaskBar feb = new TaskBar("T2", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 2), 0, 0, 40, 8, 0, 0,
                    "#CCCCCC", 0.9, 5, 2, 0.4, 0.16, false, true, false, true, true);
            var analysis = new OverlapAnalysis(2, 0, List.of(), 0, 0, 0, 0, 0, "none");
            var result = new LayoutResult(List.of(jan, feb), List.of(), analysis, null, List.of(), List.of());
            assertEquals(List.of(jan), result.barsForTask("T1"));
            assertEquals(List.of(feb), result.barsForMonth(YearMonth.of(2024, 2)));
            assertTrue(result.conflicts().isEmpty());
        }
    }
}
