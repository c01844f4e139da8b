package com.gridplanner.core.engine;

import com.gridplanner.core.logging.MdcContext;
import com.gridplanner.core.metrics.PlannerMetrics;
import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.LayoutResult;
import com.gridplanner.core.model.LayoutStatistics;
import com.gridplanner.core.model.OverlapAnalysis;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskBar;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LayoutServiceTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);

    private LayoutOrchestrator orchestrator;
    private SimpleMeterRegistry registry;
    private LayoutService service;
    private GridConfig config;

    @BeforeEach
    void setUp() {
        orchestrator = mock(LayoutOrchestrator.class);
        registry = new SimpleMeterRegistry();
        service = new LayoutService(orchestrator, new PlannerMetrics(registry));
        config = GridConfig.builder(JAN_1, LocalDate.of(2024, 3, 31)).build();
    }

    private Task task(String id, String start, String end) {
        return new Task(id, id, "RESEARCH", "", LocalDate.parse(start), LocalDate.parse(end), 3, "Planned", "Sam");
    }

    private LayoutResult result() {
        TaskBar split = new TaskBar("A", JAN_1, JAN_1, 0, 12, 20, 8, 0, 0, "#CCCCCC", 0.9, 5, 3, 0.5, 0.3,
                false, false, true, false, true);
        var analysis = new OverlapAnalysis(2, 2, List.of(), 3, 1, 0, 2, 0, "3 overlaps");
        var stats = new LayoutStatistics(2, 1, 1, 4, 1, 2, 1, 8, 8, 20, 20, 12, 0.9, 1.0, 1.0, 0.9, 0.1);
        return new LayoutResult(List.of(split), List.of(), analysis, stats, List.of("advice"), List.of());
    }

    @Test
    @DisplayName("run records metrics from the layout result")
    void recordsMetrics() {
        when(orchestrator.layout(anyList(), any(GridConfig.class), any())).thenReturn(result());

        service.run(List.of(task("A", "2024-01-01", "2024-01-01")), config, JAN_1);

        assertEquals(1, registry.find("gridplanner.layout.duration").timer().count());
        assertEquals(1, registry.find("gridplanner.layout.tasks").summary().count());
        assertEquals(1.0, registry.find("gridplanner.overlaps.total").tag("severity", "critical").counter().count());
        assertEquals(2.0, registry.find("gridplanner.overlaps.total").tag("severity", "medium").counter().count());
        assertNull(registry.find("gridplanner.overlaps.total").tag("severity", "high").counter());
        assertEquals(4.0, registry.find("gridplanner.collisions.resolved").counter().count());
        assertEquals(1.0, registry.find("gridplanner.collisions.residual").counter().count());
        assertEquals(2.0, registry.find("gridplanner.rows.overflow").counter().count());
        assertEquals(1.0, registry.find("gridplanner.segments.total").counter().count());
    }

    @Test
    @DisplayName("the run ID is in the MDC during the run and cleared afterwards")
    void mdcScope() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(orchestrator.layout(anyList(), any(GridConfig.class), any())).thenAnswer(inv -> {
            seen.set(MDC.get(MdcContext.LAYOUT_RUN_ID));
            return result();
        });

        service.run(List.of(), config, JAN_1);

        assertNotNull(seen.get());
        assertTrue(seen.get().startsWith("LAYOUT-"));
        assertNull(MDC.get(MdcContext.LAYOUT_RUN_ID));
    }

    @Test
    @DisplayName("the MDC is cleared when the layout fails")
    void mdcClearedOnFailure() {
        when(orchestrator.layout(anyList(), any(GridConfig.class), any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(IllegalStateException.class, () -> service.run(List.of(), config, JAN_1));
        assertNull(MDC.get(MdcContext.LAYOUT_RUN_ID));
    }

    @Test
    @DisplayName("runMonth narrows the calendar and keeps only tasks touching the month")
    @SuppressWarnings("unchecked")
    void runMonth() {
        AtomicReference<String> month = new AtomicReference<>();
        when(orchestrator.layout(anyList(), any(GridConfig.class), any())).thenAnswer(inv -> {
            month.set(MDC.get(MdcContext.LAYOUT_MONTH));
            return result();
        });
        var tasks = List.of(task("JAN", "2024-01-05", "2024-01-09"), task("CROSS", "2024-01-28", "2024-02-03"),
                task("FEB", "2024-02-10", "2024-02-12"), task("MAR", "2024-03-01", "2024-03-02"));

        service.runMonth(tasks, config, YearMonth.of(2024, 2), JAN_1);

        ArgumentCaptor<List<Task>> taskCaptor = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<GridConfig> configCaptor = ArgumentCaptor.forClass(GridConfig.class);
        verify(orchestrator).layout(taskCaptor.capture(), configCaptor.capture(), eq(JAN_1));
        assertEquals(List.of("CROSS", "FEB"), taskCaptor.getValue().stream().map(Task::id).toList());
        assertEquals(LocalDate.of(2024, 2, 1), configCaptor.getValue().calendarStart());
        assertEquals(LocalDate.of(2024, 2, 29), configCaptor.getValue().calendarEnd());
        assertEquals("2024-02", month.get());
        assertNull(MDC.get(MdcContext.LAYOUT_MONTH));
    }

    @Test
    @DisplayName("run IDs are unique and carry the year")
    void runIds() {
        String first = service.generateRunId();
        String second = service.generateRunId();
        assertNotEquals(first, second);
        assertTrue(first.matches("LAYOUT-\\d{4}-\\d{4}"));
    }
}
