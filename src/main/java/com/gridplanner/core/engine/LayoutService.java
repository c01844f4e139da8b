package com.gridplanner.core.engine;

import com.gridplanner.core.logging.MdcContext;
import com.gridplanner.core.metrics.PlannerMetrics;
import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.LayoutResult;
import com.gridplanner.core.model.OverlapAnalysis;
import com.gridplanner.core.model.OverlapSeverity;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Host-side entry point around {@link LayoutOrchestrator}.
 * <p>
 * Tags each run with a layout run ID in the logging MDC and records metrics; the orchestrator
 * itself stays free of both.
 */
@Service
public class LayoutService {

    private static final Logger log = LoggerFactory.getLogger(LayoutService.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final LayoutOrchestrator orchestrator;
    private final PlannerMetrics metrics;

    public LayoutService(LayoutOrchestrator orchestrator, PlannerMetrics metrics) {
        this.orchestrator = orchestrator;
        this.metrics = metrics;
    }

    public LayoutResult run(List<Task> tasks, GridConfig config, LocalDate referenceDate) {
        String runId = generateRunId();
        MdcContext.setLayoutRun(runId);
        try {
            log.info("Starting layout run {} for {} tasks ({} to {})",
                    runId, tasks.size(), config.calendarStart(), config.calendarEnd());
            return execute(tasks, config, referenceDate);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Lays out a single month: the grid is narrowed to the month and only tasks touching it are included.
     * Tasks crossing into neighbouring months contribute only this month's slice, so independent months
     * can be laid out concurrently.
     */
    public LayoutResult runMonth(List<Task> tasks, GridConfig config, YearMonth month, LocalDate referenceDate) {
        String runId = generateRunId();
        MdcContext.setMonth(runId, month);
        try {
            LocalDate first = month.atDay(1);
            LocalDate last = month.atEndOfMonth();
            List<Task> inMonth = tasks.stream()
                    .filter(t -> !t.endDate().isBefore(first) && !t.startDate().isAfter(last))
                    .toList();
            log.info("Starting layout run {} for {} ({} of {} tasks)", runId, month, inMonth.size(), tasks.size());
            return execute(inMonth, config.withCalendar(first, last), referenceDate);
        } finally {
            MdcContext.clear();
        }
    }

    private LayoutResult execute(List<Task> tasks, GridConfig config, LocalDate referenceDate) {
        long start = System.currentTimeMillis();
        LayoutResult result = orchestrator.layout(tasks, config, referenceDate);
        metrics.recordLayoutDuration(System.currentTimeMillis() - start);
        metrics.recordTaskCount(tasks.size());

        OverlapAnalysis overlaps = result.overlapAnalysis();
        metrics.recordOverlaps(OverlapSeverity.CRITICAL, overlaps.criticalOverlaps());
        metrics.recordOverlaps(OverlapSeverity.HIGH, overlaps.highOverlaps());
        metrics.recordOverlaps(OverlapSeverity.MEDIUM, overlaps.mediumOverlaps());
        metrics.recordOverlaps(OverlapSeverity.LOW, overlaps.lowOverlaps());
        metrics.recordCollisions(result.statistics().conflictsResolved(), result.statistics().residualCollisions());
        metrics.recordRowOverflow(result.statistics().overflowCount());
        metrics.recordSegments((int) result.taskBars().stream().filter(TaskBar::crossesMonthBoundary).count());

        if (!result.recommendations().isEmpty()) {
            log.warn("Layout produced {} recommendations", result.recommendations().size());
        }
        return result;
    }

    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LAYOUT-%d-%04d", year, count);
    }
}
