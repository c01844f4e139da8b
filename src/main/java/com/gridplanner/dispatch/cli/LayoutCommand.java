package com.gridplanner.dispatch.cli;

import com.gridplanner.core.config.InvalidGridConfigException;
import com.gridplanner.core.config.PlannerProperties;
import com.gridplanner.core.engine.LayoutService;
import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.LayoutResult;
import com.gridplanner.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gridplanner layout &lt;tasks.json&gt;
 * <p>
 * Lays out a JSON array of task records on the configured grid and prints statistics, overlaps,
 * recommendations and bar geometry, or the whole result as JSON.
 */
@Command(name = "layout", mixinStandardHelpOptions = true, description = "Lay out tasks on the calendar grid")
@Component
public class LayoutCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "JSON file with an array of task records")
    private Path tasksFile;

    @Option(names = {"--start"}, description = "Calendar start (default: first day of the earliest task month)")
    private LocalDate start;

    @Option(names = {"--end"}, description = "Calendar end (default: last day of the latest task month)")
    private LocalDate end;

    @Option(names = {"--reference-date"}, description = "Date urgency is measured from (default: calendar start)")
    private LocalDate referenceDate;

    @Option(names = {"--month"}, description = "Lay out a single month, e.g. 2024-01")
    private YearMonth month;

    @Option(names = {"--json"}, description = "Print the full layout result as JSON")
    private boolean json;

    private final LayoutService layoutService;
    private final PlannerProperties properties;
    private final TaskFileReader reader;

    public LayoutCommand(LayoutService layoutService, PlannerProperties properties, TaskFileReader reader) {
        this.layoutService = layoutService;
        this.properties = properties;
        this.reader = reader;
    }

    @Override
    public Integer call() {
        List<Task> tasks;
        try {
            tasks = reader.read(tasksFile);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read tasks from " + tasksFile + ": " + e.getMessage());
            return 1;
        }

        if (!json) {
            ConsoleOutput.printBanner();
        }
        if (tasks.isEmpty() && (start == null || end == null)) {
            ConsoleOutput.info("No tasks in " + tasksFile);
            return 0;
        }

        LocalDate calendarStart = start != null ? start : earliestMonth(tasks).atDay(1);
        LocalDate calendarEnd = end != null ? end : latestMonth(tasks).atEndOfMonth();
        LocalDate reference = referenceDate != null ? referenceDate : calendarStart;

        LayoutResult result;
        try {
            GridConfig config = properties.toGridConfig(calendarStart, calendarEnd);
            result = month != null
                    ? layoutService.runMonth(tasks, config, month, reference)
                    : layoutService.run(tasks, config, reference);
        } catch (InvalidGridConfigException e) {
            ConsoleOutput.error("Invalid grid configuration:");
            for (String violation : e.getViolations()) {
                ConsoleOutput.error("  " + violation);
            }
            return 2;
        }

        if (json) {
            try {
                System.out.println(reader.toJson(result));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot serialize layout: " + e.getMessage());
                return 1;
            }
            return 0;
        }

        ConsoleOutput.info("Calendar " + calendarStart + " to " + calendarEnd
                + (month != null ? " (month " + month + ")" : ""));
        ConsoleOutput.statistics(result.statistics());
        ConsoleOutput.overlaps(result.overlapAnalysis());
        ConsoleOutput.bars(result.taskBars());
        ConsoleOutput.recommendations(result.recommendations());
        ConsoleOutput.issues(result.layoutIssues());
        return 0;
    }

    private static YearMonth earliestMonth(List<Task> tasks) {
        return YearMonth.from(tasks.stream().map(Task::startDate).min(Comparator.naturalOrder()).orElseThrow());
    }

    private static YearMonth latestMonth(List<Task> tasks) {
        return YearMonth.from(tasks.stream().map(Task::endDate).max(Comparator.naturalOrder()).orElseThrow());
    }
}
