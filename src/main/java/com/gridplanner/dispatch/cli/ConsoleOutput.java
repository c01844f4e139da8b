package com.gridplanner.dispatch.cli;

import com.gridplanner.core.model.CategoryStyle;
import com.gridplanner.core.model.LayoutStatistics;
import com.gridplanner.core.model.Overlap;
import com.gridplanner.core.model.OverlapAnalysis;
import com.gridplanner.core.model.OverlapGroup;
import com.gridplanner.core.model.OverlapSeverity;
import com.gridplanner.core.model.TaskBar;
import picocli.CommandLine;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the gridplanner CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GRIDPLANNER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PLANNER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void statistics(LayoutStatistics s) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Layout Statistics|@"));
        System.out.println("  Tasks: " + s.totalTasks() + " in " + s.groupCount() + " groups, "
                + s.processedBars() + " bars");
        System.out.println("  Collisions: " + s.conflictsResolved() + " resolved, " + s.residualCollisions() + " residual");
        System.out.println("  Overflow: " + s.overflowCount() + ", month-crossing tasks: " + s.monthBoundaryCount());
        System.out.printf(Locale.ROOT, "  Bar height: avg %.1f, max %.1f | width: avg %.1f, max %.1f%n",
                s.averageBarHeight(), s.maxBarHeight(), s.averageBarWidth(), s.maxBarWidth());
        System.out.printf(Locale.ROOT, "  Space efficiency %s, alignment %s, spacing %s, balance %s, utilization %s%n",
                percent(s.spaceEfficiency()), percent(s.alignmentScore()), percent(s.spacingScore()),
                percent(s.visualBalance()), percent(s.gridUtilization()));
    }

    public static void overlaps(OverlapAnalysis analysis) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Overlaps|@ " + analysis.summary()));
        for (OverlapGroup group : analysis.groups()) {
            if (group.overlaps().isEmpty()) continue;
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  " + severity(group.maxSeverity()) + " " + group.groupId() + ": " + group.resolution()));
            for (Overlap overlap : group.overlaps()) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    " + severity(overlap.severity()) + " " + overlap.conflictReason()));
                System.out.println("      " + overlap.resolutionHint());
            }
        }
    }

    public static void bars(List<TaskBar> bars) {
        if (bars.isEmpty()) return;
        System.out.println("──────────────────────────────────");
        System.out.printf("  %-10s %-10s %-10s %7s %7s %6s %5s %4s %s%n",
                "TASK", "START", "END", "X", "Y", "W", "H", "ROW", "FLAGS");
        System.out.println("  " + "-".repeat(76));
        for (TaskBar bar : bars) {
            System.out.printf(Locale.ROOT, "  %-10s %-10s %-10s %7.1f %7.1f %6.1f %5.1f %4d %s%n",
                    truncate(bar.taskId(), 10), bar.startDate(), bar.endDate(),
                    bar.x(), bar.y(), bar.width(), bar.height(), bar.row(), flags(bar));
        }
    }

    public static void recommendations(List<String> recommendations) {
        if (recommendations.isEmpty()) {
            success("Layout within all quality thresholds");
            return;
        }
        for (String recommendation : recommendations) {
            warn(recommendation);
        }
    }

    public static void issues(List<String> issues) {
        for (String issue : issues) {
            warn(issue);
        }
    }

    public static void categories(Collection<CategoryStyle> categories) {
        System.out.printf("  %-14s %-18s %-8s %6s %s%n", "CATEGORY", "NAME", "COLOR", "WEIGHT", "MILESTONE");
        System.out.println("  " + "-".repeat(60));
        for (CategoryStyle c : categories) {
            System.out.printf("  %-14s %-18s %-8s %6d %s%n",
                    c.name(), c.displayName(), c.color(), c.weight(), c.milestone() ? "yes" : "");
        }
    }

    private static String severity(OverlapSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "@|fg(red),bold [CRITICAL]|@";
            case HIGH -> "@|fg(red) [HIGH]|@";
            case MEDIUM -> "@|fg(yellow) [MEDIUM]|@";
            case LOW -> "@|fg(cyan) [LOW]|@";
            case NONE -> "[NONE]";
        };
    }

    private static String flags(TaskBar bar) {
        var sb = new StringBuilder();
        if (bar.isStart()) sb.append("start ");
        if (bar.isContinuation()) sb.append("cont ");
        if (bar.isEnd()) sb.append("end ");
        if (bar.crossesMonthBoundary()) sb.append("split");
        return sb.toString().trim();
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.0f%%", value * 100);
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
