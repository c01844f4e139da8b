package com.gridplanner.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for gridplanner.
 * Routes to subcommands: layout, categories.
 */
@Command(
        name = "gridplanner",
        mixinStandardHelpOptions = true,
        version = "gridplanner 0.1.0",
        description = "Lays out calendar tasks onto a printable planner grid",
        subcommands = {
                LayoutCommand.class,
                CategoriesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlannerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
