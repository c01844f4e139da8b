package com.gridplanner.dispatch.cli;

import com.gridplanner.core.config.CategoryCatalog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gridplanner categories
 * <p>
 * Prints the category table the layout engine colors and weights tasks with.
 */
@Command(name = "categories", mixinStandardHelpOptions = true, description = "List configured task categories")
@Component
public class CategoriesCommand implements Runnable {

    private final CategoryCatalog categories;

    public CategoriesCommand(CategoryCatalog categories) {
        this.categories = categories;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.categories(categories.all());
    }
}
