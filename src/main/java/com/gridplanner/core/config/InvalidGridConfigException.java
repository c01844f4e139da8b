package com.gridplanner.core.config;

import java.util.List;

/**
 * Thrown when a grid configuration is structurally invalid. Raised before any layout work starts.
 */
public class InvalidGridConfigException extends RuntimeException {

    private final List<String> violations;

    public InvalidGridConfigException(List<String> violations) {
        super("Invalid grid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
