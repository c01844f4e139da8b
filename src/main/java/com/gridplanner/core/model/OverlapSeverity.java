package com.gridplanner.core.model;

/**
 * Severity of an overlap, declared from least to most severe.
 */
public enum OverlapSeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isMoreSevereThan(OverlapSeverity other) {
        return compareTo(other) > 0;
    }
}
