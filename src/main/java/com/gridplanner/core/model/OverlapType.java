package com.gridplanner.core.model;

/**
 * Shape of the temporal intersection between two tasks.
 */
public enum OverlapType {
    NONE,
    PARTIAL,
    COMPLETE,
    NESTED,
    ADJACENT,
    IDENTICAL
}
