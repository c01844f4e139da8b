package com.gridplanner.core.positioning;

/**
 * Condition kinds understood by {@link PositioningRules}.
 */
public enum RuleCondition {
    /** Priority at or above the configured high-priority threshold. */
    HIGH_PRIORITY,
    /** Milestone by name or category. */
    MILESTONE,
    /** Matches every bar. */
    ALWAYS
}
