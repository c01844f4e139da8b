package com.gridplanner.core.positioning;

/**
 * Minimum vertical gap between two horizontally overlapping bars.
 *
 * @param name      rule label used in debug logging
 * @param condition applies when either bar of the pair matches
 * @param spacing   required gap before clamping to the configured spacing range
 * @param order     evaluation order, highest first
 */
public record SpacingRule(
    String name,
    RuleCondition condition,
    double spacing,
    int order
) {
}
