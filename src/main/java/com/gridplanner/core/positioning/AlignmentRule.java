package com.gridplanner.core.positioning;

/**
 * Chooses the vertical anchor of a bar.
 *
 * @param name           rule label used in debug logging
 * @param condition      when the rule applies
 * @param mode           alignment applied
 * @param anchorFraction anchor offset as a fraction of the day height
 * @param order          evaluation order, highest first
 */
public record AlignmentRule(
    String name,
    RuleCondition condition,
    AlignmentMode mode,
    double anchorFraction,
    int order
) {
}
