package com.gridplanner.core.model;

/**
 * Display and weighting attributes for one task category.
 *
 * @param name        category key, upper case (e.g. "RESEARCH")
 * @param displayName human-readable label
 * @param color       hex display color (e.g. "#50E3C2")
 * @param weight      priority weight; 5 is neutral in visual weight scoring
 * @param milestone   tasks in this category receive the milestone prominence bonus
 */
public record CategoryStyle(
    String name,
    String displayName,
    String color,
    int weight,
    boolean milestone
) {
}
