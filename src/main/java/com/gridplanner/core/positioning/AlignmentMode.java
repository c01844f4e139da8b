package com.gridplanner.core.positioning;

/**
 * Vertical anchor a bar is aligned to within its day cell.
 */
public enum AlignmentMode {
    TOP,
    MIDDLE,
    BOTTOM,
    LEFT
}
