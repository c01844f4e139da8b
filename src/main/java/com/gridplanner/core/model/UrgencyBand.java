package com.gridplanner.core.model;

/**
 * Five-level urgency band. The multiplier scales a task's prominence score.
 */
public enum UrgencyBand {
    MINIMAL(0.2),
    LOW(0.4),
    MEDIUM(0.6),
    HIGH(0.8),
    CRITICAL(1.0);

    private final double multiplier;

    UrgencyBand(double multiplier) {
        this.multiplier = multiplier;
    }

    public double multiplier() {
        return multiplier;
    }

    public static UrgencyBand fromPriority(int priority) {
        if (priority >= 5) return CRITICAL;
        if (priority == 4) return HIGH;
        if (priority == 3) return MEDIUM;
        if (priority == 2) return LOW;
        return MINIMAL;
    }

    /** One level more urgent, saturating at CRITICAL. */
    public UrgencyBand raise() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }
}
