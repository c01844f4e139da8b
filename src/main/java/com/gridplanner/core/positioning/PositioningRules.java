package com.gridplanner.core.positioning;

import com.gridplanner.core.model.GridConfig;

import java.util.Comparator;
import java.util.List;

/**
 * Ordered alignment and spacing rules with a small interpreter over {@link RuleCondition}.
 * <p>
 * The first matching rule wins. Each list must end with an {@link RuleCondition#ALWAYS} rule so
 * every bar resolves to something.
 */
public final class PositioningRules {

    private final List<AlignmentRule> alignmentRules;
    private final List<SpacingRule> spacingRules;
    private final int highPriorityThreshold;

    public PositioningRules(List<AlignmentRule> alignmentRules, List<SpacingRule> spacingRules,
                            int highPriorityThreshold) {
        this.alignmentRules = alignmentRules.stream()
                .sorted(Comparator.comparingInt(AlignmentRule::order).reversed())
                .toList();
        this.spacingRules = spacingRules.stream()
                .sorted(Comparator.comparingInt(SpacingRule::order).reversed())
                .toList();
        this.highPriorityThreshold = highPriorityThreshold;
        if (this.alignmentRules.isEmpty() || this.spacingRules.isEmpty()) {
            throw new IllegalArgumentException("At least one alignment rule and one spacing rule are required");
        }
    }

    /** High-priority bars anchor at the top, milestones in the middle, the rest near the top-left. */
    public static PositioningRules defaults(GridConfig config) {
        return new PositioningRules(
                List.of(
                        new AlignmentRule("high-priority-top", RuleCondition.HIGH_PRIORITY, AlignmentMode.TOP, 0.1, 100),
                        new AlignmentRule("milestone-middle", RuleCondition.MILESTONE, AlignmentMode.MIDDLE, 0.4, 90),
                        new AlignmentRule("default-left", RuleCondition.ALWAYS, AlignmentMode.LEFT, 0.2, 0)),
                List.of(
                        new SpacingRule("high-priority-spacing", RuleCondition.HIGH_PRIORITY, 3.0, 100),
                        new SpacingRule("default-spacing", RuleCondition.ALWAYS, config.minTaskSpacing(), 0)),
                config.highPriorityThreshold());
    }

    public AlignmentRule alignmentFor(int priority, boolean milestone) {
        for (AlignmentRule rule : alignmentRules) {
            if (matches(rule.condition(), priority, milestone)) {
                return rule;
            }
        }
        return alignmentRules.get(alignmentRules.size() - 1);
    }

    /**
     * Required gap between two bars, clamped to {@code [minTaskSpacing, maxTaskSpacing]}.
     */
    public double spacingFor(int priorityA, boolean milestoneA, int priorityB, boolean milestoneB, GridConfig config) {
        double spacing = spacingRules.get(spacingRules.size() - 1).spacing();
        for (SpacingRule rule : spacingRules) {
            if (matches(rule.condition(), priorityA, milestoneA) || matches(rule.condition(), priorityB, milestoneB)) {
                spacing = rule.spacing();
                break;
            }
        }
        return Math.max(config.minTaskSpacing(), Math.min(config.maxTaskSpacing(), spacing));
    }

    public List<AlignmentRule> alignmentRules() {
        return alignmentRules;
    }

    public List<SpacingRule> spacingRules() {
        return spacingRules;
    }

    private boolean matches(RuleCondition condition, int priority, boolean milestone) {
        return switch (condition) {
            case HIGH_PRIORITY -> priority >= highPriorityThreshold;
            case MILESTONE -> milestone;
            case ALWAYS -> true;
        };
    }
}
