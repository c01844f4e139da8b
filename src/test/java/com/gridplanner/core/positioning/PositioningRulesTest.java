package com.gridplanner.core.positioning;

import com.gridplanner.core.model.GridConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositioningRulesTest {

    private final GridConfig config = GridConfig.builder(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)).build();

    @Test
    @DisplayName("high priority anchors at the top, milestones in the middle, others left")
    void defaultAlignment() {
        PositioningRules rules = PositioningRules.defaults(config);
        assertEquals(AlignmentMode.TOP, rules.alignmentFor(5, false).mode());
        assertEquals(AlignmentMode.TOP, rules.alignmentFor(4, true).mode());
        assertEquals(AlignmentMode.MIDDLE, rules.alignmentFor(3, true).mode());
        assertEquals(AlignmentMode.LEFT, rules.alignmentFor(1, false).mode());
        assertEquals(0.4, rules.alignmentFor(3, true).anchorFraction());
    }

    @Test
    @DisplayName("pairs with a high-priority bar need wider spacing")
    void defaultSpacing() {
        PositioningRules rules = PositioningRules.defaults(config);
        assertEquals(3.0, rules.spacingFor(4, false, 1, false, config));
        assertEquals(3.0, rules.spacingFor(1, false, 5, false, config));
        assertEquals(1.0, rules.spacingFor(1, false, 2, true, config));
    }

    @Test
    @DisplayName("spacing is clamped to the configured range")
    void clampedSpacing() {
        GridConfig wide = GridConfig.builder(config.calendarStart(), config.calendarEnd())
                .minTaskSpacing(5)
                .maxTaskSpacing(8)
                .build();
        PositioningRules rules = PositioningRules.defaults(wide);
        assertEquals(5.0, rules.spacingFor(4, false, 4, false, wide));

        PositioningRules custom = new PositioningRules(
                List.of(new AlignmentRule("all", RuleCondition.ALWAYS, AlignmentMode.BOTTOM, 0.7, 0)),
                List.of(new SpacingRule("huge", RuleCondition.ALWAYS, 50.0, 0)),
                4);
        assertEquals(8.0, custom.spacingFor(1, false, 1, false, wide));
    }

    @Test
    @DisplayName("rules are evaluated by descending order regardless of list order")
    void ordering() {
        PositioningRules rules = new PositioningRules(
                List.of(new AlignmentRule("fallback", RuleCondition.ALWAYS, AlignmentMode.LEFT, 0.2, 0),
                        new AlignmentRule("milestones", RuleCondition.MILESTONE, AlignmentMode.BOTTOM, 0.6, 50)),
                List.of(new SpacingRule("fallback", RuleCondition.ALWAYS, 1.0, 0)),
                4);
        assertEquals("milestones", rules.alignmentRules().get(0).name());
        assertEquals(AlignmentMode.BOTTOM, rules.alignmentFor(1, true).mode());
        assertEquals(AlignmentMode.LEFT, rules.alignmentFor(5, false).mode());
    }

    @Test
    @DisplayName("empty rule lists are rejected")
    void emptyRules() {
        assertThrows(IllegalArgumentException.class, () -> new PositioningRules(List.of(), List.of(), 4));
    }
}
