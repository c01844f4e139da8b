package com.gridplanner.core.engine;

import com.gridplanner.core.model.LayoutStatistics;
import com.gridplanner.core.model.OverlapAnalysis;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns statistics that breach their thresholds into advisory messages.
 */
@Component
public class RecommendationGenerator {

    static final double MIN_SPACE_EFFICIENCY = 0.7;
    static final double MIN_ALIGNMENT_SCORE = 0.8;
    static final double MIN_VISUAL_BALANCE = 0.6;

    public List<String> generate(LayoutStatistics stats, OverlapAnalysis overlaps, int maxRowsPerDay) {
        var recommendations = new ArrayList<String>();
        if (stats.processedBars() == 0) {
            return recommendations;
        }
        if (stats.spaceEfficiency() < MIN_SPACE_EFFICIENCY) {
            recommendations.add("Consider reducing task spacing to improve space efficiency");
        }
        if (stats.alignmentScore() < MIN_ALIGNMENT_SCORE) {
            recommendations.add("Enable grid snapping to improve alignment consistency");
        }
        if (stats.visualBalance() < MIN_VISUAL_BALANCE) {
            recommendations.add("Redistribute tasks to improve visual balance");
        }
        if (stats.overflowCount() > 0) {
            recommendations.add(("Overcrowded: %d tasks exceed the limit of %d rows per day and share row 0; "
                    + "consider raising max rows per day or rescheduling").formatted(stats.overflowCount(), maxRowsPerDay));
        }
        if (stats.conflictsResolved() > 0) {
            recommendations.add("Moved %d lower-prominence bars to resolve collisions".formatted(stats.conflictsResolved()));
        }
        if (stats.residualCollisions() > 0) {
            recommendations.add(("%d bar collisions remain after resolution; "
                    + "consider a larger row height or collision buffer").formatted(stats.residualCollisions()));
        }
        if (overlaps.hasCriticalOverlaps()) {
            recommendations.add("Resolve %d critical task overlaps with identical schedules".formatted(overlaps.criticalOverlaps()));
        }
        return recommendations;
    }
}
