package com.gridplanner.core.engine;

import com.gridplanner.core.boundary.MonthBoundarySegmenter;
import com.gridplanner.core.grouping.TemporalGrouper;
import com.gridplanner.core.model.GridConfig;
import com.gridplanner.core.model.LayoutResult;
import com.gridplanner.core.model.LayoutStatistics;
import com.gridplanner.core.model.OverlapAnalysis;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskBar;
import com.gridplanner.core.model.TaskGroup;
import com.gridplanner.core.model.TaskScore;
import com.gridplanner.core.overlap.OverlapDetector;
import com.gridplanner.core.positioning.CollisionReport;
import com.gridplanner.core.positioning.CollisionResolver;
import com.gridplanner.core.positioning.SpatialPositioner;
import com.gridplanner.core.scoring.PriorityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Runs the layout pipeline for one task set against one grid:
 * scoring, grouping and rows, overlap analysis, positioning, collision resolution,
 * month segmentation, then statistics, recommendations and layout issues.
 * <p>
 * Holds no state between calls; the only time input is the explicit reference date.
 * The only exception thrown is {@link com.gridplanner.core.config.InvalidGridConfigException}
 * from config validation, before any layout work.
 */
@Service
public class LayoutOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LayoutOrchestrator.class);

    private final PriorityScorer scorer;
    private final TemporalGrouper grouper;
    private final OverlapDetector overlapDetector;
    private final SpatialPositioner positioner;
    private final CollisionResolver collisionResolver;
    private final MonthBoundarySegmenter segmenter;
    private final LayoutStatisticsCalculator statisticsCalculator;
    private final RecommendationGenerator recommendationGenerator;
    private final LayoutValidator validator;

    public LayoutOrchestrator(PriorityScorer scorer,
                              TemporalGrouper grouper,
                              OverlapDetector overlapDetector,
                              SpatialPositioner positioner,
                              CollisionResolver collisionResolver,
                              MonthBoundarySegmenter segmenter,
                              LayoutStatisticsCalculator statisticsCalculator,
                              RecommendationGenerator recommendationGenerator,
                              LayoutValidator validator) {
        this.scorer = scorer;
        this.grouper = grouper;
        this.overlapDetector = overlapDetector;
        this.positioner = positioner;
        this.collisionResolver = collisionResolver;
        this.segmenter = segmenter;
        this.statisticsCalculator = statisticsCalculator;
        this.recommendationGenerator = recommendationGenerator;
        this.validator = validator;
    }

    /**
     * Lays out the tasks.
     *
     * @param tasks         validated tasks, not modified
     * @param config        grid for this run
     * @param referenceDate "today" for urgency scoring; null disables the urgency adjustment
     * @throws com.gridplanner.core.config.InvalidGridConfigException if the grid is structurally invalid
     */
    public LayoutResult layout(List<Task> tasks, GridConfig config, LocalDate referenceDate) {
        config.validate();

        Map<String, TaskScore> scores = scorer.scoreAll(tasks, referenceDate, config.urgencyWindowDays());
        List<TaskGroup> groups = grouper.group(tasks, config.maxRowsPerDay(), scores);
        OverlapAnalysis overlaps = overlapDetector.analyze(groups, config.overlapThreshold());

        List<TaskBar> positioned = positioner.position(groups, scores, config);
        CollisionReport collisions = collisionResolver.resolve(positioned, config.collisionBuffer());
        List<TaskBar> bars = segmenter.segmentAll(collisions.bars(), config);

        int crossing = (int) collisions.bars().stream().filter(TaskBar::spansMultipleMonths).count();
        var counts = new LayoutStatisticsCalculator.RunCounts(
                tasks.size(), collisions.resolvedCount(), collisions.residualCount(), crossing);
        LayoutStatistics statistics = statisticsCalculator.calculate(bars, groups, counts, config);
        List<String> recommendations = recommendationGenerator.generate(statistics, overlaps, config.maxRowsPerDay());
        List<String> issues = validator.validate(bars, config);

        log.info("Laid out {} tasks as {} bars in {} groups: {} overlaps, {} collisions resolved, {} residual",
                tasks.size(), bars.size(), groups.size(), overlaps.totalOverlaps(),
                collisions.resolvedCount(), collisions.residualCount());
        return new LayoutResult(List.copyOf(bars), groups, overlaps, statistics,
                List.copyOf(recommendations), List.copyOf(issues));
    }
}
