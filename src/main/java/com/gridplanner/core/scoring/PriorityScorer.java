package com.gridplanner.core.scoring;

import com.gridplanner.core.config.CategoryCatalog;
import com.gridplanner.core.model.CategoryStyle;
import com.gridplanner.core.model.Task;
import com.gridplanner.core.model.TaskScore;
import com.gridplanner.core.model.UrgencyBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts priority, category, duration and milestone status into the visual weight and
 * prominence scores that order stacking and decide collision wins.
 * <p>
 * Time-relative urgency is computed against an explicit reference date, never the system clock,
 * so identical inputs always score identically.
 */
@Service
public class PriorityScorer {

    private static final Logger log = LoggerFactory.getLogger(PriorityScorer.class);

    static final int MAX_PRIORITY = 5;
    static final double LONG_TASK_FACTOR = 1.2;
    static final double SHORT_TASK_FACTOR = 0.8;
    static final double MILESTONE_NAME_FACTOR = 1.5;
    static final double MILESTONE_PROMINENCE_FACTOR = 1.2;

    private final CategoryCatalog categories;

    public PriorityScorer(CategoryCatalog categories) {
        this.categories = categories;
    }

    /**
     * Scores every task, keyed by task ID in input order.
     *
     * @param tasks             tasks to score
     * @param referenceDate     the "current" date for urgency; null disables the urgency adjustment
     * @param urgencyWindowDays tasks starting within this many days after the reference date are more urgent
     */
    public Map<String, TaskScore> scoreAll(List<Task> tasks, LocalDate referenceDate, int urgencyWindowDays) {
        var scores = new LinkedHashMap<String, TaskScore>();
        for (Task task : tasks) {
            scores.put(task.id(), score(task, referenceDate, urgencyWindowDays));
        }
        return scores;
    }

    public TaskScore score(Task task, LocalDate referenceDate, int urgencyWindowDays) {
        CategoryStyle category = categories.lookup(task.category());
        double baseWeight = baseWeight(task);
        double visualWeight = visualWeight(task, baseWeight, category);
        UrgencyBand band = urgencyBand(task, referenceDate, urgencyWindowDays);
        boolean milestone = task.isMilestone() || category.milestone();

        double prominence = visualWeight * band.multiplier();
        if (milestone) {
            prominence *= MILESTONE_PROMINENCE_FACTOR;
        }
        prominence = clamp(prominence);

        log.debug("Scored {}: base={} visual={} band={} prominence={}",
                task.id(), baseWeight, visualWeight, band, prominence);
        return new TaskScore(task.id(), band, baseWeight, visualWeight, prominence, milestone);
    }

    double baseWeight(Task task) {
        return clamp((double) task.priority() / MAX_PRIORITY);
    }

    double visualWeight(Task task, double baseWeight, CategoryStyle category) {
        double weight = baseWeight;
        long duration = task.durationDays();
        if (duration > 7) {
            weight *= LONG_TASK_FACTOR;
        } else if (duration < 1) {
            weight *= SHORT_TASK_FACTOR;
        }
        weight *= category.weight() / (double) CategoryCatalog.NEUTRAL_WEIGHT;
        if (task.isMilestone()) {
            weight *= MILESTONE_NAME_FACTOR;
        }
        return clamp(weight);
    }

    /**
     * Band from priority, raised one level when the task is running on the reference date
     * or starts within the urgency window after it.
     */
    UrgencyBand urgencyBand(Task task, LocalDate referenceDate, int urgencyWindowDays) {
        UrgencyBand band = UrgencyBand.fromPriority(task.priority());
        if (referenceDate == null) {
            return band;
        }
        boolean active = !task.startDate().isAfter(referenceDate) && !task.endDate().isBefore(referenceDate);
        boolean imminent = task.startDate().isAfter(referenceDate)
                && !task.startDate().isAfter(referenceDate.plusDays(urgencyWindowDays));
        return active || imminent ? band.raise() : band;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
