package com.gridplanner.core.metrics;

import com.gridplanner.core.model.OverlapSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for layout runs.
 */
@Service
public class PlannerMetrics {

    private final MeterRegistry registry;

    public PlannerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLayoutDuration(long ms) {
        Timer.builder("gridplanner.layout.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskCount(int tasks) {
        DistributionSummary.builder("gridplanner.layout.tasks")
                .description("Tasks per layout run")
                .register(registry)
                .record(tasks);
    }

    public void recordOverlaps(OverlapSeverity severity, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder("gridplanner.overlaps.total")
                .tag("severity", severity.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment(count);
    }

    /**
     * Records the outcome of the collision pass.
     *
     * @param resolved colliding pairs that were separated
     * @param residual colliding pairs left after the single pass
     */
    public void recordCollisions(int resolved, int residual) {
        Counter.builder("gridplanner.collisions.resolved")
                .register(registry)
                .increment(resolved);
        Counter.builder("gridplanner.collisions.residual")
                .description("Collisions left after the single resolution pass")
                .register(registry)
                .increment(residual);
    }

    public void recordRowOverflow(int overflow) {
        Counter.builder("gridplanner.rows.overflow")
                .description("Tasks placed on row 0 because the row cap was reached")
                .register(registry)
                .increment(overflow);
    }

    public void recordSegments(int segments) {
        Counter.builder("gridplanner.segments.total")
                .register(registry)
                .increment(segments);
    }
}
