package io.plandigest.core.analysis;

import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import io.plandigest.core.report.ExecutionRate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Share of the plans created in a window that ran at least once in it. Works on the two id sets
 * rather than per-run lookups, so a created plan without runs only adds to the denominator.
 */
public final class ExecutionRateCalculator {

    public ExecutionRate compute(Collection<Plan> plansCreated, Collection<PlanRun> runs) {
        Set<String> created = new TreeSet<>();
        for (Plan plan : plansCreated) {
            created.add(plan.id());
        }
        if (created.isEmpty()) {
            return new ExecutionRate(0.0, 0, 0, List.of());
        }

        Set<String> executed = new TreeSet<>();
        for (PlanRun run : runs) {
            executed.add(run.planId());
        }

        Set<String> intersection = new TreeSet<>(created);
        intersection.retainAll(executed);
        return new ExecutionRate(
            DurationStatistics.percentage(intersection.size(), created.size()),
            intersection.size(),
            created.size(),
            List.copyOf(intersection)
        );
    }
}
