package io.plandigest.core.analysis;

import io.plandigest.core.model.PlanRun;
import io.plandigest.core.model.RunState;
import io.plandigest.core.report.PlanActivity;
import io.plandigest.core.report.PlanDuration;
import io.plandigest.core.report.PlanDurationDetail;
import io.plandigest.core.report.PlanDurationStats;
import io.plandigest.core.report.PlanSuccessRate;
import io.plandigest.core.report.RunDuration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-plan grouping of runs and the rankings derived from it. Every ordering falls back to the
 * plan or run identifier so equal keys always come out in the same order.
 */
public final class PlanRankings {
    private static final Comparator<PlanRun> BY_DURATION_ASC = Comparator
        .comparing(PlanRun::durationMs)
        .thenComparing(PlanRun::id);
    private static final Comparator<PlanRun> BY_DURATION_DESC = Comparator
        .comparing(PlanRun::durationMs, Comparator.reverseOrder())
        .thenComparing(PlanRun::id);

    public List<PlanActivity> perPlanStats(List<PlanRun> completedRuns, PlanResolver resolver) {
        return group(completedRuns).stream()
            .sorted(Comparator.comparingInt(PlanGroup::runCount).reversed().thenComparing(PlanGroup::planId))
            .map(group -> new PlanActivity(
                group.planId(),
                resolver.nameOf(group.planId()),
                group.runCount(),
                group.mean(),
                group.median()
            ))
            .toList();
    }

    public List<RunDuration> extremeRuns(List<PlanRun> completedRuns, PlanResolver resolver, boolean fastest, int limit) {
        return completedRuns.stream()
            .filter(PlanRun::hasDuration)
            .sorted(fastest ? BY_DURATION_ASC : BY_DURATION_DESC)
            .limit(Math.max(0, limit))
            .map(run -> new RunDuration(
                run.id(),
                run.planId(),
                resolver.nameOf(run.planId()),
                run.durationSeconds(),
                run.completedAt()
            ))
            .toList();
    }

    public List<PlanDuration> extremePlans(List<PlanRun> completedRuns, PlanResolver resolver, boolean fastest, int limit) {
        Comparator<PlanGroup> byMean = fastest
            ? Comparator.comparingDouble(PlanGroup::mean)
            : Comparator.comparingDouble(PlanGroup::mean).reversed();
        return group(completedRuns).stream()
            .sorted(byMean.thenComparing(PlanGroup::planId))
            .limit(Math.max(0, limit))
            .map(group -> new PlanDuration(group.planId(), resolver.nameOf(group.planId()), group.mean(), group.runCount()))
            .toList();
    }

    public List<PlanSuccessRate> planSuccessRates(List<PlanRun> allRuns, PlanResolver resolver) {
        Map<String, int[]> counts = new TreeMap<>();
        for (PlanRun run : allRuns) {
            // completed, failed, total
            int[] tally = counts.computeIfAbsent(run.planId(), ignored -> new int[3]);
            RunState state = run.runState();
            if (state.isSuccess()) {
                tally[0]++;
            } else if (state.isFailure()) {
                tally[1]++;
            }
            tally[2]++;
        }

        List<PlanSuccessRate> rates = new ArrayList<>();
        counts.forEach((planId, tally) -> rates.add(new PlanSuccessRate(
            planId,
            resolver.nameOf(planId),
            DurationStatistics.percentage(tally[0], tally[2]),
            tally[0],
            tally[1],
            tally[2]
        )));
        rates.sort(Comparator.comparingDouble(PlanSuccessRate::successRate).reversed().thenComparing(PlanSuccessRate::planId));
        return rates;
    }

    public PlanDurationStats planDurationStats(List<PlanRun> completedRuns, PlanResolver resolver) {
        List<PlanDurationDetail> details = group(completedRuns).stream()
            .sorted(Comparator.comparingDouble(PlanGroup::mean).reversed().thenComparing(PlanGroup::planId))
            .map(group -> new PlanDurationDetail(
                group.planId(),
                resolver.nameOf(group.planId()),
                group.mean(),
                group.median(),
                DurationStatistics.min(group.durations()),
                DurationStatistics.max(group.durations()),
                group.runCount()
            ))
            .toList();
        double overall = DurationStatistics.mean(details.stream().map(PlanDurationDetail::avgDuration).toList());
        return new PlanDurationStats(details.size(), overall, details);
    }

    List<PlanGroup> group(List<PlanRun> runs) {
        Map<String, List<Double>> durationsByPlan = new TreeMap<>();
        for (PlanRun run : runs) {
            if (run.hasDuration()) {
                durationsByPlan.computeIfAbsent(run.planId(), ignored -> new ArrayList<>()).add(run.durationSeconds());
            }
        }
        List<PlanGroup> groups = new ArrayList<>();
        durationsByPlan.forEach((planId, durations) -> groups.add(new PlanGroup(planId, durations)));
        return groups;
    }

    record PlanGroup(String planId, List<Double> durations) {
        PlanGroup {
            durations = List.copyOf(durations);
        }

        int runCount() {
            return durations.size();
        }

        double mean() {
            return DurationStatistics.mean(durations);
        }

        double median() {
            return DurationStatistics.median(durations);
        }
    }
}
