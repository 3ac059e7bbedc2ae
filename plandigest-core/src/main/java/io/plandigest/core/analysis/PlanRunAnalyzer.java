package io.plandigest.core.analysis;

import io.plandigest.core.model.AnalysisWindow;
import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import io.plandigest.core.model.RunState;
import io.plandigest.core.report.AnalysisReport;
import io.plandigest.core.report.CreatedPlan;
import io.plandigest.core.report.DurationStats;
import io.plandigest.core.report.PlansCreated;
import io.plandigest.core.report.ReportWindow;
import io.plandigest.core.report.ResourceUsage;
import io.plandigest.core.source.RecordSource;
import io.plandigest.core.source.RunQuery;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an {@link AnalysisReport} for one window of plan runs. Every section is derived from the
 * three run fetches and the plans-created fetch. Apart from a defaulted window end, only
 * {@code generated_at} reads the clock.
 */
public final class PlanRunAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(PlanRunAnalyzer.class);
    public static final int DEFAULT_FETCH_LIMIT = 1000;

    private final RecordSource source;
    private final Clock clock;
    private final AnalysisProfile profile;
    private final int fetchLimit;
    private final PlanRankings rankings = new PlanRankings();
    private final TemporalDistribution temporal = new TemporalDistribution();
    private final FailureAnalyzer failures = new FailureAnalyzer();
    private final ToolUsageAnalyzer tools = new ToolUsageAnalyzer();
    private final ExecutionRateCalculator executionRate = new ExecutionRateCalculator();

    public PlanRunAnalyzer(RecordSource source, Clock clock) {
        this(source, clock, AnalysisProfile.STANDARD, DEFAULT_FETCH_LIMIT);
    }

    public PlanRunAnalyzer(RecordSource source, Clock clock, AnalysisProfile profile, int fetchLimit) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.profile = Objects.requireNonNull(profile, "profile must not be null");
        if (fetchLimit < 1) {
            throw new IllegalArgumentException("fetchLimit must be >= 1");
        }
        this.fetchLimit = fetchLimit;
    }

    public AnalysisReport analyzeWindow(Instant since, Instant until, boolean includeToolMetrics) throws IOException {
        return analyze(AnalysisWindow.of(since, until, clock), includeToolMetrics);
    }

    public AnalysisReport analyze(AnalysisWindow window, boolean includeToolMetrics) throws IOException {
        Objects.requireNonNull(window, "window must not be null");
        List<PlanRun> allRuns = source.listRuns(RunQuery.inWindow(window, null, fetchLimit));
        List<PlanRun> completedRuns = source.listRuns(RunQuery.inWindow(window, RunState.COMPLETE, fetchLimit));
        List<PlanRun> failedRuns = source.listRuns(RunQuery.inWindow(window, RunState.FAILED, fetchLimit));
        List<Plan> plansCreated = plansCreated(window);
        LOG.debug(
            "Fetched {} runs ({} complete, {} failed) and {} created plans from {}",
            allRuns.size(),
            completedRuns.size(),
            failedRuns.size(),
            plansCreated.size(),
            source.name()
        );

        ReportWindow reportWindow = ReportWindow.of(window);
        if (allRuns.isEmpty()) {
            return AnalysisReport.empty(reportWindow, clock.instant());
        }

        PlanResolver resolver = PlanResolver.fetch(source, planIds(allRuns, completedRuns, failedRuns), clock);
        List<PlanRun> timedRuns = completedRuns.stream().filter(PlanRun::hasDuration).toList();
        DurationStats durationStats = DurationStatistics.summarize(
            timedRuns.stream().map(PlanRun::durationSeconds).toList()
        );
        int topK = profile.topK();

        ToolUsageAnalyzer.ToolReport toolReport = includeToolMetrics ? tools.analyze(completedRuns, profile) : null;

        return new AnalysisReport(
            reportWindow,
            clock.instant(),
            null,
            allRuns.size(),
            completedRuns.size(),
            failedRuns.size(),
            DurationStatistics.percentage(completedRuns.size(), allRuns.size()),
            plansCreated.size(),
            plansCreatedDetails(plansCreated),
            executionRate.compute(plansCreated, allRuns),
            durationStats,
            rankings.planDurationStats(completedRuns, resolver),
            rankings.perPlanStats(completedRuns, resolver),
            rankings.extremeRuns(completedRuns, resolver, true, topK),
            rankings.extremeRuns(completedRuns, resolver, false, topK),
            rankings.extremePlans(completedRuns, resolver, true, topK),
            rankings.extremePlans(completedRuns, resolver, false, topK),
            rankings.planSuccessRates(allRuns, resolver),
            temporal.hourly(completedRuns),
            temporal.daily(completedRuns),
            failures.analyze(failedRuns, resolver),
            resourceUsage(completedRuns),
            toolReport == null ? null : toolReport.usage(),
            toolReport == null ? null : toolReport.performance()
        );
    }

    private List<Plan> plansCreated(AnalysisWindow window) {
        try {
            return source.listPlansCreated(window.since(), window.until(), fetchLimit);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not fetch plans created between {} and {}; continuing without them", window.since(), window.until(), e);
            return List.of();
        }
    }

    private static Set<String> planIds(List<PlanRun> allRuns, List<PlanRun> completedRuns, List<PlanRun> failedRuns) {
        Set<String> ids = new TreeSet<>();
        for (List<PlanRun> runs : List.of(allRuns, completedRuns, failedRuns)) {
            for (PlanRun run : runs) {
                if (run.planId() != null) {
                    ids.add(run.planId());
                }
            }
        }
        return ids;
    }

    private static ResourceUsage resourceUsage(List<PlanRun> completedRuns) {
        if (completedRuns.isEmpty()) {
            return new ResourceUsage(0.0, 0.0, 0);
        }
        double total = 0.0;
        for (PlanRun run : completedRuns) {
            if (run.hasDuration()) {
                total += run.durationSeconds();
            }
        }
        return new ResourceUsage(total, total / completedRuns.size(), completedRuns.size());
    }

    private static PlansCreated plansCreatedDetails(List<Plan> plans) {
        List<CreatedPlan> details = new ArrayList<>();
        plans.stream()
            .sorted(Comparator.comparing(Plan::createdAt).reversed().thenComparing(Plan::id))
            .forEach(plan -> details.add(new CreatedPlan(plan.id(), plan.name(), plan.createdAt(), plan.updatedAt())));
        return new PlansCreated(details.size(), details);
    }
}
