package io.plandigest.core.analysis;

import io.plandigest.core.model.PlanRun;
import io.plandigest.core.model.ToolInvocation;
import io.plandigest.core.model.ToolTrace;
import io.plandigest.core.model.ToolTraceParser;
import io.plandigest.core.report.ToolPerformance;
import io.plandigest.core.report.ToolPerformanceDetail;
import io.plandigest.core.report.ToolStat;
import io.plandigest.core.report.ToolUsage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class ToolUsageAnalyzer {
    private final ToolTraceParser parser;

    public ToolUsageAnalyzer() {
        this(new ToolTraceParser());
    }

    public ToolUsageAnalyzer(ToolTraceParser parser) {
        this.parser = parser;
    }

    public ToolReport analyze(List<PlanRun> completedRuns, AnalysisProfile profile) {
        Map<String, ToolAggregate> aggregates = new TreeMap<>();
        int malformed = 0;
        int total = 0;
        for (PlanRun run : completedRuns) {
            ToolTrace trace = parser.parse(run);
            malformed += trace.malformedEntries();
            for (ToolInvocation invocation : trace.invocations()) {
                aggregates.computeIfAbsent(invocation.name(), ToolAggregate::new).add(invocation);
                total++;
            }
        }

        List<ToolAggregate> ranked = aggregates.values().stream()
            .sorted(Comparator.comparingInt(ToolAggregate::total).reversed().thenComparing(ToolAggregate::name))
            .limit(profile.topTools())
            .toList();

        List<ToolStat> topTools = new ArrayList<>();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (ToolAggregate aggregate : ranked) {
            topTools.add(toStat(aggregate, profile.extendedToolStats()));
            distribution.put(aggregate.name(), aggregate.total());
        }
        ToolUsage usage = new ToolUsage(total, aggregates.size(), malformed, topTools, distribution);

        List<ToolPerformanceDetail> performance = aggregates.values().stream()
            .filter(aggregate -> !aggregate.durations().isEmpty())
            .sorted(Comparator.comparingDouble(ToolAggregate::meanDuration).reversed().thenComparing(ToolAggregate::name))
            .map(aggregate -> new ToolPerformanceDetail(
                aggregate.name(),
                aggregate.meanDuration(),
                DurationStatistics.median(aggregate.durations()),
                DurationStatistics.min(aggregate.durations()),
                DurationStatistics.max(aggregate.durations()),
                aggregate.successRate(),
                aggregate.total()
            ))
            .toList();

        return new ToolReport(usage, new ToolPerformance(performance.size(), performance));
    }

    private ToolStat toStat(ToolAggregate aggregate, boolean extended) {
        List<Double> durations = aggregate.durations();
        boolean timed = !durations.isEmpty();
        return new ToolStat(
            aggregate.name(),
            aggregate.total(),
            aggregate.successes(),
            aggregate.total(),
            aggregate.successRate(),
            timed ? aggregate.meanDuration() : null,
            timed && extended ? DurationStatistics.median(durations) : null,
            timed && extended ? DurationStatistics.min(durations) : null,
            timed && extended ? DurationStatistics.max(durations) : null
        );
    }

    public record ToolReport(ToolUsage usage, ToolPerformance performance) {
    }

    private static final class ToolAggregate {
        private final String name;
        private final List<Double> durations = new ArrayList<>();
        private int total;
        private int successes;

        private ToolAggregate(String name) {
            this.name = name;
        }

        private void add(ToolInvocation invocation) {
            total++;
            if (invocation.success()) {
                successes++;
            }
            if (invocation.hasDuration()) {
                durations.add(invocation.durationMs() / 1000.0);
            }
        }

        private String name() {
            return name;
        }

        private int total() {
            return total;
        }

        private int successes() {
            return successes;
        }

        private List<Double> durations() {
            return durations;
        }

        private double meanDuration() {
            return DurationStatistics.mean(durations);
        }

        private double successRate() {
            return DurationStatistics.percentage(successes, total);
        }
    }
}
