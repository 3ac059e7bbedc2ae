package io.plandigest.cli;

import io.plandigest.core.report.AnalysisReport;
import io.plandigest.core.report.DurationStats;
import io.plandigest.core.report.PlanActivity;
import io.plandigest.core.report.ToolStat;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text digest of a report for the terminal. The JSON form carries every section; this one
 * keeps to the headline numbers.
 */
final class DigestFormatter {
    private static final int TOP_PLANS = 5;

    String format(AnalysisReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Plan run digest").append('\n');
        out.append("Window: ").append(report.window().since()).append(" -> ").append(report.window().until()).append('\n');
        if (report.isEmptyWindow()) {
            out.append(report.message()).append('\n');
            return out.toString();
        }

        out.append("Total runs: ").append(report.totalRuns())
            .append(" (completed ").append(report.completedRuns())
            .append(", failed ").append(report.failedRuns()).append(")\n");
        out.append("Success rate: ").append(percent(report.successRate())).append('\n');
        out.append("Plans created: ").append(report.plansCreated())
            .append(", execution rate ").append(percent(report.executionRate().rate())).append('\n');

        DurationStats durations = report.durationStats();
        if (durations.count() > 0) {
            out.append("Durations: mean ").append(seconds(durations.meanSeconds()))
                .append(", median ").append(seconds(durations.medianSeconds()))
                .append(", p95 ").append(seconds(durations.p95Seconds())).append('\n');
        } else {
            out.append("Durations: no timed runs").append('\n');
        }

        List<PlanActivity> plans = report.perPlanStats();
        if (!plans.isEmpty()) {
            out.append("Most active plans:").append('\n');
            for (PlanActivity plan : plans.subList(0, Math.min(TOP_PLANS, plans.size()))) {
                out.append("  - ").append(plan.planName())
                    .append(" [").append(plan.planId()).append("] ")
                    .append(plan.runCount()).append(" runs, mean ")
                    .append(seconds(plan.meanDurationSeconds())).append('\n');
            }
        }

        out.append("Failures: ").append(report.failureAnalysis().count()).append('\n');

        if (report.hasToolMetrics()) {
            out.append("Tool invocations: ").append(report.toolUsage().totalToolInvocations())
                .append(" across ").append(report.toolUsage().uniqueToolsUsed()).append(" tools").append('\n');
            for (ToolStat tool : report.toolUsage().topTools()) {
                out.append("  - ").append(tool.toolName())
                    .append(": ").append(tool.usageCount()).append(" calls, ")
                    .append(percent(tool.successRate())).append(" success").append('\n');
            }
        }
        return out.toString();
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.1f%%", value);
    }

    private static String seconds(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.2fs", value);
    }
}
