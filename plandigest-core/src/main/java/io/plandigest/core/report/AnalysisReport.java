package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Analytics for one window of plan runs. Sections that were not computed are {@code null} and are
 * left out of the JSON form; {@code generatedAt} is the only field that depends on the wall clock.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "window",
    "generated_at",
    "message",
    "total_runs",
    "completed_runs",
    "failed_runs",
    "success_rate",
    "plans_created",
    "plans_created_details",
    "execution_rate",
    "duration_stats",
    "plan_duration_stats",
    "per_plan_stats",
    "fastest_runs",
    "slowest_runs",
    "fastest_plans",
    "slowest_plans",
    "plan_success_rates",
    "hourly_distribution",
    "daily_distribution",
    "failure_analysis",
    "resource_usage",
    "tool_usage",
    "tool_performance"
})
public record AnalysisReport(
    ReportWindow window,
    @JsonProperty("generated_at") Instant generatedAt,
    String message,
    @JsonProperty("total_runs") int totalRuns,
    @JsonProperty("completed_runs") Integer completedRuns,
    @JsonProperty("failed_runs") Integer failedRuns,
    @JsonProperty("success_rate") Double successRate,
    @JsonProperty("plans_created") Integer plansCreated,
    @JsonProperty("plans_created_details") PlansCreated plansCreatedDetails,
    @JsonProperty("execution_rate") ExecutionRate executionRate,
    @JsonProperty("duration_stats") DurationStats durationStats,
    @JsonProperty("plan_duration_stats") PlanDurationStats planDurationStats,
    @JsonProperty("per_plan_stats") List<PlanActivity> perPlanStats,
    @JsonProperty("fastest_runs") List<RunDuration> fastestRuns,
    @JsonProperty("slowest_runs") List<RunDuration> slowestRuns,
    @JsonProperty("fastest_plans") List<PlanDuration> fastestPlans,
    @JsonProperty("slowest_plans") List<PlanDuration> slowestPlans,
    @JsonProperty("plan_success_rates") List<PlanSuccessRate> planSuccessRates,
    @JsonProperty("hourly_distribution") SortedMap<Integer, Integer> hourlyDistribution,
    @JsonProperty("daily_distribution") SortedMap<String, Integer> dailyDistribution,
    @JsonProperty("failure_analysis") FailureAnalysis failureAnalysis,
    @JsonProperty("resource_usage") ResourceUsage resourceUsage,
    @JsonProperty("tool_usage") ToolUsage toolUsage,
    @JsonProperty("tool_performance") ToolPerformance toolPerformance
) {
    public static final String NO_RUNS_MESSAGE = "No plan runs found in the specified window.";

    public AnalysisReport {
        perPlanStats = copy(perPlanStats);
        fastestRuns = copy(fastestRuns);
        slowestRuns = copy(slowestRuns);
        fastestPlans = copy(fastestPlans);
        slowestPlans = copy(slowestPlans);
        planSuccessRates = copy(planSuccessRates);
        hourlyDistribution = hourlyDistribution == null ? null : Collections.unmodifiableSortedMap(new TreeMap<>(hourlyDistribution));
        dailyDistribution = dailyDistribution == null ? null : Collections.unmodifiableSortedMap(new TreeMap<>(dailyDistribution));
    }

    public static AnalysisReport empty(ReportWindow window, Instant generatedAt) {
        return new AnalysisReport(
            window,
            generatedAt,
            NO_RUNS_MESSAGE,
            0,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }

    @JsonIgnore
    public boolean isEmptyWindow() {
        return totalRuns == 0;
    }

    @JsonIgnore
    public boolean hasToolMetrics() {
        return toolUsage != null;
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? null : List.copyOf(values);
    }
}
