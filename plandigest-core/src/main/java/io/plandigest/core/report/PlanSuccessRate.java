package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanSuccessRate(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("completed_runs") int completedRuns,
    @JsonProperty("failed_runs") int failedRuns,
    @JsonProperty("total_runs") int totalRuns
) {
}
