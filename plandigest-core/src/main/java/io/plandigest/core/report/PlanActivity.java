package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanActivity(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("run_count") int runCount,
    @JsonProperty("mean_duration_seconds") double meanDurationSeconds,
    @JsonProperty("median_duration_seconds") double medianDurationSeconds
) {
}
