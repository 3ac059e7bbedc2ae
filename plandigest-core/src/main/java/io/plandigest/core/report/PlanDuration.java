package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanDuration(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("avg_duration") double avgDuration,
    @JsonProperty("run_count") int runCount
) {
}
