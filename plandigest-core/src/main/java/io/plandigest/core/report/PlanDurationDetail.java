package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PlanDurationDetail(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("avg_duration") double avgDuration,
    @JsonProperty("median_duration") double medianDuration,
    @JsonProperty("min_duration") double minDuration,
    @JsonProperty("max_duration") double maxDuration,
    @JsonProperty("run_count") int runCount
) {
}
