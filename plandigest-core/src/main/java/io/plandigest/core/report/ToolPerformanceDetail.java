package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ToolPerformanceDetail(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("avg_duration") double avgDuration,
    @JsonProperty("median_duration") double medianDuration,
    @JsonProperty("min_duration") double minDuration,
    @JsonProperty("max_duration") double maxDuration,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("total_invocations") int totalInvocations
) {
}
