package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolStat(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("usage_count") int usageCount,
    @JsonProperty("success_count") int successCount,
    @JsonProperty("total_invocations") int totalInvocations,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("avg_duration_seconds") Double avgDurationSeconds,
    @JsonProperty("median_duration_seconds") Double medianDurationSeconds,
    @JsonProperty("min_duration_seconds") Double minDurationSeconds,
    @JsonProperty("max_duration_seconds") Double maxDurationSeconds
) {
}
