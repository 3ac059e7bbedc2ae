package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ResourceUsage(
    @JsonProperty("total_duration") double totalDuration,
    @JsonProperty("avg_duration") double avgDuration,
    @JsonProperty("total_runs") int totalRuns
) {
}
