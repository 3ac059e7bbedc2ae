package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunDuration(
    @JsonProperty("run_id") String runId,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("duration_seconds") double durationSeconds,
    @JsonProperty("completed_at") Instant completedAt
) {
}
