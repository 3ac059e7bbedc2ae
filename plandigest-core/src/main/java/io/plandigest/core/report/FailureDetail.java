package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureDetail(
    @JsonProperty("run_id") String runId,
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("failed_at") Instant failedAt,
    @JsonProperty("error_message") String errorMessage
) {
}
