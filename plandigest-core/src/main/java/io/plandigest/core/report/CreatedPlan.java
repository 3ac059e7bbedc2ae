package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record CreatedPlan(
    @JsonProperty("plan_id") String planId,
    @JsonProperty("plan_name") String planName,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {
}
