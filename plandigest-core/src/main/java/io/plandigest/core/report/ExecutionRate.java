package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ExecutionRate(
    double rate,
    @JsonProperty("executed_plans") int executedPlans,
    @JsonProperty("total_plans") int totalPlans,
    @JsonProperty("executed_plan_ids") List<String> executedPlanIds
) {
    public ExecutionRate {
        executedPlanIds = executedPlanIds == null ? List.of() : List.copyOf(executedPlanIds);
    }
}
