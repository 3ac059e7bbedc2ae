package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record PlanDurationStats(
    @JsonProperty("plan_count") int planCount,
    @JsonProperty("overall_avg_plan_duration") double overallAvgPlanDuration,
    @JsonProperty("plan_details") List<PlanDurationDetail> planDetails
) {
    public PlanDurationStats {
        planDetails = planDetails == null ? List.of() : List.copyOf(planDetails);
    }
}
