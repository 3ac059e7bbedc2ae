package io.plandigest.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordSnapshot(
    List<Plan> plans,
    @JsonProperty("plan_runs") @JsonAlias({"planRuns", "runs"}) List<PlanRun> planRuns
) {
    public RecordSnapshot {
        plans = plans == null ? List.of() : List.copyOf(plans);
        planRuns = planRuns == null ? List.of() : List.copyOf(planRuns);
    }
}
