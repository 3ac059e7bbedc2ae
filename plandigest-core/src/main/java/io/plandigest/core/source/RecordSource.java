package io.plandigest.core.source;

import io.plandigest.core.model.Plan;
import io.plandigest.core.model.PlanRun;
import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Read-only access to the plans and plan runs recorded by the execution platform.
 * Implementations may return fewer records than exist; callers never page past one response.
 */
public interface RecordSource {
    String name();

    List<PlanRun> listRuns(RunQuery query) throws IOException;

    List<Plan> listPlans(int limit) throws IOException;

    /**
     * @throws RecordSourceException when the plan does not exist or cannot be fetched
     */
    Plan getPlan(String planId) throws IOException;

    PlanRun getRun(String runId) throws IOException;

    /**
     * Plans whose creation time falls in {@code [since, until]}. The default fetches one page of
     * plans and filters locally; backends with a native range query should override it.
     */
    default List<Plan> listPlansCreated(Instant since, Instant until, int limit) throws IOException {
        return listPlans(limit).stream()
            .filter(plan -> !plan.createdAt().isBefore(since) && !plan.createdAt().isAfter(until))
            .toList();
    }
}
