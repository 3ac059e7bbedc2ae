package io.plandigest.core.source;

import io.plandigest.core.model.AnalysisWindow;
import io.plandigest.core.model.RunState;
import java.time.Instant;

public record RunQuery(
    String planId,
    RunState state,
    Instant since,
    Instant until,
    int limit
) {
    public RunQuery {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        planId = planId == null || planId.isBlank() ? null : planId.trim();
    }

    public static RunQuery inWindow(AnalysisWindow window, RunState state, int limit) {
        return new RunQuery(null, state, window.since(), window.until(), limit);
    }

    public static RunQuery latest(int limit) {
        return new RunQuery(null, null, null, null, limit);
    }

    public boolean matchesWindow(Instant createdAt) {
        if (createdAt == null) {
            return since == null && until == null;
        }
        boolean afterStart = since == null || !createdAt.isBefore(since);
        boolean beforeEnd = until == null || createdAt.isBefore(until);
        return afterStart && beforeEnd;
    }
}
