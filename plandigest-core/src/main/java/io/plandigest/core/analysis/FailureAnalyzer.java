package io.plandigest.core.analysis;

import io.plandigest.core.model.PlanRun;
import io.plandigest.core.report.FailureAnalysis;
import io.plandigest.core.report.FailureDetail;
import java.util.List;
import java.util.Map;

public final class FailureAnalyzer {
    public static final String UNKNOWN_ERROR = "Unknown error";

    public FailureAnalysis analyze(List<PlanRun> failedRuns, PlanResolver resolver) {
        List<FailureDetail> details = failedRuns.stream()
            .map(run -> new FailureDetail(
                run.id(),
                run.planId(),
                resolver.nameOf(run.planId()),
                run.completedAt(),
                errorMessage(run.metadata())
            ))
            .toList();
        return new FailureAnalysis(failedRuns.size(), details);
    }

    String errorMessage(Map<String, Object> metadata) {
        if (metadata == null) {
            return UNKNOWN_ERROR;
        }
        Object error = metadata.get("error");
        if (error instanceof Map<?, ?> structured && structured.get("message") != null) {
            error = structured.get("message");
        }
        String message = error == null ? "" : String.valueOf(error).trim();
        return message.isEmpty() ? UNKNOWN_ERROR : message;
    }
}
