package io.plandigest.core.report;

import java.util.List;

public record FailureAnalysis(int count, List<FailureDetail> details) {
    public FailureAnalysis {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
