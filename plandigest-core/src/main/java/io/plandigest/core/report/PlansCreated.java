package io.plandigest.core.report;

import java.util.List;

public record PlansCreated(int count, List<CreatedPlan> details) {
    public PlansCreated {
        details = details == null ? List.of() : List.copyOf(details);
    }
}
