package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ToolPerformance(
    @JsonProperty("tool_count") int toolCount,
    @JsonProperty("performance_details") List<ToolPerformanceDetail> performanceDetails
) {
    public ToolPerformance {
        performanceDetails = performanceDetails == null ? List.of() : List.copyOf(performanceDetails);
    }
}
