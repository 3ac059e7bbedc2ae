package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ToolUsage(
    @JsonProperty("total_tool_invocations") int totalToolInvocations,
    @JsonProperty("unique_tools_used") int uniqueToolsUsed,
    @JsonProperty("malformed_entries") int malformedEntries,
    @JsonProperty("top_tools") List<ToolStat> topTools,
    @JsonProperty("tool_distribution") Map<String, Integer> toolDistribution
) {
    public ToolUsage {
        topTools = topTools == null ? List.of() : List.copyOf(topTools);
        // ranking order is part of the contract, so keep insertion order
        toolDistribution = toolDistribution == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(toolDistribution));
    }
}
