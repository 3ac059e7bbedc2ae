package io.plandigest.core.model;

import java.util.List;

public record ToolTrace(List<ToolInvocation> invocations, int malformedEntries) {
    public static final ToolTrace EMPTY = new ToolTrace(List.of(), 0);

    public ToolTrace {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        malformedEntries = Math.max(0, malformedEntries);
    }
}
