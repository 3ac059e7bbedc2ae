package io.plandigest.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates the {@code tools_used} metadata entry of a run into typed {@link ToolInvocation}s.
 * Entries that cannot be trusted are skipped and counted instead of failing the run.
 */
public final class ToolTraceParser {
    public static final String TOOLS_USED_KEY = "tools_used";

    public ToolTrace parse(PlanRun run) {
        if (run == null) {
            return ToolTrace.EMPTY;
        }
        return parse(run.metadata());
    }

    public ToolTrace parse(Map<String, Object> metadata) {
        if (metadata == null || !metadata.containsKey(TOOLS_USED_KEY)) {
            return ToolTrace.EMPTY;
        }
        Object raw = metadata.get(TOOLS_USED_KEY);
        if (!(raw instanceof List<?> entries)) {
            return new ToolTrace(List.of(), 1);
        }

        List<ToolInvocation> invocations = new ArrayList<>();
        int malformed = 0;
        for (Object entry : entries) {
            ToolInvocation invocation = toInvocation(entry);
            if (invocation == null) {
                malformed++;
            } else {
                invocations.add(invocation);
            }
        }
        return new ToolTrace(invocations, malformed);
    }

    private ToolInvocation toInvocation(Object entry) {
        if (!(entry instanceof Map<?, ?> fields)) {
            return null;
        }
        if (!(fields.get("name") instanceof String name) || name.isBlank()) {
            return null;
        }

        Object successValue = fields.get("success");
        boolean success = true;
        if (successValue != null) {
            if (!(successValue instanceof Boolean flag)) {
                return null;
            }
            success = flag;
        }

        Object durationValue = fields.get("duration_ms");
        Long durationMs = null;
        if (durationValue != null) {
            if (!(durationValue instanceof Number number) || number.doubleValue() < 0) {
                return null;
            }
            durationMs = number.longValue();
        }
        return new ToolInvocation(name.trim(), success, durationMs);
    }
}
