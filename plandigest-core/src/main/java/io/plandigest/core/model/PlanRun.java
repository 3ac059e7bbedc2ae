package io.plandigest.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanRun(
    String id,
    @JsonProperty("plan_id") @JsonAlias({"plan", "planId"}) String planId,
    @JsonAlias({"run_state"}) String state,
    @JsonProperty("created_at") @JsonAlias({"createdAt"}) Instant createdAt,
    @JsonProperty("completed_at") @JsonAlias({"completedAt"}) Instant completedAt,
    @JsonProperty("duration_ms") @JsonAlias({"durationMs"}) Long durationMs,
    Map<String, Object> metadata
) {
    public PlanRun {
        Objects.requireNonNull(id, "id must not be null");
        planId = planId == null ? "" : planId.trim();
        state = state == null ? "" : state.trim();
        if (durationMs != null && durationMs < 0) {
            durationMs = null;
        }
        metadata = copyMetadata(metadata);
    }

    public RunState runState() {
        return RunState.parse(state);
    }

    public boolean hasDuration() {
        return durationMs != null;
    }

    public double durationSeconds() {
        return durationMs == null ? 0.0 : durationMs / 1000.0;
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }
}
