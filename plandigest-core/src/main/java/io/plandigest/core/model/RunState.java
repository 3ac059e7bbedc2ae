package io.plandigest.core.model;

import java.util.Locale;

public enum RunState {
    NOT_STARTED,
    PENDING,
    IN_PROGRESS,
    RUNNING,
    NEED_CLARIFICATION,
    READY_TO_RESUME,
    COMPLETE,
    FAILED,
    UNKNOWN;

    public static RunState parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (RunState state : values()) {
            if (state.name().equals(normalized)) {
                return state;
            }
        }
        return UNKNOWN;
    }

    public String wireValue() {
        return name();
    }

    public boolean isSuccess() {
        return this == COMPLETE;
    }

    public boolean isFailure() {
        return this == FAILED;
    }
}
