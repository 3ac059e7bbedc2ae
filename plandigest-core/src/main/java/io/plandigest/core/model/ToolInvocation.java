package io.plandigest.core.model;

import java.util.Objects;

public record ToolInvocation(String name, boolean success, Long durationMs) {
    public ToolInvocation {
        Objects.requireNonNull(name, "name must not be null");
    }

    public boolean hasDuration() {
        return durationMs != null;
    }
}
