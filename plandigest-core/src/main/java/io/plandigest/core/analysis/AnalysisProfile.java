package io.plandigest.core.analysis;

import java.util.Locale;

/**
 * Output shape of a report: how many entries the ranking sections keep and whether tool
 * statistics carry median/min/max next to the mean.
 */
public record AnalysisProfile(String name, int topK, int topTools, boolean extendedToolStats) {
    public static final AnalysisProfile STANDARD = new AnalysisProfile("standard", 5, 10, true);
    public static final AnalysisProfile COMPACT = new AnalysisProfile("compact", 3, 10, false);

    public AnalysisProfile {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        if (topTools < 1) {
            throw new IllegalArgumentException("topTools must be at least 1");
        }
    }

    public static AnalysisProfile named(String name) {
        if (name == null || name.isBlank()) {
            return STANDARD;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "standard" -> STANDARD;
            case "compact" -> COMPACT;
            default -> throw new IllegalArgumentException("unknown analysis profile: " + name);
        };
    }

    public AnalysisProfile withTopTools(int limit) {
        return limit < 1 ? this : new AnalysisProfile(name, topK, limit, extendedToolStats);
    }
}
