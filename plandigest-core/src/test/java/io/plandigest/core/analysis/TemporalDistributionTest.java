package io.plandigest.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import io.plandigest.core.model.PlanRun;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemporalDistributionTest {

    private final TemporalDistribution distribution = new TemporalDistribution();

    private final List<PlanRun> runs = List.of(
        completedAt("r1", "2025-01-14T23:59:00Z"),
        completedAt("r2", "2025-01-15T00:10:00Z"),
        completedAt("r3", "2025-01-15T09:30:00Z"),
        completedAt("r4", "2025-01-15T09:45:00Z"),
        completedAt("r5", null)
    );

    @Test
    void shouldBucketByUtcHour() {
        assertThat(distribution.hourly(runs)).containsExactly(
            Map.entry(0, 1),
            Map.entry(9, 2),
            Map.entry(23, 1)
        );
    }

    @Test
    void shouldBucketByUtcDate() {
        assertThat(distribution.daily(runs)).containsExactly(
            Map.entry("2025-01-14", 1),
            Map.entry("2025-01-15", 3)
        );
    }

    private static PlanRun completedAt(String id, String completedAt) {
        Instant completed = completedAt == null ? null : Instant.parse(completedAt);
        return new PlanRun(id, "plan-a", "COMPLETE", Instant.parse("2025-01-14T20:00:00Z"), completed, 1_000L, Map.of());
    }
}
