package io.plandigest.core.analysis;

import static io.plandigest.core.analysis.InMemoryRecordSource.run;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.plandigest.core.model.Plan;
import io.plandigest.core.report.ExecutionRate;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExecutionRateCalculatorTest {

    private static final Instant T0 = Instant.parse("2025-01-15T08:00:00Z");

    private final ExecutionRateCalculator calculator = new ExecutionRateCalculator();

    @Test
    void shouldIntersectCreatedAndExecutedPlans() {
        List<Plan> created = List.of(plan("p3"), plan("p1"), plan("p2"));

        ExecutionRate rate = calculator.compute(created, List.of(
            run("r1", "p1", "COMPLETE", T0, 1_000L),
            run("r2", "p1", "FAILED", T0, null),
            run("r3", "p3", "IN_PROGRESS", T0, null),
            run("r4", "older-plan", "COMPLETE", T0, 1_000L)
        ));

        assertThat(rate.rate()).isCloseTo(66.67, within(0.01));
        assertThat(rate.executedPlans()).isEqualTo(2);
        assertThat(rate.totalPlans()).isEqualTo(3);
        assertThat(rate.executedPlanIds()).containsExactly("p1", "p3");
    }

    @Test
    void shouldReturnZeroWhenNoPlansWereCreated() {
        ExecutionRate rate = calculator.compute(List.of(), List.of(run("r1", "p1", "COMPLETE", T0, 1_000L)));

        assertThat(rate.rate()).isEqualTo(0.0);
        assertThat(rate.totalPlans()).isZero();
        assertThat(rate.executedPlanIds()).isEmpty();
    }

    private static Plan plan(String id) {
        return new Plan(id, "Plan " + id, null, T0, T0);
    }
}
