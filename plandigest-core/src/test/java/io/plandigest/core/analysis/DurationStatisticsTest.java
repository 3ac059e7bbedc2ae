package io.plandigest.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.plandigest.core.report.DurationStats;
import java.util.List;
import org.junit.jupiter.api.Test;

class DurationStatisticsTest {

    private static final List<Double> VALUES = List.of(40.0, 10.0, 30.0, 20.0);

    @Test
    void shouldInterpolateBetweenNeighbouringRanks() {
        assertThat(DurationStatistics.percentile(VALUES, 95)).isCloseTo(38.5, within(1e-9));
        assertThat(DurationStatistics.median(VALUES)).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void shouldReturnExtremesAtBoundaryPercentiles() {
        assertThat(DurationStatistics.percentile(VALUES, 0)).isEqualTo(10.0);
        assertThat(DurationStatistics.percentile(VALUES, 100)).isEqualTo(40.0);
        assertThat(DurationStatistics.percentile(VALUES, 150)).isEqualTo(40.0);
        assertThat(DurationStatistics.percentile(VALUES, -5)).isEqualTo(10.0);
    }

    @Test
    void shouldHandleSingleAndEmptyInputs() {
        assertThat(DurationStatistics.percentile(List.of(7.5), 95)).isEqualTo(7.5);
        assertThat(DurationStatistics.percentile(List.of(), 95)).isEqualTo(0.0);
        assertThat(DurationStatistics.mean(List.of())).isEqualTo(0.0);
    }

    @Test
    void shouldSummarizeDurations() {
        DurationStats stats = DurationStatistics.summarize(VALUES);

        assertThat(stats.count()).isEqualTo(4);
        assertThat(stats.meanSeconds()).isEqualTo(25.0);
        assertThat(stats.minSeconds()).isEqualTo(10.0);
        assertThat(stats.maxSeconds()).isEqualTo(40.0);
        assertThat(stats.p95Seconds()).isCloseTo(38.5, within(1e-9));
    }

    @Test
    void shouldReportOnlyCountForEmptySummary() {
        DurationStats stats = DurationStatistics.summarize(List.of());

        assertThat(stats.count()).isZero();
        assertThat(stats.meanSeconds()).isNull();
        assertThat(stats.p95Seconds()).isNull();
    }

    @Test
    void shouldGuardZeroDenominator() {
        assertThat(DurationStatistics.percentage(3, 0)).isEqualTo(0.0);
        assertThat(DurationStatistics.percentage(7, 10)).isEqualTo(70.0);
    }
}
