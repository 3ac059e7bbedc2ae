package io.plandigest.core.analysis;

import static io.plandigest.core.analysis.InMemoryRecordSource.run;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.plandigest.core.model.PlanRun;
import io.plandigest.core.report.ToolPerformanceDetail;
import io.plandigest.core.report.ToolStat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolUsageAnalyzerTest {

    private static final Instant T0 = Instant.parse("2025-01-15T08:00:00Z");

    private final ToolUsageAnalyzer analyzer = new ToolUsageAnalyzer();

    @Test
    void shouldKeepTopTenToolsWithNameTieBreak() {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            String name = String.format("tool-%02d", i);
            // tool-00..tool-04 are used twice, the rest once
            int uses = i < 5 ? 2 : 1;
            for (int u = 0; u < uses; u++) {
                tools.add(Map.of("name", name, "success", true));
            }
        }
        PlanRun run = run("r1", "plan-a", "COMPLETE", T0, 1_000L, Map.of("tools_used", tools));

        ToolUsageAnalyzer.ToolReport report = analyzer.analyze(List.of(run), AnalysisProfile.STANDARD);

        assertThat(report.usage().totalToolInvocations()).isEqualTo(20);
        assertThat(report.usage().uniqueToolsUsed()).isEqualTo(15);
        assertThat(report.usage().topTools()).hasSize(10);
        assertThat(report.usage().topTools()).extracting(ToolStat::toolName).containsExactly(
            "tool-00", "tool-01", "tool-02", "tool-03", "tool-04",
            "tool-05", "tool-06", "tool-07", "tool-08", "tool-09"
        );
        assertThat(report.usage().toolDistribution().keySet()).containsExactly(
            "tool-00", "tool-01", "tool-02", "tool-03", "tool-04",
            "tool-05", "tool-06", "tool-07", "tool-08", "tool-09"
        );
        assertThat(report.usage().toolDistribution()).containsEntry("tool-00", 2).containsEntry("tool-09", 1);
    }

    @Test
    void shouldSkipAndCountMalformedEntries() {
        Map<String, Object> nullName = new HashMap<>();
        nullName.put("name", null);
        nullName.put("success", true);
        List<Object> tools = List.of(
            Map.of("name", "search", "success", true, "duration_ms", 1_200),
            Map.of("name", "search", "success", false, "duration_ms", 800),
            nullName,
            Map.of("name", "fetch", "success", "yes"),
            Map.of("name", "fetch", "duration_ms", -5),
            "not-a-map"
        );
        PlanRun run = run("r1", "plan-a", "COMPLETE", T0, 1_000L, Map.of("tools_used", tools));

        ToolUsageAnalyzer.ToolReport report = analyzer.analyze(List.of(run), AnalysisProfile.STANDARD);

        assertThat(report.usage().malformedEntries()).isEqualTo(4);
        assertThat(report.usage().totalToolInvocations()).isEqualTo(2);
        ToolStat search = report.usage().topTools().get(0);
        assertThat(search.toolName()).isEqualTo("search");
        assertThat(search.successCount()).isEqualTo(1);
        assertThat(search.successRate()).isEqualTo(50.0);
        assertThat(search.avgDurationSeconds()).isCloseTo(1.0, within(1e-9));
        assertThat(search.minDurationSeconds()).isEqualTo(0.8);
        assertThat(search.maxDurationSeconds()).isEqualTo(1.2);
    }

    @Test
    void shouldOmitExtendedStatsInCompactProfile() {
        PlanRun run = run("r1", "plan-a", "COMPLETE", T0, 1_000L, Map.of("tools_used", List.of(
            Map.of("name", "search", "success", true, "duration_ms", 500)
        )));

        ToolStat stat = analyzer.analyze(List.of(run), AnalysisProfile.COMPACT).usage().topTools().get(0);

        assertThat(stat.avgDurationSeconds()).isEqualTo(0.5);
        assertThat(stat.medianDurationSeconds()).isNull();
        assertThat(stat.minDurationSeconds()).isNull();
    }

    @Test
    void shouldRankPerformanceByMeanDurationAndSkipUntimedTools() {
        PlanRun first = run("r1", "plan-a", "COMPLETE", T0, null, Map.of("tools_used", List.of(
            Map.of("name", "fast", "success", true, "duration_ms", 100),
            Map.of("name", "slow", "success", true, "duration_ms", 3_000),
            Map.of("name", "untimed", "success", true)
        )));
        PlanRun second = run("r2", "plan-b", "COMPLETE", T0, 2_000L, Map.of("tools_used", List.of(
            Map.of("name", "slow", "success", false, "duration_ms", 1_000)
        )));

        ToolUsageAnalyzer.ToolReport report = analyzer.analyze(List.of(first, second), AnalysisProfile.STANDARD);

        assertThat(report.performance().toolCount()).isEqualTo(2);
        assertThat(report.performance().performanceDetails())
            .extracting(ToolPerformanceDetail::toolName)
            .containsExactly("slow", "fast");
        ToolPerformanceDetail slow = report.performance().performanceDetails().get(0);
        assertThat(slow.avgDuration()).isEqualTo(2.0);
        assertThat(slow.successRate()).isEqualTo(50.0);
        assertThat(slow.totalInvocations()).isEqualTo(2);
    }

    @Test
    void shouldIgnoreRunsWithoutToolTrace() {
        PlanRun run = run("r1", "plan-a", "COMPLETE", T0, 1_000L);

        ToolUsageAnalyzer.ToolReport report = analyzer.analyze(List.of(run), AnalysisProfile.STANDARD);

        assertThat(report.usage().totalToolInvocations()).isZero();
        assertThat(report.usage().topTools()).isEmpty();
        assertThat(report.performance().performanceDetails()).isEmpty();
    }
}
