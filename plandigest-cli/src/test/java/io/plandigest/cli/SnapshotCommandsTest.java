package io.plandigest.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.plandigest.core.config.ConfigService;
import io.plandigest.core.source.RecordSources;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SnapshotCommandsTest {

    @TempDir
    Path tempDir;

    private CliContext context;

    @BeforeEach
    void setUp() throws Exception {
        Path snapshot = tempDir.resolve("snapshot.json");
        Files.writeString(snapshot, """
            {
              "plans": [
                { "id": "plan-a", "name": "Invoice triage", "created_at": "2025-01-10T00:00:00Z" },
                { "id": "plan-b", "name": "Weekly report", "created_at": "2025-01-15T01:00:00Z" }
              ],
              "plan_runs": [
                { "id": "run-1", "plan_id": "plan-a", "state": "COMPLETE", "created_at": "2025-01-15T02:00:00Z",
                  "completed_at": "2025-01-15T02:00:04Z", "duration_ms": 4000 },
                { "id": "run-2", "plan_id": "plan-b", "state": "FAILED", "created_at": "2025-01-15T03:00:00Z",
                  "metadata": { "error": "tool timeout" } }
              ]
            }
            """, StandardCharsets.UTF_8);
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            { "source": { "snapshotFile": "%s" }, "analysis": { "profile": "compact" } }
            """.formatted(snapshot.toString().replace("\\", "\\\\")), StandardCharsets.UTF_8);
        context = new CliContext(
            new ConfigService(Map.of()),
            configPath,
            RecordSources::fromConfig,
            Clock.fixed(Instant.parse("2025-01-15T12:00:00Z"), ZoneOffset.UTC)
        );
    }

    @Test
    void shouldListPlansNewestFirst() {
        CommandCapture.Captured result = CommandCapture.execute(new PlansCommand(context), "list");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out().indexOf("plan-b")).isLessThan(result.out().indexOf("plan-a"));
        assertThat(result.out()).contains("Weekly report");
    }

    @Test
    void shouldPrintPlanAsJson() {
        CommandCapture.Captured result = CommandCapture.execute(new PlansCommand(context), "get", "plan-a");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("\"name\" : \"Invoice triage\"").contains("\"created_at\" : \"2025-01-10T00:00:00Z\"");
    }

    @Test
    void shouldReportMissingPlanRun() {
        CommandCapture.Captured result = CommandCapture.execute(new PlanRunsCommand(context), "get", "run-404");

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("Plan run not found: run-404");
    }

    @Test
    void shouldFilterPlanRunsByState() {
        CommandCapture.Captured result = CommandCapture.execute(new PlanRunsCommand(context), "list", "--state", "failed");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out()).contains("run-2").doesNotContain("run-1");
    }

    @Test
    void shouldRejectUnknownRunStateAsUsageError() {
        CommandCapture.Captured result = CommandCapture.execute(new PlanRunsCommand(context), "list", "--state", "archived");

        assertThat(result.code()).isEqualTo(2);
        assertThat(result.err()).contains("unknown run state");
    }

    @Test
    void shouldAnalyzeSnapshotWithConfiguredProfile() {
        CommandCapture.Captured result = CommandCapture.execute(new AnalyzeCommand(context), "--today");

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Total runs: 2 (completed 1, failed 1)")
            .contains("Plans created: 1, execution rate 100.0%");
    }

    @Test
    void shouldShowSnapshotStatus() {
        CommandCapture.Captured result = CommandCapture.execute(new StatusCommand(context));

        assertThat(result.code()).isEqualTo(0);
        assertThat(result.out())
            .contains("Record source: snapshot")
            .contains("API key configured: false")
            .contains("Analysis profile: compact");
    }

    @Test
    void onboardShouldCreateThenRefreshConfig() {
        Path configPath = tempDir.resolve("fresh/config.json");
        CliContext fresh = new CliContext(new ConfigService(Map.of()), configPath);

        CommandCapture.Captured created = CommandCapture.execute(new OnboardCommand(fresh));
        CommandCapture.Captured refreshed = CommandCapture.execute(new OnboardCommand(fresh));
        CommandCapture.Captured overwritten = CommandCapture.execute(new OnboardCommand(fresh), "--overwrite");

        assertThat(created.out()).contains("Created config: " + configPath);
        assertThat(refreshed.out()).contains("Refreshed config");
        assertThat(overwritten.out()).contains("Overwrote config with defaults");
        assertThat(Files.exists(configPath)).isTrue();
    }

    @Test
    void shouldFailWhenNoSourceIsConfigured() {
        CliContext unconfigured = new CliContext(new ConfigService(Map.of()), tempDir.resolve("missing.json"));

        CommandCapture.Captured result = CommandCapture.execute(new AnalyzeCommand(unconfigured));

        assertThat(result.code()).isEqualTo(1);
        assertThat(result.err()).contains("record source is not configured");
    }
}
