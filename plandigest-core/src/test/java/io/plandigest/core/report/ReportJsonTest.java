package io.plandigest.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportJsonTest {

    private final ReportJson json = new ReportJson();

    @Test
    void shouldWriteEmptyWindowReportWithOnlyHeadlineFields() throws Exception {
        AnalysisReport report = AnalysisReport.empty(
            new ReportWindow(Instant.parse("2025-01-15T00:00:00Z"), Instant.parse("2025-01-15T12:00:00Z")),
            Instant.parse("2025-01-15T12:00:01Z")
        );

        JsonNode node = json.mapper().readTree(json.toJson(report));

        List<String> fields = new ArrayList<>();
        node.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly("window", "generated_at", "message", "total_runs");
        assertThat(node.path("window").path("since").asText()).isEqualTo("2025-01-15T00:00:00Z");
        assertThat(node.path("generated_at").asText()).isEqualTo("2025-01-15T12:00:01Z");
    }

    @Test
    void shouldKeepToolDistributionInRankingOrder() throws Exception {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("zeta", 9);
        distribution.put("alpha", 4);
        ToolUsage usage = new ToolUsage(13, 2, 0, List.of(), distribution);

        JsonNode node = json.mapper().readTree(json.toJson(usage));

        List<String> names = new ArrayList<>();
        node.path("tool_distribution").fieldNames().forEachRemaining(names::add);
        assertThat(names).containsExactly("zeta", "alpha");
        assertThat(node.path("malformed_entries").asInt()).isZero();
    }

    @Test
    void shouldOmitUnsetDurationFields() {
        String written = json.toJson(DurationStats.empty());

        assertThat(written).isEqualTo("{\"count\":0}");
    }
}
