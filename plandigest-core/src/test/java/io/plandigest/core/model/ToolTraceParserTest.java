package io.plandigest.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolTraceParserTest {

    private final ToolTraceParser parser = new ToolTraceParser();

    @Test
    void shouldParseWellFormedEntries() {
        ToolTrace trace = parser.parse(Map.of("tools_used", List.of(
            Map.of("name", " search ", "success", false, "duration_ms", 1500),
            Map.of("name", "fetch")
        )));

        assertThat(trace.malformedEntries()).isZero();
        assertThat(trace.invocations()).containsExactly(
            new ToolInvocation("search", false, 1500L),
            new ToolInvocation("fetch", true, null)
        );
    }

    @Test
    void shouldCountNonListTraceAsSingleMalformedEntry() {
        ToolTrace trace = parser.parse(Map.of("tools_used", "search,fetch"));

        assertThat(trace.invocations()).isEmpty();
        assertThat(trace.malformedEntries()).isEqualTo(1);
    }

    @Test
    void shouldReturnEmptyTraceWhenMetadataHasNoTools() {
        assertThat(parser.parse(Map.of("error", "boom"))).isEqualTo(ToolTrace.EMPTY);
        assertThat(parser.parse((PlanRun) null)).isEqualTo(ToolTrace.EMPTY);
    }

    @Test
    void shouldRejectEntriesWithWrongFieldTypes() {
        ToolTrace trace = parser.parse(Map.of("tools_used", List.of(
            Map.of("name", ""),
            Map.of("name", 42),
            Map.of("name", "search", "success", "true"),
            Map.of("name", "search", "duration_ms", "fast"),
            Map.of("name", "search", "duration_ms", 12.5)
        )));

        assertThat(trace.malformedEntries()).isEqualTo(4);
        assertThat(trace.invocations()).containsExactly(new ToolInvocation("search", true, 12L));
    }
}
