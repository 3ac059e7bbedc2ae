package io.plandigest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    String profile,
    @JsonAlias({"top_tools"}) int topTools
) {

    public static AnalysisConfig defaults() {
        return new AnalysisConfig("standard", 10);
    }
}
