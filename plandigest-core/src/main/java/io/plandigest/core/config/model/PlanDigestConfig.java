package io.plandigest.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDigestConfig(
    SourceConfig source,
    AnalysisConfig analysis
) {

    public static PlanDigestConfig defaults() {
        return new PlanDigestConfig(
            SourceConfig.defaults(),
            AnalysisConfig.defaults()
        );
    }
}
