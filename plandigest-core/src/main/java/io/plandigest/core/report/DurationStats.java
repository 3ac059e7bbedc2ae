package io.plandigest.core.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DurationStats(
    int count,
    @JsonProperty("mean_seconds") Double meanSeconds,
    @JsonProperty("median_seconds") Double medianSeconds,
    @JsonProperty("p95_seconds") Double p95Seconds,
    @JsonProperty("min_seconds") Double minSeconds,
    @JsonProperty("max_seconds") Double maxSeconds
) {

    public static DurationStats empty() {
        return new DurationStats(0, null, null, null, null, null);
    }
}
