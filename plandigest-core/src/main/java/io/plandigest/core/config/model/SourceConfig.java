package io.plandigest.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"org_id"}) String orgId,
    @JsonAlias({"snapshot_file"}) String snapshotFile,
    @JsonAlias({"page_limit"}) int pageLimit,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"max_attempts"}) int maxAttempts
) {
    public static final String DEFAULT_API_BASE = "https://api.portialabs.ai";

    public static SourceConfig defaults() {
        return new SourceConfig("", DEFAULT_API_BASE, "", "", 1000, 30, 3);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean usesSnapshot() {
        return snapshotFile != null && !snapshotFile.isBlank();
    }

    public String resolvedApiBase() {
        return apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase;
    }

    public SourceConfig withOverrides(String apiKeyOverride, String apiBaseOverride, String orgIdOverride, String snapshotOverride) {
        return new SourceConfig(
            pick(apiKeyOverride, apiKey),
            pick(apiBaseOverride, apiBase),
            pick(orgIdOverride, orgId),
            pick(snapshotOverride, snapshotFile),
            pageLimit,
            timeoutSeconds,
            maxAttempts
        );
    }

    private static String pick(String override, String current) {
        return override == null || override.isBlank() ? current : override.trim();
    }
}
