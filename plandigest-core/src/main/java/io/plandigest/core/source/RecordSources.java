package io.plandigest.core.source;

import io.plandigest.core.config.ConfigPaths;
import io.plandigest.core.config.model.SourceConfig;
import java.time.Duration;

public final class RecordSources {

    private RecordSources() {
    }

    public static RecordSource fromConfig(SourceConfig config) {
        if (config == null) {
            throw new IllegalStateException("record source is not configured");
        }
        if (config.usesSnapshot()) {
            return new FileRecordSource(ConfigPaths.resolve(config.snapshotFile()));
        }
        if (!config.configured()) {
            throw new IllegalStateException(
                "record source is not configured: set source.apiKey (or PLANDIGEST_API_KEY) or source.snapshotFile"
            );
        }
        return new HttpRecordSource(
            config.resolvedApiBase(),
            config.apiKey(),
            config.orgId(),
            Duration.ofSeconds(Math.max(1, config.timeoutSeconds())),
            config.maxAttempts()
        );
    }
}
