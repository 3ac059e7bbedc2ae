package io.plandigest.cli;

import io.plandigest.core.config.ConfigService;
import io.plandigest.core.source.RecordSources;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RecordSourceFactory sourceFactory,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, RecordSources::fromConfig, Clock.systemUTC());
    }
}
