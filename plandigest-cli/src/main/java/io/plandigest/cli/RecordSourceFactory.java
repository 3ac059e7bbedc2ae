package io.plandigest.cli;

import io.plandigest.core.config.model.SourceConfig;
import io.plandigest.core.source.RecordSource;

@FunctionalInterface
public interface RecordSourceFactory {
    RecordSource create(SourceConfig config) throws Exception;
}
