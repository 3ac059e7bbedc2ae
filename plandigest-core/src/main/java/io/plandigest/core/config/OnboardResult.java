package io.plandigest.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, boolean createdConfig, boolean overwrittenConfig) {
}
