package io.plandigest.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.plandigest.core.config.model.PlanDigestConfig;
import io.plandigest.core.config.model.SourceConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String ENV_API_KEY = "PLANDIGEST_API_KEY";
    public static final String ENV_API_BASE = "PLANDIGEST_API_BASE";
    public static final String ENV_ORG_ID = "PLANDIGEST_ORG_ID";
    public static final String ENV_SNAPSHOT_FILE = "PLANDIGEST_SNAPSHOT_FILE";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
        this.mapper = new ObjectMapper();
    }

    public PlanDigestConfig load(Path configPath) throws IOException {
        return applyEnvironment(loadFile(configPath));
    }

    public void save(Path configPath, PlanDigestConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        PlanDigestConfig config;
        if (created || overwrite) {
            config = PlanDigestConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            // environment values are credentials and never get written back
            config = loadFile(configPath);
        }

        save(configPath, config);
        return new OnboardResult(configPath, created, overwritten);
    }

    private PlanDigestConfig loadFile(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return PlanDigestConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(PlanDigestConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, PlanDigestConfig.class);
    }

    private PlanDigestConfig applyEnvironment(PlanDigestConfig config) {
        SourceConfig source = config.source().withOverrides(
            environment.get(ENV_API_KEY),
            environment.get(ENV_API_BASE),
            environment.get(ENV_ORG_ID),
            environment.get(ENV_SNAPSHOT_FILE)
        );
        return new PlanDigestConfig(source, config.analysis());
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            // snake_case keys land on the camelCase default they alias
            String key = camelCase(entry.getKey());
            JsonNode existing = merged.get(key);
            merged.set(key, deepMerge(existing, entry.getValue()));
        });
        return merged;
    }

    private static String camelCase(String key) {
        if (key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder out = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = out.length() > 0;
            } else {
                out.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return out.toString();
    }
}
