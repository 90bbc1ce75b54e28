package io.mnemo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemo.core.config.model.MnemoConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@link MnemoConfig} as JSON. Keys missing from the file keep their defaults, so a
 * config only needs the values it changes. A typical application root does
 * {@code new StoreManager(new ConfigService().loadDefault(), projectRoot, Clock.systemUTC())}.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Loads {@link ConfigPaths#configPath()}.
     */
    public MnemoConfig loadDefault() throws IOException {
        return load(ConfigPaths.configPath());
    }

    /**
     * @throws IOException if the file cannot be read, is not JSON, or holds out-of-range values
     */
    public MnemoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemoConfig.defaults();
        }

        try {
            JsonNode fileNode = mapper.readTree(Files.readString(configPath));
            JsonNode merged = deepMerge(mapper.valueToTree(MnemoConfig.defaults()), fileNode);
            return mapper.treeToValue(merged, MnemoConfig.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid knowledge config " + configPath + ": " + e.getOriginalMessage(), e);
        }
    }

    public void save(Path configPath, MnemoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public String toPrettyJson(MnemoConfig config) {
        try {
            return mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
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
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
