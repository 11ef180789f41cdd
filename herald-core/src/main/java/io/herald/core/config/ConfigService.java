package io.herald.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.herald.core.config.model.HeraldConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes {@code config.json}. Values present in the file win; anything missing falls back to
 * {@link HeraldConfig#defaults()}, so older files keep working when new settings appear.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public HeraldConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return HeraldConfig.defaults();
        }

        JsonNode defaults = mapper.valueToTree(HeraldConfig.defaults());
        JsonNode stored = mapper.readTree(Files.readString(configPath));
        return mapper.treeToValue(deepMerge(defaults, stored), HeraldConfig.class);
    }

    public void save(Path configPath, HeraldConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        Files.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        HeraldConfig config = created || overwrite ? HeraldConfig.defaults() : load(configPath);
        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config.storage().workspace());
        Path contentDir = ConfigPaths.resolveContentDir(config);
        WorkspaceBootstrap.ensureWorkspace(workspace, contentDir);
        return new OnboardResult(configPath, workspace, contentDir, created, !created && overwrite);
    }

    public String toPrettyJson(HeraldConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null || override == null || override.isNull()) {
            return base == null ? override : base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue()))
        );
        return merged;
    }
}
