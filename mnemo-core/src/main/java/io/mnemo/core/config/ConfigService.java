package io.mnemo.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.fs.AtomicFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper;
    private final AtomicFiles atomicFiles;

    public ConfigService() {
        this(new AtomicFiles());
    }

    public ConfigService(AtomicFiles atomicFiles) {
        this.mapper = new ObjectMapper();
        this.atomicFiles = Objects.requireNonNull(atomicFiles, "atomicFiles must not be null");
    }

    public MnemoConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return MnemoConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(MnemoConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, MnemoConfig.class);
    }

    public void save(Path configPath, MnemoConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        atomicFiles.writeString(configPath, toPrettyJson(config) + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        MnemoConfig config;
        if (created || overwrite) {
            config = MnemoConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(config);
        Files.createDirectories(workspace.resolve(".memory"));
        Path liveStore = ConfigPaths.resolveLiveStore(config);
        Files.createDirectories(liveStore.getParent());
        return new InitResult(configPath, workspace, created, overwritten);
    }

    public String toPrettyJson(MnemoConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
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
