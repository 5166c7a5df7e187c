package io.mnemo.core.config;

import io.mnemo.core.config.model.MnemoConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".mnemo", "config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of("").toAbsolutePath().normalize();
        }
        return expandHome(rawPath).toAbsolutePath().normalize();
    }

    public static Path resolveWorkspace(MnemoConfig config) {
        return resolveWorkspace(config.workspace().root());
    }

    public static Path resolveLiveStore(MnemoConfig config) {
        Path workspace = resolveWorkspace(config);
        String raw = config.workspace().liveStore();
        if (raw == null || raw.isBlank()) {
            return workspace.resolve(".aipm/memory.json");
        }
        Path live = expandHome(raw);
        return live.isAbsolute() ? live.normalize() : workspace.resolve(live).normalize();
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
