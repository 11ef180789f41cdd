package io.herald.core.config;

import io.herald.core.config.model.HeraldConfig;
import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return heraldHome().resolve("config.json");
    }

    public static Path resolveWorkspace(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return heraldHome().resolve("workspace");
        }
        return expandHome(rawPath);
    }

    public static Path resolveSqlitePath(HeraldConfig config) {
        String raw = config.storage().sqlitePath();
        if (raw == null || raw.isBlank()) {
            return resolveWorkspace(config.storage().workspace()).resolve("herald.db");
        }
        return expandHome(raw);
    }

    public static Path resolveContentDir(HeraldConfig config) {
        String raw = config.content().contentDir();
        if (raw == null || raw.isBlank()) {
            return resolveWorkspace(config.storage().workspace()).resolve("content");
        }
        return expandHome(raw);
    }

    private static Path heraldHome() {
        return Path.of(System.getProperty("user.home"), ".herald");
    }

    private static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
