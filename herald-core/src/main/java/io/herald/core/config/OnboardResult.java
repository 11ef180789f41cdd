package io.herald.core.config;

import java.nio.file.Path;

public record OnboardResult(
    Path configPath,
    Path workspacePath,
    Path contentPath,
    boolean createdConfig,
    boolean overwrittenConfig
) {
}
