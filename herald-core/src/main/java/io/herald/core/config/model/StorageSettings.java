package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Where schedules, templates and delivery history live. {@code backend} is {@code sqlite} or {@code memory};
 * a blank {@code sqlitePath} resolves to {@code herald.db} inside the workspace.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageSettings(String workspace, String backend, String sqlitePath) {
    public static final String BACKEND_SQLITE = "sqlite";
    public static final String BACKEND_MEMORY = "memory";

    public static StorageSettings defaults() {
        return new StorageSettings("~/.herald/workspace", BACKEND_SQLITE, "");
    }
}
