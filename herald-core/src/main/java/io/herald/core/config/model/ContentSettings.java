package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ContentSettings(String serverName, String serverUrl, String baseUrl, String contentDir) {

    public static ContentSettings defaults() {
        return new ContentSettings("Media Server", "http://localhost:8096", "http://localhost:8096", "");
    }
}
