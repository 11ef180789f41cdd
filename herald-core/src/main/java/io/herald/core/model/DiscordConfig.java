package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscordConfig(String webhookUrl, String username, String avatarUrl) {
}
