package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackConfig(String webhookUrl, String channel, String username, String iconEmoji) {
}
