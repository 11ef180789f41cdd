package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramConfig(String botToken, String chatId, String parseMode) {
}
