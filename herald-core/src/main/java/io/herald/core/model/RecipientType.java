package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecipientType {
    @JsonProperty("user")
    USER,
    @JsonProperty("email")
    EMAIL,
    @JsonProperty("webhook")
    WEBHOOK
}
