package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

public enum DeliveryStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("sending")
    SENDING,
    @JsonProperty("delivered")
    DELIVERED,
    @JsonProperty("partial")
    PARTIAL,
    @JsonProperty("failed")
    FAILED;

    public boolean terminal() {
        return this == DELIVERED || this == PARTIAL || this == FAILED;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DeliveryStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return DeliveryStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
