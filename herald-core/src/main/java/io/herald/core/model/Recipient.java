package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Recipient(RecipientType type, String target, String name) {

    public Recipient {
        Objects.requireNonNull(type, "type must not be null");
        target = target == null ? "" : target.trim();
        name = name == null ? "" : name;
    }

    public static Recipient user(String userId) {
        return new Recipient(RecipientType.USER, userId, "");
    }

    public static Recipient email(String address) {
        return new Recipient(RecipientType.EMAIL, address, "");
    }

    public static Recipient webhook(String url) {
        return new Recipient(RecipientType.WEBHOOK, url, "");
    }

    public String displayName() {
        return name.isBlank() ? target : name;
    }

    @Override
    public String toString() {
        return type.name().toLowerCase(Locale.ROOT) + ":" + target;
    }
}
