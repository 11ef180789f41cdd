package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;

public enum ContentType {
    @JsonProperty("recently_added")
    RECENTLY_ADDED,
    @JsonProperty("weekly_digest")
    WEEKLY_DIGEST,
    @JsonProperty("monthly_stats")
    MONTHLY_STATS,
    @JsonProperty("user_activity")
    USER_ACTIVITY,
    @JsonProperty("recommendations")
    RECOMMENDATIONS,
    @JsonProperty("server_health")
    SERVER_HEALTH,
    @JsonProperty("custom")
    CUSTOM;

    public boolean requiresUser() {
        return this == USER_ACTIVITY || this == RECOMMENDATIONS;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
