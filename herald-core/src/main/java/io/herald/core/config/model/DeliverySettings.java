package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.herald.core.delivery.DeliveryManagerConfig;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DeliverySettings(
    int maxRetries,
    long baseDelayMillis,
    long maxDelayMillis,
    int parallelism,
    int httpTimeoutSeconds
) {

    public static DeliverySettings defaults() {
        return new DeliverySettings(3, 1_000, 30_000, 10, 30);
    }

    public DeliveryManagerConfig toManagerConfig() {
        return new DeliveryManagerConfig(
            maxRetries,
            Duration.ofMillis(baseDelayMillis),
            Duration.ofMillis(maxDelayMillis),
            parallelism
        );
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(httpTimeoutSeconds > 0 ? httpTimeoutSeconds : 30);
    }
}
