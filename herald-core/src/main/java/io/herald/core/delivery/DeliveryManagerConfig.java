package io.herald.core.delivery;

import java.time.Duration;

public record DeliveryManagerConfig(int maxRetries, Duration baseDelay, Duration maxDelay, int parallelism) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final int DEFAULT_PARALLELISM = 10;

    public DeliveryManagerConfig {
        maxRetries = maxRetries < 0 ? DEFAULT_MAX_RETRIES : maxRetries;
        baseDelay = baseDelay == null || baseDelay.isZero() || baseDelay.isNegative() ? DEFAULT_BASE_DELAY : baseDelay;
        maxDelay = maxDelay == null || maxDelay.isZero() || maxDelay.isNegative() ? DEFAULT_MAX_DELAY : maxDelay;
        parallelism = parallelism <= 0 ? DEFAULT_PARALLELISM : parallelism;
    }

    public static DeliveryManagerConfig defaults() {
        return new DeliveryManagerConfig(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_PARALLELISM);
    }
}
