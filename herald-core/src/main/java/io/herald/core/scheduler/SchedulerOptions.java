package io.herald.core.scheduler;

import java.time.Duration;

public record SchedulerOptions(
    boolean enabled,
    Duration checkInterval,
    int maxConcurrentDeliveries,
    Duration executionTimeout
) {
    public static final Duration MIN_CHECK_INTERVAL = Duration.ofSeconds(10);

    public SchedulerOptions {
        checkInterval = checkInterval == null ? Duration.ofMinutes(1) : checkInterval;
        if (checkInterval.compareTo(MIN_CHECK_INTERVAL) < 0) {
            checkInterval = MIN_CHECK_INTERVAL;
        }
        maxConcurrentDeliveries = maxConcurrentDeliveries <= 0 ? 5 : maxConcurrentDeliveries;
        executionTimeout = executionTimeout == null || executionTimeout.isZero() || executionTimeout.isNegative()
            ? Duration.ofMinutes(5)
            : executionTimeout;
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(true, Duration.ofMinutes(1), 5, Duration.ofMinutes(5));
    }
}
