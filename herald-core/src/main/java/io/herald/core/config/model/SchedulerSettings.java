package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.herald.core.scheduler.SchedulerOptions;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerSettings(
    boolean enabled,
    int checkIntervalSeconds,
    int maxConcurrentDeliveries,
    int executionTimeoutSeconds
) {

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(true, 60, 5, 300);
    }

    public SchedulerOptions toOptions() {
        return new SchedulerOptions(
            enabled,
            Duration.ofSeconds(checkIntervalSeconds),
            maxConcurrentDeliveries,
            Duration.ofSeconds(executionTimeoutSeconds)
        );
    }
}
