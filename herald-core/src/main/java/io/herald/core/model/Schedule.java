package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Schedule(
    String id,
    String name,
    String templateId,
    List<Recipient> recipients,
    String cronExpression,
    String timezone,
    TemplateConfig configOverrides,
    List<String> channels,
    Map<String, ChannelConfig> channelConfigs,
    boolean enabled,
    Instant lastRunAt,
    Instant nextRunAt,
    DeliveryStatus lastRunStatus,
    int runCount,
    int successCount,
    int failureCount
) {

    public Schedule {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        channels = channels == null ? List.of() : List.copyOf(channels);
        channelConfigs = channelConfigs == null ? Map.of() : Map.copyOf(channelConfigs);
        timezone = timezone == null || timezone.isBlank() ? "UTC" : timezone;
    }

    public static Schedule create(
        String id,
        String name,
        String templateId,
        String cronExpression,
        String timezone,
        List<Recipient> recipients,
        List<String> channels,
        Map<String, ChannelConfig> channelConfigs
    ) {
        return new Schedule(
            id,
            name,
            templateId,
            recipients,
            cronExpression,
            timezone,
            null,
            channels,
            channelConfigs,
            true,
            null,
            null,
            null,
            0,
            0,
            0
        );
    }

    public Schedule withNextRunAt(Instant next) {
        return new Schedule(
            id, name, templateId, recipients, cronExpression, timezone, configOverrides, channels, channelConfigs,
            enabled, lastRunAt, next, lastRunStatus, runCount, successCount, failureCount
        );
    }

    public Schedule withEnabled(boolean value) {
        return new Schedule(
            id, name, templateId, recipients, cronExpression, timezone, configOverrides, channels, channelConfigs,
            value, lastRunAt, nextRunAt, lastRunStatus, runCount, successCount, failureCount
        );
    }

    public Schedule withConfigOverrides(TemplateConfig overrides) {
        return new Schedule(
            id, name, templateId, recipients, cronExpression, timezone, overrides, channels, channelConfigs,
            enabled, lastRunAt, nextRunAt, lastRunStatus, runCount, successCount, failureCount
        );
    }

    public Schedule withRunStatus(DeliveryStatus status, Instant runAt, Instant next) {
        return new Schedule(
            id, name, templateId, recipients, cronExpression, timezone, configOverrides, channels, channelConfigs,
            enabled, runAt, next, status,
            runCount + 1,
            status == DeliveryStatus.DELIVERED ? successCount + 1 : successCount,
            status == DeliveryStatus.FAILED ? failureCount + 1 : failureCount
        );
    }

    public boolean isDue(Instant now) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }
}
