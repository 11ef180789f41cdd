package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Delivery(
    String id,
    String scheduleId,
    String scheduleName,
    String templateId,
    int templateVersion,
    String channel,
    DeliveryStatus status,
    int recipientsTotal,
    int recipientsDelivered,
    int recipientsFailed,
    String renderedSubject,
    int bodySize,
    Instant startedAt,
    Instant completedAt,
    long durationMs,
    String errorMessage,
    String triggeredBy
) {
    public static final String TRIGGER_SCHEDULER = "scheduler";
    public static final String TRIGGER_MANUAL = "manual";

    public static Delivery pending(
        String id,
        Schedule schedule,
        String channel,
        Instant startedAt,
        String triggeredBy
    ) {
        return new Delivery(
            id,
            schedule.id(),
            schedule.name(),
            schedule.templateId(),
            0,
            channel,
            DeliveryStatus.PENDING,
            schedule.recipients().size() * Math.max(schedule.channels().size(), 1),
            0,
            0,
            "",
            0,
            startedAt,
            null,
            0,
            null,
            triggeredBy
        );
    }

    public Delivery sending(int templateVersion, String subject, int bodySize, int total) {
        return new Delivery(
            id, scheduleId, scheduleName, templateId, templateVersion, channel, DeliveryStatus.SENDING,
            total, 0, 0, subject, bodySize, startedAt, null, 0, null, triggeredBy
        );
    }

    public Delivery completed(DeliveryStatus terminal, int delivered, int failed, Instant finishedAt, String error) {
        if (!terminal.terminal()) {
            throw new IllegalArgumentException("Delivery cannot complete with status " + terminal);
        }
        return new Delivery(
            id, scheduleId, scheduleName, templateId, templateVersion, channel, terminal,
            recipientsTotal, delivered, failed, renderedSubject, bodySize, startedAt, finishedAt,
            elapsedMillis(finishedAt), error, triggeredBy
        );
    }

    public Delivery failed(String error, Instant finishedAt) {
        return completed(DeliveryStatus.FAILED, recipientsDelivered, recipientsTotal - recipientsDelivered, finishedAt, error);
    }

    private long elapsedMillis(Instant finishedAt) {
        if (startedAt == null || finishedAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(startedAt, finishedAt).toMillis());
    }
}
