package io.herald.core.delivery.channel;

import java.time.Instant;

public record InAppNotification(
    String id,
    String userId,
    String title,
    String message,
    String deliveryId,
    String scheduleId,
    String serverName,
    Instant createdAt,
    boolean read
) {
}
