package io.herald.core.delivery.channel;

import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryChannel;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.RecipientType;
import java.io.IOException;
import java.time.Clock;
import java.util.Locale;
import java.util.UUID;

public final class InAppChannel implements DeliveryChannel {
    public static final String NAME = "in_app";
    private static final int MAX_MESSAGE = 1000;

    private final Clock clock;
    private volatile InAppNotificationStore store;

    public InAppChannel(InAppNotificationStore store) {
        this(store, Clock.systemUTC());
    }

    public InAppChannel(InAppNotificationStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public void setStore(InAppNotificationStore store) {
        this.store = store;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsHtml() {
        return false;
    }

    @Override
    public int maxContentLength() {
        return MAX_MESSAGE;
    }

    @Override
    public void validate(ChannelConfig config) {
        // Nothing to configure; notifications go to the local store.
    }

    @Override
    public DeliveryResult send(SendParams params) {
        InAppNotificationStore target = store;
        if (target == null) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, "in-app notification store is not configured");
        }
        if (params.recipient().type() != RecipientType.USER) {
            return DeliveryResult.failure(
                NAME,
                params.recipient(),
                ErrorCode.INVALID_RECIPIENT,
                "in-app notifications need a user recipient, got " + params.recipient().type().name().toLowerCase(Locale.ROOT)
            );
        }

        InAppNotification notification = new InAppNotification(
            UUID.randomUUID().toString(),
            params.recipient().target(),
            params.subject(),
            ChannelContent.formatFor(this, params),
            params.deliveryId(),
            params.scheduleId(),
            params.metadata().serverName(),
            clock.instant(),
            false
        );
        try {
            target.save(notification);
            return DeliveryResult.success(NAME, params.recipient());
        } catch (IOException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.SERVER_ERROR, "failed to store notification: " + e.getMessage());
        }
    }
}
