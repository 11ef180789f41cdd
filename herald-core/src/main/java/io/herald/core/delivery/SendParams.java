package io.herald.core.delivery;

import io.herald.core.model.ChannelConfig;
import io.herald.core.model.Recipient;

public record SendParams(
    String deliveryId,
    String scheduleId,
    Recipient recipient,
    String subject,
    String html,
    String text,
    ChannelConfig config,
    DeliveryMetadata metadata
) {

    public SendParams {
        scheduleId = scheduleId == null ? "" : scheduleId;
        subject = subject == null ? "" : subject;
        html = html == null ? "" : html;
        text = text == null ? "" : text;
        config = config == null ? ChannelConfig.empty() : config;
        metadata = metadata == null ? DeliveryMetadata.empty() : metadata;
    }
}
