package io.herald.core.delivery;

import io.herald.core.model.ChannelConfig;
import io.herald.core.model.Recipient;
import java.util.List;
import java.util.Map;

public record DeliveryRequest(
    String deliveryId,
    String scheduleId,
    String subject,
    String html,
    String text,
    List<Recipient> recipients,
    List<String> channels,
    Map<String, ChannelConfig> channelConfigs,
    DeliveryMetadata metadata
) {

    public DeliveryRequest {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        channels = channels == null ? List.of() : List.copyOf(channels);
        channelConfigs = channelConfigs == null ? Map.of() : Map.copyOf(channelConfigs);
        metadata = metadata == null ? DeliveryMetadata.empty() : metadata;
    }

    public ChannelConfig configFor(String channel) {
        ChannelConfig config = channelConfigs.get(channel);
        if (config == null) {
            config = channelConfigs.get(ChannelRegistry.normalize(channel));
        }
        return config == null ? ChannelConfig.empty() : config;
    }

    public int unitCount() {
        return recipients.size() * channels.size();
    }
}
