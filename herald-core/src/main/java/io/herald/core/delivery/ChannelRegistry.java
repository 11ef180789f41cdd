package io.herald.core.delivery;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ChannelRegistry {
    private final Map<String, DeliveryChannel> channels = new ConcurrentHashMap<>();

    public void register(DeliveryChannel channel) {
        channels.put(normalize(channel.name()), channel);
    }

    public Optional<DeliveryChannel> find(String name) {
        return Optional.ofNullable(channels.get(normalize(name)));
    }

    public List<String> names() {
        return channels.keySet().stream().sorted().toList();
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
