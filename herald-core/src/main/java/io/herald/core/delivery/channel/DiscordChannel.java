package io.herald.core.delivery.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.DiscordConfig;
import java.time.Instant;
import java.util.Map;
import okhttp3.OkHttpClient;

public final class DiscordChannel extends AbstractHttpChannel {
    public static final String NAME = "discord";
    static final String DEFAULT_USERNAME = "Newsletter";
    private static final int MAX_DESCRIPTION = 4096;
    private static final int MAX_TITLE = 256;
    private static final int EMBED_COLOR = 0xE5A00D;

    public DiscordChannel(OkHttpClient client, ObjectMapper mapper) {
        super(client, mapper);
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
        return MAX_DESCRIPTION;
    }

    @Override
    public void validate(ChannelConfig config) {
        DiscordConfig discord = config == null ? null : config.discord();
        if (discord == null || isBlank(discord.webhookUrl())) {
            throw new IllegalArgumentException("discord webhook url is required");
        }
        if (!ChannelContent.isValidWebhookUrl(discord.webhookUrl())) {
            throw new IllegalArgumentException("discord webhook url must be an http(s) url");
        }
    }

    @Override
    public DeliveryResult send(SendParams params) {
        try {
            validate(params.config());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, e.getMessage());
        }
        return sendJson("POST", params.config().discord().webhookUrl(), Map.of(), buildPayload(params), params.recipient());
    }

    ObjectNode buildPayload(SendParams params) {
        DiscordConfig discord = params.config().discord();
        String serverName = params.metadata().serverName();

        ObjectNode payload = newPayload();
        if (discord != null && !isBlank(discord.username())) {
            payload.put("username", discord.username());
        } else if (!serverName.isBlank()) {
            payload.put("username", serverName);
        } else {
            payload.put("username", DEFAULT_USERNAME);
        }
        if (discord != null && !isBlank(discord.avatarUrl())) {
            payload.put("avatar_url", discord.avatarUrl());
        }

        ObjectNode embed = payload.putArray("embeds").addObject();
        embed.put("title", ChannelContent.truncate(params.subject(), MAX_TITLE));
        embed.put("description", ChannelContent.formatFor(this, params));
        embed.put("color", EMBED_COLOR);
        embed.put("timestamp", Instant.now().toString());
        if (!serverName.isBlank()) {
            embed.putObject("footer").put("text", "From " + serverName);
        }
        return payload;
    }
}
