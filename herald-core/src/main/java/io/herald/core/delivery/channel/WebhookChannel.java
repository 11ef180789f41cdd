package io.herald.core.delivery.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.RecipientType;
import io.herald.core.model.WebhookConfig;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import okhttp3.OkHttpClient;

public final class WebhookChannel extends AbstractHttpChannel {
    public static final String NAME = "webhook";
    static final String EVENT = "newsletter.delivery";
    private static final Set<String> METHODS = Set.of("POST", "PUT");

    public WebhookChannel(OkHttpClient client, ObjectMapper mapper) {
        super(client, mapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supportsHtml() {
        return true;
    }

    @Override
    public int maxContentLength() {
        return 0;
    }

    @Override
    public void validate(ChannelConfig config) {
        WebhookConfig webhook = config == null ? null : config.webhook();
        if (webhook == null) {
            throw new IllegalArgumentException("webhook configuration is required");
        }
        if (!ChannelContent.isValidWebhookUrl(webhook.url())) {
            throw new IllegalArgumentException("webhook url must be an http(s) url");
        }
        if (!METHODS.contains(webhook.method())) {
            throw new IllegalArgumentException("webhook method must be POST or PUT, got " + webhook.method());
        }
    }

    @Override
    public DeliveryResult send(SendParams params) {
        try {
            validate(params.config());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, e.getMessage());
        }
        WebhookConfig webhook = params.config().webhook();
        String url = webhook.url();
        if (params.recipient().type() == RecipientType.WEBHOOK && !params.recipient().target().isBlank()) {
            if (!ChannelContent.isValidWebhookUrl(params.recipient().target())) {
                return DeliveryResult.failure(
                    NAME,
                    params.recipient(),
                    ErrorCode.INVALID_RECIPIENT,
                    "recipient is not a valid webhook url"
                );
            }
            url = params.recipient().target();
        }

        Map<String, String> headers = new LinkedHashMap<>(webhook.headers());
        if (!isBlank(webhook.authorization())) {
            headers.put("Authorization", webhook.authorization());
        }
        return sendJson(webhook.method(), url, headers, buildPayload(params), params.recipient());
    }

    ObjectNode buildPayload(SendParams params) {
        ObjectNode payload = newPayload();
        payload.put("event", EVENT);
        payload.put("timestamp", Instant.now().toString());
        payload.put("subject", params.subject());
        payload.put("body_html", params.html());
        payload.put("body_text", ChannelContent.plaintextOf(params));

        ObjectNode recipient = payload.putObject("recipient");
        recipient.put("type", params.recipient().type().name().toLowerCase(Locale.ROOT));
        recipient.put("target", params.recipient().target());
        recipient.put("name", params.recipient().name());

        ObjectNode newsletter = payload.putObject("newsletter");
        newsletter.put("delivery_id", params.deliveryId());
        newsletter.put("schedule_id", params.scheduleId());
        newsletter.put("schedule_name", params.metadata().scheduleName());
        newsletter.put("server_name", params.metadata().serverName());
        if (!params.metadata().unsubscribeUrl().isBlank()) {
            newsletter.put("unsubscribe_url", params.metadata().unsubscribeUrl());
        }
        return payload;
    }
}
