package io.herald.core.delivery.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.SlackConfig;
import java.util.Map;
import okhttp3.OkHttpClient;

public final class SlackChannel extends AbstractHttpChannel {
    public static final String NAME = "slack";
    static final String DEFAULT_USERNAME = "Newsletter";
    static final String DEFAULT_ICON = ":newspaper:";
    private static final int MAX_SECTION_TEXT = 3000;
    private static final int MAX_HEADER_TEXT = 150;

    public SlackChannel(OkHttpClient client, ObjectMapper mapper) {
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
        return MAX_SECTION_TEXT;
    }

    @Override
    public void validate(ChannelConfig config) {
        SlackConfig slack = config == null ? null : config.slack();
        if (slack == null || isBlank(slack.webhookUrl())) {
            throw new IllegalArgumentException("slack webhook url is required");
        }
        if (!ChannelContent.isValidWebhookUrl(slack.webhookUrl())) {
            throw new IllegalArgumentException("slack webhook url must be an http(s) url");
        }
    }

    @Override
    public DeliveryResult send(SendParams params) {
        try {
            validate(params.config());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, e.getMessage());
        }
        return sendJson("POST", params.config().slack().webhookUrl(), Map.of(), buildPayload(params), params.recipient());
    }

    ObjectNode buildPayload(SendParams params) {
        SlackConfig slack = params.config().slack();
        String serverName = params.metadata().serverName();

        ObjectNode payload = newPayload();
        if (slack != null && !isBlank(slack.channel())) {
            payload.put("channel", slack.channel());
        }
        if (slack != null && !isBlank(slack.username())) {
            payload.put("username", slack.username());
        } else {
            payload.put("username", serverName.isBlank() ? DEFAULT_USERNAME : serverName);
        }
        payload.put("icon_emoji", slack != null && !isBlank(slack.iconEmoji()) ? slack.iconEmoji() : DEFAULT_ICON);
        payload.put("text", params.subject());

        ArrayNode blocks = payload.putArray("blocks");
        ObjectNode header = blocks.addObject();
        header.put("type", "header");
        ObjectNode headerText = header.putObject("text");
        headerText.put("type", "plain_text");
        headerText.put("text", ChannelContent.truncate(params.subject(), MAX_HEADER_TEXT));

        ObjectNode section = blocks.addObject();
        section.put("type", "section");
        ObjectNode sectionText = section.putObject("text");
        sectionText.put("type", "mrkdwn");
        sectionText.put("text", toMrkdwn(ChannelContent.formatFor(this, params)));

        if (!serverName.isBlank()) {
            ObjectNode context = blocks.addObject();
            context.put("type", "context");
            ObjectNode element = context.putArray("elements").addObject();
            element.put("type", "mrkdwn");
            element.put("text", "From *" + serverName + "*");
        }
        return payload;
    }

    static String toMrkdwn(String text) {
        return text == null ? "" : text.replace("\r\n", "\n");
    }
}
