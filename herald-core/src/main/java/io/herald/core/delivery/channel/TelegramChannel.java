package io.herald.core.delivery.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.delivery.ChannelContent;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorClassifier;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.TelegramConfig;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import okhttp3.OkHttpClient;

public final class TelegramChannel extends AbstractHttpChannel {
    public static final String NAME = "telegram";
    public static final String DEFAULT_API_BASE = "https://api.telegram.org";
    static final String PARSE_MODE_HTML = "HTML";
    static final String PARSE_MODE_MARKDOWN_V2 = "MarkdownV2";
    private static final int MAX_MESSAGE = 4096;
    private static final Pattern BOT_TOKEN = Pattern.compile("^\\d+:[A-Za-z0-9_-]+$");
    private static final String MARKDOWN_V2_SPECIALS = "_*[]()~`>#+-=|{}.!\\";

    private final String apiBase;

    public TelegramChannel(OkHttpClient client, ObjectMapper mapper) {
        this(client, mapper, DEFAULT_API_BASE);
    }

    public TelegramChannel(OkHttpClient client, ObjectMapper mapper, String apiBase) {
        super(client, mapper);
        this.apiBase = apiBase == null || apiBase.isBlank() ? DEFAULT_API_BASE : apiBase.replaceAll("/+$", "");
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
        return MAX_MESSAGE;
    }

    @Override
    public void validate(ChannelConfig config) {
        TelegramConfig telegram = config == null ? null : config.telegram();
        if (telegram == null || isBlank(telegram.botToken())) {
            throw new IllegalArgumentException("telegram bot token is required");
        }
        if (isBlank(telegram.chatId())) {
            throw new IllegalArgumentException("telegram chat id is required");
        }
        if (!BOT_TOKEN.matcher(telegram.botToken().trim()).matches()) {
            throw new IllegalArgumentException("telegram bot token has an invalid format");
        }
    }

    @Override
    public DeliveryResult send(SendParams params) {
        try {
            validate(params.config());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.failure(NAME, params.recipient(), ErrorCode.INVALID_CONFIG, e.getMessage());
        }
        String url = apiBase + "/bot" + params.config().telegram().botToken().trim() + "/sendMessage";
        return sendJson("POST", url, Map.of(), buildMessage(params), params.recipient());
    }

    @Override
    protected ErrorCode classifyStatus(int status, String body) {
        return classify(status, describe(body));
    }

    ObjectNode buildMessage(SendParams params) {
        TelegramConfig telegram = params.config().telegram();
        String parseMode = parseMode(telegram);
        String subject = params.subject();
        String body = ChannelContent.plaintextOf(params);
        String serverName = params.metadata().serverName();

        String text;
        if (PARSE_MODE_HTML.equals(parseMode)) {
            text = "<b>" + escapeHtml(subject) + "</b>\n\n" + escapeHtml(body);
            if (!serverName.isBlank()) {
                text += "\n\n<i>From " + escapeHtml(serverName) + "</i>";
            }
        } else if (PARSE_MODE_MARKDOWN_V2.equals(parseMode)) {
            text = "*" + escapeMarkdownV2(subject) + "*\n\n" + escapeMarkdownV2(body);
            if (!serverName.isBlank()) {
                text += "\n\n_From " + escapeMarkdownV2(serverName) + "_";
            }
        } else {
            text = subject + "\n\n" + body;
            if (!serverName.isBlank()) {
                text += "\n\nFrom " + serverName;
            }
        }

        ObjectNode message = newPayload();
        message.put("chat_id", telegram == null ? "" : telegram.chatId());
        message.put("text", ChannelContent.truncate(text, MAX_MESSAGE));
        if (!parseMode.isEmpty()) {
            message.put("parse_mode", parseMode);
        }
        message.put("disable_web_page_preview", true);
        return message;
    }

    static ErrorCode classify(int status, String description) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (status == 400) {
            if (text.contains("chat not found")) {
                return ErrorCode.RECIPIENT_NOT_FOUND;
            }
            if (text.contains("blocked") || text.contains("deactivated")) {
                return ErrorCode.RECIPIENT_OPTED_OUT;
            }
            return ErrorCode.INVALID_CONFIG;
        }
        if (status == 403) {
            return ErrorCode.RECIPIENT_OPTED_OUT;
        }
        return ErrorClassifier.fromHttpStatus(status);
    }

    static String escapeHtml(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String escapeMarkdownV2(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length() + 16);
        for (char c : value.toCharArray()) {
            if (MARKDOWN_V2_SPECIALS.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static String parseMode(TelegramConfig telegram) {
        String configured = telegram == null ? null : telegram.parseMode();
        if (configured == null || configured.isBlank()) {
            return PARSE_MODE_HTML;
        }
        if ("plain".equalsIgnoreCase(configured.trim())) {
            return "";
        }
        if (PARSE_MODE_MARKDOWN_V2.equalsIgnoreCase(configured.trim())) {
            return PARSE_MODE_MARKDOWN_V2;
        }
        return PARSE_MODE_HTML;
    }

    private String describe(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node.path("description").asText("");
        } catch (Exception e) {
            return body;
        }
    }
}
