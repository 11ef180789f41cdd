package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-channel transport settings attached to a schedule. Only the section matching the channel is read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelConfig(
    SmtpConfig smtp,
    DiscordConfig discord,
    SlackConfig slack,
    TelegramConfig telegram,
    WebhookConfig webhook
) {

    public static ChannelConfig empty() {
        return new ChannelConfig(null, null, null, null, null);
    }

    public static ChannelConfig ofSmtp(SmtpConfig smtp) {
        return new ChannelConfig(smtp, null, null, null, null);
    }

    public static ChannelConfig ofDiscord(DiscordConfig discord) {
        return new ChannelConfig(null, discord, null, null, null);
    }

    public static ChannelConfig ofSlack(SlackConfig slack) {
        return new ChannelConfig(null, null, slack, null, null);
    }

    public static ChannelConfig ofTelegram(TelegramConfig telegram) {
        return new ChannelConfig(null, null, null, telegram, null);
    }

    public static ChannelConfig ofWebhook(WebhookConfig webhook) {
        return new ChannelConfig(null, null, null, null, webhook);
    }
}
