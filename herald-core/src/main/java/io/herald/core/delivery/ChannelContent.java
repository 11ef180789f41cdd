package io.herald.core.delivery;

import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;

public final class ChannelContent {
    private static final String ELLIPSIS = "...";

    private ChannelContent() {
    }

    /**
     * Cuts {@code text} to at most {@code maxLength} characters, ending with an ellipsis when there is room for
     * one. A non-positive limit leaves the text untouched.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    public static String htmlToPlaintext(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text().replace('\u00A0', ' ').trim();
    }

    /**
     * Picks the body variant the channel can display and fits it to the channel's length limit.
     */
    public static String formatFor(DeliveryChannel channel, SendParams params) {
        String body;
        if (channel.supportsHtml() && !params.html().isBlank()) {
            body = params.html();
        } else if (!params.text().isBlank()) {
            body = params.text();
        } else {
            body = htmlToPlaintext(params.html());
        }
        return truncate(body, channel.maxContentLength());
    }

    public static String plaintextOf(SendParams params) {
        return params.text().isBlank() ? htmlToPlaintext(params.html()) : params.text();
    }

    public static boolean isValidEmail(String address) {
        if (address == null || address.isBlank() || !address.contains("@")) {
            return false;
        }
        try {
            new InternetAddress(address.trim(), true).validate();
            return true;
        } catch (AddressException e) {
            return false;
        }
    }

    public static boolean isValidWebhookUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        return parsed != null && !parsed.host().isBlank();
    }
}
