package io.herald.core.template;

public record RenderedContent(String subject, String html, String text) {

    public RenderedContent {
        subject = subject == null ? "" : subject;
        html = html == null ? "" : html;
        text = text == null ? "" : text;
    }

    public int bodySize() {
        return Math.max(html.length(), text.length());
    }
}
