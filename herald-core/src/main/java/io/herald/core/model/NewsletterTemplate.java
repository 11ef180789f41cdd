package io.herald.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record NewsletterTemplate(
    String id,
    String name,
    ContentType type,
    String subject,
    String bodyHtml,
    String bodyText,
    TemplateConfig defaultConfig,
    int version,
    boolean active
) {

    public NewsletterTemplate {
        type = type == null ? ContentType.CUSTOM : type;
        subject = subject == null ? "" : subject;
        bodyHtml = bodyHtml == null ? "" : bodyHtml;
        bodyText = bodyText == null ? "" : bodyText;
        version = Math.max(version, 1);
    }
}
