package io.herald.core.template;

import io.herald.core.content.ContentData;
import io.herald.core.delivery.ChannelContent;
import io.herald.core.model.NewsletterTemplate;
import io.quarkus.qute.Engine;
import io.quarkus.qute.Expression;
import io.quarkus.qute.HtmlEscaper;
import io.quarkus.qute.ResultMapper;
import io.quarkus.qute.Results;
import io.quarkus.qute.Template;
import io.quarkus.qute.TemplateException;
import io.quarkus.qute.TemplateInstance;
import io.quarkus.qute.TemplateNode.Origin;
import io.quarkus.qute.ValueResolvers;
import io.quarkus.qute.Variant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders newsletter templates with Qute.
 *
 * <p>Templates use Qute syntax: {@code {server_name}}, {@code {stats.total_plays}},
 * {@code {#for movie in new_movies}...{/for}}, {@code {#if new_shows}...{#else}...{/if}} and
 * {@code {title.raw}}. Values are HTML-escaped only in the HTML body; names that resolve to nothing render
 * as empty text and are falsy in conditions. Loops over a section that may be absent need
 * {@code {#for movie in new_movies.orEmpty}}.
 */
public final class QuteTemplateRenderer implements TemplateRenderer {
    private static final Variant HTML = Variant.forContentType(Variant.TEXT_HTML);
    private static final Variant TEXT = Variant.forContentType("text/plain");

    private final Engine engine;

    public QuteTemplateRenderer() {
        this.engine = Engine.builder()
            .addDefaults()
            .addValueResolver(ValueResolvers.rawResolver())
            .addValueResolver(ValueResolvers.orEmpty())
            .addResultMapper(new HtmlEscaper(List.of(Variant.TEXT_HTML)))
            .addResultMapper(new MissingValueMapper())
            .strictRendering(false)
            .build();
    }

    @Override
    public RenderedContent render(NewsletterTemplate template, ContentData content) throws TemplateRenderException {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Map<String, Object> model = content.toModel();

        String subject = render("subject", template.subject(), model, false).trim();
        if (subject.isEmpty()) {
            throw new TemplateRenderException("template " + template.id() + " rendered an empty subject");
        }
        String html = render("html body", template.bodyHtml(), model, true);
        String text = render("text body", template.bodyText(), model, false);
        if (text.isBlank() && !html.isBlank()) {
            text = ChannelContent.htmlToPlaintext(html);
        }
        if (html.isBlank() && text.isBlank()) {
            throw new TemplateRenderException("template " + template.id() + " rendered an empty body");
        }
        return new RenderedContent(subject, html, text);
    }

    public String render(String label, String source, Map<String, Object> model, boolean escapeHtml)
        throws TemplateRenderException {
        if (source == null || source.isEmpty()) {
            return "";
        }
        Template parsed;
        try {
            parsed = engine.parse(source, escapeHtml ? HTML : TEXT);
        } catch (TemplateException e) {
            throw new TemplateRenderException("cannot parse " + label + ": " + e.getMessage(), e);
        }
        TemplateInstance instance = parsed.instance();
        for (Map.Entry<String, Object> entry : model.entrySet()) {
            instance.data(entry.getKey(), entry.getValue());
        }
        try {
            return instance.render();
        } catch (TemplateException e) {
            throw new TemplateRenderException("cannot render " + label + ": " + e.getMessage(), e);
        }
    }

    private static final class MissingValueMapper implements ResultMapper {

        // Must run before the HTML escaper.
        @Override
        public int getPriority() {
            return 10;
        }

        @Override
        public boolean appliesTo(Origin origin, Object result) {
            return Results.isNotFound(result);
        }

        @Override
        public String map(Object result, Expression expression) {
            return "";
        }
    }
}
