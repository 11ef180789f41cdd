package io.herald.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.herald.core.content.ContentData;
import io.herald.core.content.DateRange;
import io.herald.core.model.ContentType;
import io.herald.core.model.NewsletterTemplate;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QuteTemplateRendererTest {
    private final QuteTemplateRenderer renderer = new QuteTemplateRenderer();

    @Test
    void shouldRenderSubjectAndBodiesFromContent() throws Exception {
        NewsletterTemplate template = template(
            "{server_name} digest for {date_range_display}",
            "<h1>{server_name}</h1><ul>{#for movie in new_movies}<li>{movie.title} ({movie.year})</li>{/for}</ul>",
            "{#for movie in new_movies}[{movie.title}]{/for}"
        );

        RenderedContent rendered = renderer.render(template, content(Map.of(
            "new_movies", List.of(Map.of("title", "Heat", "year", 1995), Map.of("title", "Alien", "year", 1979))
        )));

        assertThat(rendered.subject()).isEqualTo("Media & Co digest for March 8 - 15, 2026");
        assertThat(rendered.html()).isEqualTo("<h1>Media &amp; Co</h1><ul><li>Heat (1995)</li><li>Alien (1979)</li></ul>");
        assertThat(rendered.text()).isEqualTo("[Heat][Alien]");
        assertThat(rendered.bodySize()).isEqualTo(rendered.html().length());
    }

    @Test
    void shouldEscapeOnlyInHtmlAndHonourRawValues() throws Exception {
        Map<String, Object> model = Map.of("title", "<b>Tom & Jerry</b>");

        assertThat(renderer.render("html", "{title}|{title.raw}", model, true))
            .isEqualTo("&lt;b&gt;Tom &amp; Jerry&lt;/b&gt;|<b>Tom & Jerry</b>");
        assertThat(renderer.render("text", "{title}", model, false)).isEqualTo("<b>Tom & Jerry</b>");
    }

    @Test
    void shouldSupportConditionsNestedPathsAndComments() throws Exception {
        Map<String, Object> model = Map.of(
            "new_shows", List.of(),
            "stats", Map.of("total_plays", 12, "top_user", Map.of("name", "ana")),
            "tags", List.of("drama", "crime")
        );

        String out = renderer.render(
            "body",
            "{! header !}{#if new_shows}Shows!{#else}No new shows.{/if} Plays: {stats.total_plays} by {stats.top_user.name}."
                + " {#for tag in tags}[{tag}]{/for}{missing.path}",
            model,
            false
        );

        assertThat(out).isEqualTo("No new shows. Plays: 12 by ana. [drama][crime]");
    }

    @Test
    void loopBodyShouldSeeOuterNames() throws Exception {
        Map<String, Object> model = Map.of(
            "server_name", "Home",
            "items", List.of(Map.of("title", "Heat"))
        );

        assertThat(renderer.render("body", "{#for item in items}{item.title}@{server_name}{/for}", model, false))
            .isEqualTo("Heat@Home");
    }

    @Test
    void missingNamesShouldRenderEmptyEvenInHtml() throws Exception {
        assertThat(renderer.render("html", "<p>{nothing}</p>{#if nothing}x{/if}", Map.of(), true))
            .isEqualTo("<p></p>");
    }

    @Test
    void shouldDeriveTextBodyFromHtmlWhenMissing() throws Exception {
        RenderedContent rendered = renderer.render(
            template("Hello", "<p>Welcome to <b>{server_name}</b></p>", ""),
            content(Map.of())
        );

        assertThat(rendered.text()).isEqualTo("Welcome to Media & Co");
    }

    @Test
    void shouldRejectMalformedTemplates() {
        assertThatThrownBy(() -> renderer.render("body", "{#if items}open", Map.of(), false))
            .isInstanceOf(TemplateRenderException.class)
            .hasMessageStartingWith("cannot parse body");
        assertThatThrownBy(() -> renderer.render("body", "{#for item in items}x{/if}", Map.of(), false))
            .isInstanceOf(TemplateRenderException.class)
            .hasMessageStartingWith("cannot parse body");
        assertThatThrownBy(() -> renderer.render("html body", "hello {name", Map.of(), true))
            .isInstanceOf(TemplateRenderException.class)
            .hasMessageStartingWith("cannot parse html body");
    }

    @Test
    void shouldRejectEmptySubjectOrBody() {
        assertThatThrownBy(() -> renderer.render(template("{missing}", "<p>x</p>", ""), content(Map.of())))
            .isInstanceOf(TemplateRenderException.class)
            .hasMessageContaining("empty subject");
        assertThatThrownBy(() -> renderer.render(template("Hi", "", "{missing}"), content(Map.of())))
            .hasMessageContaining("empty body");
    }

    private static NewsletterTemplate template(String subject, String html, String text) {
        return new NewsletterTemplate("t-1", "Weekly", ContentType.WEEKLY_DIGEST, subject, html, text, null, 1, true);
    }

    private static ContentData content(Map<String, Object> sections) {
        return new ContentData(
            "Media & Co",
            "http://media:8096",
            "",
            "",
            Instant.parse("2026-03-15T09:00:00Z"),
            new DateRange(Instant.parse("2026-03-08T09:00:00Z"), Instant.parse("2026-03-15T09:00:00Z"), "March 8 - 15, 2026"),
            sections,
            List.of()
        );
    }
}
