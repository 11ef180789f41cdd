package io.herald.core.delivery.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald.core.delivery.DeliveryMetadata;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.delivery.SendParams;
import io.herald.core.model.ChannelConfig;
import io.herald.core.model.Recipient;
import io.herald.core.model.WebhookConfig;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebhookChannelTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private WebhookChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        channel = new WebhookChannel(new OkHttpClient(), mapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostNewsletterEventWithHeaders() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));
        WebhookConfig config = new WebhookConfig(
            server.url("/hooks/newsletter").toString(),
            null,
            Map.of("X-Source", "herald"),
            "Bearer secret"
        );

        DeliveryResult result = channel.send(params(Recipient.user("u1"), ChannelConfig.ofWebhook(config)));

        assertThat(result.success()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/newsletter");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        assertThat(request.getHeader("X-Source")).isEqualTo("herald");
        assertThat(request.getHeader("User-Agent")).isEqualTo("Herald/1.0");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");

        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("event").asText()).isEqualTo("newsletter.delivery");
        assertThat(body.path("subject").asText()).isEqualTo("This week");
        assertThat(body.path("body_html").asText()).isEqualTo("<p>Two new movies</p>");
        assertThat(body.path("body_text").asText()).isEqualTo("Two new movies");
        assertThat(body.path("recipient").path("type").asText()).isEqualTo("user");
        assertThat(body.path("newsletter").path("delivery_id").asText()).isEqualTo("d-1");
        assertThat(body.path("newsletter").path("schedule_id").asText()).isEqualTo("s-1");
        assertThat(body.path("newsletter").path("unsubscribe_url").asText()).isEqualTo("https://media.example.com/unsubscribe");
    }

    @Test
    void webhookRecipientShouldOverrideTheConfiguredUrl() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));
        WebhookConfig config = new WebhookConfig("https://unused.example.com/hook", "put", null, null);

        DeliveryResult result = channel.send(params(
            Recipient.webhook(server.url("/personal").toString()),
            ChannelConfig.ofWebhook(config)
        ));

        assertThat(result.success()).isTrue();
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/personal");
        assertThat(request.getMethod()).isEqualTo("PUT");
    }

    @Test
    void shouldClassifyHttpFailuresAndKeepRetryAfter() {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7").setBody("slow down"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("maintenance"));
        server.enqueue(new MockResponse().setResponseCode(401).setBody("nope"));
        ChannelConfig config = ChannelConfig.ofWebhook(new WebhookConfig(server.url("/h").toString(), null, null, null));

        DeliveryResult limited = channel.send(params(Recipient.user("u1"), config));
        DeliveryResult unavailable = channel.send(params(Recipient.user("u1"), config));
        DeliveryResult denied = channel.send(params(Recipient.user("u1"), config));

        assertThat(limited.errorCode()).isEqualTo(ErrorCode.RATE_LIMITED);
        assertThat(limited.retryAfter()).isEqualTo(Duration.ofSeconds(7));
        assertThat(limited.retryable()).isTrue();
        assertThat(limited.errorMessage()).isEqualTo("HTTP 429: slow down");
        assertThat(unavailable.errorCode()).isEqualTo(ErrorCode.SERVER_ERROR);
        assertThat(denied.errorCode()).isEqualTo(ErrorCode.AUTH_FAILED);
        assertThat(denied.retryable()).isFalse();
    }

    @Test
    void shouldReportUnreachableEndpointsAsConnectionFailures() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String url = closed.url("/gone").toString();
        closed.shutdown();

        DeliveryResult result = channel.send(params(
            Recipient.user("u1"),
            ChannelConfig.ofWebhook(new WebhookConfig(url, null, null, null))
        ));

        assertThat(result.success()).isFalse();
        assertThat(result.errorCode()).isEqualTo(ErrorCode.CONNECTION_FAILED);
        assertThat(result.transientFailure()).isTrue();
    }

    @Test
    void shouldRejectBadConfigurationWithoutCallingOut() {
        DeliveryResult missing = channel.send(params(Recipient.user("u1"), ChannelConfig.empty()));
        DeliveryResult badRecipient = channel.send(params(
            Recipient.webhook("not a url"),
            ChannelConfig.ofWebhook(new WebhookConfig("https://example.com/hook", null, null, null))
        ));

        assertThat(missing.errorCode()).isEqualTo(ErrorCode.INVALID_CONFIG);
        assertThat(badRecipient.errorCode()).isEqualTo(ErrorCode.INVALID_RECIPIENT);
        assertThat(server.getRequestCount()).isZero();
        assertThatThrownBy(() -> channel.validate(
            ChannelConfig.ofWebhook(new WebhookConfig("https://example.com/hook", "DELETE", null, null))
        )).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("POST or PUT");
    }

    @Test
    void retryAfterShouldAcceptSecondsAndHttpDates() {
        Instant now = Instant.parse("2026-01-15T10:00:00Z");

        assertThat(AbstractHttpChannel.parseRetryAfter("30", now)).isEqualTo(Duration.ofSeconds(30));
        assertThat(AbstractHttpChannel.parseRetryAfter("Thu, 15 Jan 2026 10:01:00 GMT", now)).isEqualTo(Duration.ofMinutes(1));
        assertThat(AbstractHttpChannel.parseRetryAfter("Thu, 15 Jan 2026 09:00:00 GMT", now)).isNull();
        assertThat(AbstractHttpChannel.parseRetryAfter("soon", now)).isNull();
        assertThat(AbstractHttpChannel.parseRetryAfter(null, now)).isNull();
    }

    private static SendParams params(Recipient recipient, ChannelConfig config) {
        return new SendParams(
            "d-1",
            "s-1",
            recipient,
            "This week",
            "<p>Two new movies</p>",
            "",
            config,
            new DeliveryMetadata("Weekly", "Media Server", "https://media.example.com/unsubscribe")
        );
    }
}
