package io.herald.core.delivery.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.delivery.DeliveryChannel;
import io.herald.core.delivery.DeliveryResult;
import io.herald.core.delivery.ErrorClassifier;
import io.herald.core.delivery.ErrorCode;
import io.herald.core.model.Recipient;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for channels that deliver by sending one JSON document over HTTP.
 */
public abstract class AbstractHttpChannel implements DeliveryChannel {
    private static final Logger LOG = LoggerFactory.getLogger(AbstractHttpChannel.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final int ERROR_SNIPPET_LENGTH = 200;

    private final OkHttpClient client;
    protected final ObjectMapper mapper;

    protected AbstractHttpChannel(OkHttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    protected DeliveryResult sendJson(
        String method,
        String url,
        Map<String, String> headers,
        ObjectNode payload,
        Recipient recipient
    ) {
        HttpUrl httpUrl = url == null ? null : HttpUrl.parse(url);
        if (httpUrl == null) {
            return DeliveryResult.failure(name(), recipient, ErrorCode.INVALID_CONFIG, "invalid endpoint url");
        }

        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return DeliveryResult.failure(name(), recipient, ErrorCode.UNKNOWN, "failed to encode payload: " + e.getMessage());
        }

        Request.Builder builder = new Request.Builder()
            .url(httpUrl)
            .method(method, RequestBody.create(body, JSON))
            .header("User-Agent", "Herald/1.0");
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        try (Response response = client.newCall(builder.build()).execute()) {
            if (response.isSuccessful()) {
                return DeliveryResult.success(name(), recipient);
            }
            String raw = response.body() == null ? "" : response.body().string();
            ErrorCode code = classifyStatus(response.code(), raw);
            LOG.debug("{} endpoint {} answered {} ({})", name(), httpUrl.host(), response.code(), code);
            DeliveryResult failure = DeliveryResult.failure(
                name(),
                recipient,
                code,
                "HTTP " + response.code() + ": " + snippet(raw)
            );
            Duration retryAfter = parseRetryAfter(response.header("Retry-After"), Instant.now());
            return retryAfter == null ? failure : failure.withRetryAfter(retryAfter);
        } catch (IOException e) {
            ErrorCode code = ErrorClassifier.fromException(e);
            return DeliveryResult.failure(name(), recipient, code, name() + " request failed: " + e.getMessage());
        }
    }

    protected ErrorCode classifyStatus(int status, String body) {
        return ErrorClassifier.fromHttpStatus(status);
    }

    protected ObjectNode newPayload() {
        return mapper.createObjectNode();
    }

    static Duration parseRetryAfter(String header, Instant now) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException ignored) {
            // fall through to the HTTP-date form
        }
        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(now, at);
            return wait.isNegative() || wait.isZero() ? null : wait;
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparseable Retry-After header '{}'", value);
            return null;
        }
    }

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String snippet(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        return trimmed.length() <= ERROR_SNIPPET_LENGTH ? trimmed : trimmed.substring(0, ERROR_SNIPPET_LENGTH) + "...";
    }
}
