package io.herald.core.delivery;

import io.herald.core.model.Recipient;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record DeliveryResult(
    String channel,
    Recipient recipient,
    boolean success,
    ErrorCode errorCode,
    String errorMessage,
    boolean transientFailure,
    Duration retryAfter,
    int attempts,
    Instant completedAt
) {

    public DeliveryResult {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(recipient, "recipient must not be null");
        errorCode = errorCode == null ? (success ? ErrorCode.NONE : ErrorCode.UNKNOWN) : errorCode;
        errorMessage = errorMessage == null ? "" : errorMessage;
        attempts = Math.max(attempts, 1);
        completedAt = completedAt == null ? Instant.now() : completedAt;
    }

    public static DeliveryResult success(String channel, Recipient recipient) {
        return new DeliveryResult(channel, recipient, true, ErrorCode.NONE, "", false, null, 1, null);
    }

    public static DeliveryResult failure(String channel, Recipient recipient, ErrorCode code, String message) {
        return new DeliveryResult(channel, recipient, false, code, message, code.isTransient(), null, 1, null);
    }

    public DeliveryResult withRetryAfter(Duration hint) {
        return new DeliveryResult(
            channel, recipient, success, errorCode, errorMessage, transientFailure, hint, attempts, completedAt
        );
    }

    public DeliveryResult finish(int attemptCount, Instant at) {
        return new DeliveryResult(
            channel, recipient, success, errorCode, errorMessage, transientFailure, retryAfter, attemptCount, at
        );
    }

    public boolean retryable() {
        return !success && transientFailure && errorCode.retryable();
    }
}
