package io.herald.core.delivery;

public enum ErrorCode {
    NONE(false),
    UNKNOWN(false),
    INVALID_CONFIG(false),
    INVALID_RECIPIENT(false),
    CONNECTION_FAILED(true),
    TIMEOUT(true),
    AUTH_FAILED(false),
    RATE_LIMITED(true),
    CONTENT_TOO_LARGE(false),
    RECIPIENT_NOT_FOUND(false),
    RECIPIENT_OPTED_OUT(false),
    SERVER_ERROR(true),
    CANCELLED(true);

    private final boolean transientFailure;

    ErrorCode(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    // Cancelled units are transient for reporting but never worth another attempt.
    public boolean retryable() {
        return transientFailure && this != CANCELLED;
    }
}
