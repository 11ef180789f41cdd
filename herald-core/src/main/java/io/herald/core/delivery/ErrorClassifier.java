package io.herald.core.delivery;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Locale;

public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static ErrorCode fromHttpStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorCode.AUTH_FAILED;
        }
        if (status == 404) {
            return ErrorCode.RECIPIENT_NOT_FOUND;
        }
        if (status == 413) {
            return ErrorCode.CONTENT_TOO_LARGE;
        }
        if (status == 429) {
            return ErrorCode.RATE_LIMITED;
        }
        if (status >= 500 && status <= 599) {
            return ErrorCode.SERVER_ERROR;
        }
        return ErrorCode.UNKNOWN;
    }

    public static ErrorCode fromException(IOException error) {
        if (error instanceof SocketTimeoutException) {
            return ErrorCode.TIMEOUT;
        }
        if (error instanceof InterruptedIOException) {
            String message = lower(error.getMessage());
            return message.contains("timeout") ? ErrorCode.TIMEOUT : ErrorCode.CANCELLED;
        }
        // Refused connections, unknown hosts and dropped sockets all look the same to the caller.
        return ErrorCode.CONNECTION_FAILED;
    }

    /**
     * Maps SMTP failure text onto an error code. Providers do not agree on status codes, so the wording is used.
     */
    public static ErrorCode fromMailMessage(String message) {
        String text = lower(message);
        if (text.contains("auth")) {
            return ErrorCode.AUTH_FAILED;
        }
        if (text.contains("connect") || text.contains("refused")) {
            return ErrorCode.CONNECTION_FAILED;
        }
        if (text.contains("timeout") || text.contains("timed out") || text.contains("deadline")) {
            return ErrorCode.TIMEOUT;
        }
        if (text.contains("recipient") || text.contains("mailbox")) {
            return ErrorCode.RECIPIENT_NOT_FOUND;
        }
        if (text.contains("rate limit") || text.contains("limit")) {
            return ErrorCode.RATE_LIMITED;
        }
        if (text.contains("too large") || text.contains("size")) {
            return ErrorCode.CONTENT_TOO_LARGE;
        }
        return ErrorCode.UNKNOWN;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
