package io.herald.core.content;

public class ContentResolutionException extends Exception {

    public ContentResolutionException(String message) {
        super(message);
    }

    public ContentResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
