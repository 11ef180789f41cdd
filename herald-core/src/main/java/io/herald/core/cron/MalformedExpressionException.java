package io.herald.core.cron;

public class MalformedExpressionException extends IllegalArgumentException {

    public MalformedExpressionException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
    }
}
