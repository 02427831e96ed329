package io.streamwire.websocket.exception;

import java.time.Duration;

/**
 * Raised when a bounded wait elapses.
 */
public class WebSocketTimeoutException extends WebSocketException {

    private final String operation;
    private final Duration timeout;

    public WebSocketTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
