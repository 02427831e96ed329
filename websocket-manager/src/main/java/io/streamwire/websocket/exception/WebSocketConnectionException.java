package io.streamwire.websocket.exception;

/**
 * Raised when a connection cannot be established and no automatic retry will follow.
 */
public class WebSocketConnectionException extends WebSocketException {

    private final String url;
    private final int attempts;

    public WebSocketConnectionException(String url, int attempts, Throwable cause) {
        super("Failed to connect to " + url + " after " + attempts + " attempt(s)"
            + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
