package io.streamwire.websocket.exception;

/**
 * Base class for errors surfaced by the connection manager.
 */
public class WebSocketException extends RuntimeException {

    public WebSocketException(String message) {
        super(message);
    }

    public WebSocketException(String message, Throwable cause) {
        super(message, cause);
    }
}
