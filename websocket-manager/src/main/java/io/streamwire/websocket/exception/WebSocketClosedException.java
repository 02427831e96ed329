package io.streamwire.websocket.exception;

/**
 * Raised when an operation needs a live connection and there is none.
 */
public class WebSocketClosedException extends WebSocketException {

    /** Close code for a connection that ended without a close frame. */
    public static final int ABNORMAL_CLOSURE = 1006;

    private final int code;
    private final String reason;

    public WebSocketClosedException(String message) {
        this(message, ABNORMAL_CLOSURE, "");
    }

    public WebSocketClosedException(String message, int code, String reason) {
        super(message);
        this.code = code;
        this.reason = reason == null ? "" : reason;
    }

    public WebSocketClosedException(String message, int code, String reason, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.reason = reason == null ? "" : reason;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }
}
